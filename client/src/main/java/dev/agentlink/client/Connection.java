package dev.agentlink.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.agentlink.client.transport.TransportFactory;
import dev.agentlink.protocol.Capability;
import dev.agentlink.protocol.CorrelationTable;
import dev.agentlink.protocol.Envelope;
import dev.agentlink.protocol.EnvelopeCodec;
import dev.agentlink.protocol.ErrorCode;
import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.McpException;
import dev.agentlink.protocol.McpMethod;
import dev.agentlink.protocol.PendingCall;
import dev.agentlink.protocol.model.Capabilities;
import dev.agentlink.protocol.model.InitializeResult;
import dev.agentlink.protocol.model.PeerInfo;
import dev.agentlink.protocol.model.Prompt;
import dev.agentlink.protocol.model.Resource;
import dev.agentlink.protocol.model.Tool;
import dev.agentlink.transport.Transport;
import dev.agentlink.transport.TransportException;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live session with one server: the transport, the reader thread draining it, the table of
 * requests awaiting responses and what discovery found.
 *
 * <p>A connection is used once. {@link #open()} drives it from {@link ConnectionState#DISCONNECTED}
 * to {@link ConnectionState#READY}; teardown, explicit or caused by the peer going away, returns
 * it to {@code DISCONNECTED} for good.
 */
public class Connection implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);

    private static final long READER_JOIN_MILLIS = 1000;

    /**
     * Callbacks into the owner of the connection. Both run on the reader thread or on the thread
     * tearing the connection down.
     */
    public interface Listener {

        void onNotification(Connection connection, String method, JsonNode params);

        void onClosed(Connection connection);
    }

    private final String serverName;
    private final ServerConfig config;
    private final TransportFactory transportFactory;
    private final PeerInfo clientInfo;
    private final JsonNode clientCapabilities;
    private final Map<String, RequestHandler> requestHandlers;
    private final Listener listener;

    private final CorrelationTable calls = new CorrelationTable();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean tornDown = new AtomicBoolean();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Transport transport;
    private volatile Thread reader;
    private volatile InitializeResult serverInit;
    private volatile List<Tool> tools = List.of();
    private volatile List<Resource> resources = List.of();
    private volatile List<Prompt> prompts = List.of();

    public Connection(String serverName, ServerConfig config, TransportFactory transportFactory, PeerInfo clientInfo,
        JsonNode clientCapabilities, Map<String, RequestHandler> requestHandlers, Listener listener) {
        this.serverName = serverName;
        this.config = config;
        this.transportFactory = transportFactory;
        this.clientInfo = clientInfo;
        this.clientCapabilities = clientCapabilities == null ? Json.object() : clientCapabilities;
        this.requestHandlers = requestHandlers;
        this.listener = listener;
    }

    /**
     * Opens the transport, performs the handshake and discovers what the server advertises.
     *
     * @throws McpException with {@link ErrorCode#CONNECT_FAILED} when the transport cannot be
     *     opened or the server rejects {@code initialize}, {@link ErrorCode#TIMEOUT} when it does not
     *     answer within the connect timeout; the connection is torn down in every failure case
     * @throws IllegalStateException when the connection was opened before
     */
    public void open() throws McpException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Connection to " + serverName + " was already opened");
        }
        try {
            transition(ConnectionState.CONNECTING);
            try {
                transport = transportFactory.open(serverName, config);
            } catch (TransportException e) {
                throw new McpException(ErrorCode.CONNECT_FAILED,
                    "Failed to connect to " + serverName + " at " + config.describe() + ": " + e.getMessage(), e);
            }
            startReader();

            transition(ConnectionState.AWAITING_INIT_RESPONSE);
            JsonNode initResult;
            try {
                initResult = request(McpMethod.INITIALIZE.wireName(), initializeParams(), config.connectTimeout());
            } catch (McpException e) {
                if (e.getErrorCode() == ErrorCode.TIMEOUT) {
                    throw e;
                }
                throw new McpException(ErrorCode.CONNECT_FAILED,
                    "Server " + serverName + " rejected initialize: " + e.getMessage(), e);
            }
            try {
                serverInit = Json.convert(initResult, InitializeResult.class);
            } catch (IllegalArgumentException e) {
                throw new McpException(ErrorCode.CONNECT_FAILED,
                    "Server " + serverName + " sent an unreadable initialize result", e);
            }
            LOGGER.info("Server {} is {} speaking {}", serverName,
                serverInit.serverInfo() == null ? "unnamed" : serverInit.serverInfo().displayLabel(),
                serverInit.protocolVersion());

            transition(ConnectionState.AWAITING_INITIALIZED_ACK);
            sendNotification(McpMethod.INITIALIZED.wireName(), null);

            transition(ConnectionState.DISCOVERING);
            discover();

            transition(ConnectionState.READY);
            LOGGER.info("Connection to {} is ready: {} tools, {} resources, {} prompts", serverName,
                tools.size(), resources.size(), prompts.size());
        } catch (McpException | RuntimeException e) {
            teardown("connect failed");
            throw e;
        }
    }

    /**
     * Sends a request and waits for its response.
     *
     * @return the {@code result} member of the response
     * @throws McpException carrying the server's error for an error response,
     *     {@link ErrorCode#TIMEOUT} when no response arrives in time (the connection stays open),
     *     {@link ErrorCode#CONNECTION_CLOSED} when the connection is or goes down
     */
    public JsonNode request(String method, JsonNode params, Duration timeout) throws McpException {
        Transport current = transport;
        if (current == null || tornDown.get()) {
            throw closed();
        }
        PendingCall call = calls.register();
        try {
            current.send(Envelope.request(call.id(), method, params));
        } catch (TransportException e) {
            calls.remove(call.id());
            if (e.isClosed()) {
                throw new McpException(ErrorCode.CONNECTION_CLOSED,
                    "Connection to " + serverName + " is closed", e);
            }
            throw new McpException(ErrorCode.TRANSPORT_FAILURE,
                "Failed to send " + method + " to " + serverName + ": " + e.getMessage(), e);
        }

        Envelope response;
        try {
            response = call.await(timeout);
        } catch (TimeoutException e) {
            calls.remove(call.id());
            throw new McpException(ErrorCode.TIMEOUT,
                "Request " + method + " to " + serverName + " timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof McpException failure) {
                throw new McpException(failure.getErrorCode(), failure.getMessage(), failure);
            }
            throw new McpException(ErrorCode.INTERNAL_ERROR, "Request " + method + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            calls.remove(call.id());
            throw new McpException(ErrorCode.INTERNAL_ERROR, "Interrupted while waiting for " + method, e);
        }

        if (response.error() != null) {
            throw McpException.fromRpcError(response.error());
        }
        return response.result();
    }

    public JsonNode request(String method, JsonNode params) throws McpException {
        return request(method, params, config.requestTimeout());
    }

    /**
     * Sends a notification. No response is expected.
     */
    public void sendNotification(String method, JsonNode params) throws McpException {
        Transport current = transport;
        if (current == null || tornDown.get()) {
            throw closed();
        }
        try {
            current.send(Envelope.notification(method, params));
        } catch (TransportException e) {
            throw new McpException(e.isClosed() ? ErrorCode.CONNECTION_CLOSED : ErrorCode.TRANSPORT_FAILURE,
                "Failed to send " + method + " to " + serverName + ": " + e.getMessage(), e);
        }
    }

    public void ping(Duration timeout) throws McpException {
        request(McpMethod.PING.wireName(), null, timeout);
    }

    public String serverName() {
        return serverName;
    }

    public ServerConfig config() {
        return config;
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isReady() {
        return state == ConnectionState.READY;
    }

    public Optional<PeerInfo> serverInfo() {
        InitializeResult init = serverInit;
        return init == null ? Optional.empty() : Optional.ofNullable(init.serverInfo());
    }

    public Capabilities serverCapabilities() {
        InitializeResult init = serverInit;
        return init == null ? Capabilities.none() : init.capabilities();
    }

    public List<Tool> tools() {
        return tools;
    }

    public List<Resource> resources() {
        return resources;
    }

    public List<Prompt> prompts() {
        return prompts;
    }

    /**
     * Number of requests still waiting for a response.
     */
    public int pendingCount() {
        return calls.size();
    }

    @Override
    public void close() {
        teardown("closed by client");
    }

    private ObjectNode initializeParams() {
        ObjectNode params = Json.object();
        params.put("protocolVersion", InitializeResult.PROTOCOL_VERSION);
        params.set("capabilities", clientCapabilities);
        params.set("clientInfo", Json.tree(clientInfo));
        return params;
    }

    private void discover() {
        Capabilities advertised = serverCapabilities();
        if (advertised.supports(Capability.TOOLS)) {
            tools = discover(McpMethod.LIST_TOOLS, "tools", Tool.class);
        }
        if (advertised.supports(Capability.RESOURCES)) {
            resources = discover(McpMethod.LIST_RESOURCES, "resources", Resource.class);
        }
        if (advertised.supports(Capability.PROMPTS)) {
            prompts = discover(McpMethod.LIST_PROMPTS, "prompts", Prompt.class);
        }
    }

    /**
     * Lists one category, following {@code nextCursor} pages. A failure leaves the category empty.
     */
    private <T> List<T> discover(McpMethod method, String member, Class<T> type) {
        List<T> found = new ArrayList<>();
        String cursor = null;
        try {
            do {
                ObjectNode params = Json.object();
                if (cursor != null) {
                    params.put("cursor", cursor);
                }
                JsonNode result = request(method.wireName(), params, config.requestTimeout());
                for (JsonNode item : result.path(member)) {
                    found.add(Json.convert(item, type));
                }
                JsonNode next = result.path("nextCursor");
                cursor = next.isTextual() && !next.asText().isEmpty() ? next.asText() : null;
            } while (cursor != null);
        } catch (McpException | IllegalArgumentException e) {
            LOGGER.warn("Discovery of {} on {} failed, leaving it empty: {}", member, serverName, e.getMessage());
            return List.of();
        }
        LOGGER.debug("Discovered {} {} on {}", found.size(), member, serverName);
        return List.copyOf(found);
    }

    private void startReader() {
        Thread thread = new Thread(this::readLoop, "mcp-reader-" + serverName);
        thread.setDaemon(true);
        reader = thread;
        thread.start();
    }

    private void readLoop() {
        try {
            Iterator<Envelope> incoming = transport.receive();
            while (incoming.hasNext()) {
                Envelope envelope = incoming.next();
                try {
                    route(envelope);
                } catch (RuntimeException e) {
                    LOGGER.warn("Failed to handle message from {}", serverName, e);
                }
            }
        } catch (RuntimeException e) {
            LOGGER.error("Reader for {} stopped unexpectedly", serverName, e);
        } finally {
            teardown("stream ended");
        }
    }

    private void route(Envelope envelope) {
        Optional<String> problem = EnvelopeCodec.validate(envelope);
        if (problem.isPresent()) {
            LOGGER.warn("Dropping invalid message from {}: {}", serverName, problem.get());
            return;
        }
        if (envelope.isResponse()) {
            if (!calls.resolve(envelope.id(), envelope)) {
                LOGGER.warn("Discarding response from {} for unknown or expired id {}", serverName, envelope.id());
            }
        } else if (envelope.isNotification()) {
            listener.onNotification(this, envelope.method(), envelope.params());
        } else {
            answer(envelope);
        }
    }

    private void answer(Envelope request) {
        RequestHandler handler = requestHandlers.get(request.method());
        Envelope response;
        if (handler == null) {
            response = Envelope.failure(request.id(), ErrorCode.METHOD_NOT_FOUND,
                "Method " + request.method() + " not found", null);
        } else {
            try {
                response = Envelope.success(request.id(), handler.handle(serverName, request.params()));
            } catch (McpException e) {
                response = Envelope.failure(request.id(), e.toRpcError());
            } catch (Exception e) {
                LOGGER.warn("Handler for {} from {} failed", request.method(), serverName, e);
                ObjectNode data = Json.object()
                    .put("message", String.valueOf(e.getMessage()))
                    .put("exception", e.getClass().getName());
                response = Envelope.failure(request.id(), ErrorCode.INTERNAL_ERROR,
                    "Internal error: " + e.getMessage(), data);
            }
        }
        try {
            transport.send(response);
        } catch (TransportException e) {
            LOGGER.warn("Could not answer {} from {}: {}", request.method(), serverName, e.getMessage());
        }
    }

    private void teardown(String reason) {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        ConnectionState previous = state;
        state = ConnectionState.DISCONNECTED;
        Transport current = transport;
        if (current != null) {
            current.close();
        }
        Thread thread = reader;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(READER_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int cancelled = calls.cancelAll(closed());
        tools = List.of();
        resources = List.of();
        prompts = List.of();
        LOGGER.info("Connection to {} closed from state {} ({}), {} pending calls failed",
            serverName, previous, reason, cancelled);
        listener.onClosed(this);
    }

    private void transition(ConnectionState next) throws McpException {
        if (tornDown.get()) {
            throw closed();
        }
        LOGGER.debug("Connection to {}: {} -> {}", serverName, state, next);
        state = next;
    }

    private McpException closed() {
        return new McpException(ErrorCode.CONNECTION_CLOSED, "Connection to " + serverName + " is closed");
    }
}
