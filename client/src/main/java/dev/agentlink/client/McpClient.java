package dev.agentlink.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.agentlink.client.transport.DefaultTransportFactory;
import dev.agentlink.client.transport.TransportFactory;
import dev.agentlink.protocol.ErrorCode;
import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.McpException;
import dev.agentlink.protocol.McpMethod;
import dev.agentlink.protocol.model.PeerInfo;
import dev.agentlink.protocol.model.Prompt;
import dev.agentlink.protocol.model.PromptResult;
import dev.agentlink.protocol.model.ReadResourceResult;
import dev.agentlink.protocol.model.Resource;
import dev.agentlink.protocol.model.Tool;
import dev.agentlink.protocol.model.ToolResult;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client of any number of named servers. Tools, resources and prompts discovered on every
 * connection are merged into one catalog; {@link #callTool}, {@link #readResource} and
 * {@link #getPrompt} find the owning connection and perform the round trip on it.
 *
 * <p>All operations are thread safe. Calls on the same or different servers may run
 * concurrently; only connecting and disconnecting the same name are serialized.
 */
public class McpClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpClient.class);

    private final PeerInfo clientInfo;
    private final JsonNode clientCapabilities;
    private final TransportFactory transportFactory;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Object> connectLocks = new ConcurrentHashMap<>();
    private final CapabilityCatalog<Tool> tools = new CapabilityCatalog<>("Tool");
    private final CapabilityCatalog<Resource> resources = new CapabilityCatalog<>("Resource");
    private final CapabilityCatalog<Prompt> prompts = new CapabilityCatalog<>("Prompt");
    private final Map<String, NotificationHandler> notificationHandlers = new ConcurrentHashMap<>();
    private final Map<String, RequestHandler> requestHandlers = new ConcurrentHashMap<>();
    private final Connection.Listener listener = new ConnectionListener();
    private final AtomicBoolean shutDown = new AtomicBoolean();

    public McpClient(PeerInfo clientInfo) {
        this(clientInfo, new DefaultTransportFactory());
    }

    public McpClient(PeerInfo clientInfo, TransportFactory transportFactory) {
        this(clientInfo, Json.object(), transportFactory);
    }

    public McpClient(PeerInfo clientInfo, JsonNode clientCapabilities, TransportFactory transportFactory) {
        this.clientInfo = clientInfo;
        this.clientCapabilities = clientCapabilities;
        this.transportFactory = transportFactory;
        NotificationHandler progress = (server, params) -> LOGGER.debug("Progress from {}: {}", server, params);
        notificationHandlers.put("notifications/progress", progress);
        notificationHandlers.put("progress", progress);
        requestHandlers.put(McpMethod.PING.wireName(), (server, params) -> Json.object());
    }

    /**
     * Connects to a server and merges what it offers into the catalog. An existing connection
     * under the same name is torn down first.
     *
     * @throws McpException when the connection cannot be established; nothing is registered
     *     under {@code name} in that case
     */
    public void connectServer(String name, ServerConfig config) throws McpException {
        synchronized (connectLocks.computeIfAbsent(name, key -> new Object())) {
            if (shutDown.get()) {
                throw new McpException(ErrorCode.CONNECTION_CLOSED, "Client has been shut down");
            }
            Connection previous = connections.remove(name);
            if (previous != null) {
                LOGGER.info("Reconnecting {}, closing the previous connection", name);
                previous.close();
            }

            LOGGER.info("Connecting to {} at {}", name, config.describe());
            Connection connection = new Connection(name, config, transportFactory, clientInfo, clientCapabilities,
                requestHandlers, listener);
            connection.open();

            connections.put(name, connection);
            tools.addAll(connection, connection.tools(), Tool::name);
            resources.addAll(connection, connection.resources(), Resource::uri);
            prompts.addAll(connection, connection.prompts(), Prompt::name);
            // registered before this check, so a concurrent shutdown either sees the name or is seen here
            if (shutDown.get()) {
                connection.close();
                forget(connection);
                throw new McpException(ErrorCode.CONNECTION_CLOSED, "Client has been shut down");
            }
            if (!connection.isReady()) {
                forget(connection);
                throw new McpException(ErrorCode.CONNECTION_CLOSED, "Server " + name + " went away while connecting");
            }
        }
    }

    /**
     * Tears down the connection registered under {@code name}.
     *
     * @return {@code false} when no such connection exists
     */
    public boolean disconnectServer(String name) {
        synchronized (connectLocks.computeIfAbsent(name, key -> new Object())) {
            Connection connection = connections.remove(name);
            if (connection == null) {
                return false;
            }
            connection.close();
            forget(connection);
            return true;
        }
    }

    /**
     * Invokes a tool on whichever server offers it, using that server's request timeout.
     *
     * @throws McpException {@link ErrorCode#TOOL_NOT_FOUND} when no connected server offers the
     *     tool, without any network activity
     */
    public ToolResult callTool(String toolName, JsonNode arguments) throws McpException {
        return callTool(toolName, arguments, null);
    }

    public ToolResult callTool(String toolName, JsonNode arguments, Duration timeout) throws McpException {
        Connection owner = tools.owner(toolName)
            .orElseThrow(() -> new McpException(ErrorCode.TOOL_NOT_FOUND, "Tool " + toolName + " not found"));
        ObjectNode params = Json.object();
        params.put("name", toolName);
        params.set("arguments", arguments == null ? Json.object() : arguments);
        JsonNode result = owner.request(McpMethod.CALL_TOOL.wireName(), params, timeoutFor(owner, timeout));
        return convert(result, ToolResult.class, McpMethod.CALL_TOOL);
    }

    public ReadResourceResult readResource(String uri) throws McpException {
        return readResource(uri, null);
    }

    public ReadResourceResult readResource(String uri, Duration timeout) throws McpException {
        Connection owner = resources.owner(uri)
            .orElseThrow(() -> new McpException(ErrorCode.RESOURCE_NOT_FOUND, "Resource " + uri + " not found"));
        ObjectNode params = Json.object().put("uri", uri);
        JsonNode result = owner.request(McpMethod.READ_RESOURCE.wireName(), params, timeoutFor(owner, timeout));
        return convert(result, ReadResourceResult.class, McpMethod.READ_RESOURCE);
    }

    public PromptResult getPrompt(String name, JsonNode arguments) throws McpException {
        return getPrompt(name, arguments, null);
    }

    public PromptResult getPrompt(String name, JsonNode arguments, Duration timeout) throws McpException {
        Connection owner = prompts.owner(name)
            .orElseThrow(() -> new McpException(ErrorCode.PROMPT_NOT_FOUND, "Prompt " + name + " not found"));
        ObjectNode params = Json.object();
        params.put("name", name);
        params.set("arguments", arguments == null ? Json.object() : arguments);
        JsonNode result = owner.request(McpMethod.GET_PROMPT.wireName(), params, timeoutFor(owner, timeout));
        return convert(result, PromptResult.class, McpMethod.GET_PROMPT);
    }

    public void ping(String serverName, Duration timeout) throws McpException {
        Connection connection = connections.get(serverName);
        if (connection == null) {
            throw new McpException(ErrorCode.CONNECTION_CLOSED, "Server " + serverName + " is not connected");
        }
        connection.ping(timeout);
    }

    /**
     * Pings every connected server in name order, each bounded by {@code timeout}. A failed
     * ping is reported, not thrown, and leaves the connection as it is.
     */
    public List<ServerHealth> healthCheck(Duration timeout) {
        List<ServerHealth> report = new ArrayList<>();
        for (String name : listConnectedServers()) {
            Connection connection = connections.get(name);
            if (connection == null) {
                continue;
            }
            long started = System.nanoTime();
            String error = null;
            try {
                connection.ping(timeout);
            } catch (McpException e) {
                error = e.getMessage();
                LOGGER.warn("Health check of {} failed: {}", name, error);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            report.add(new ServerHealth(name, error == null, elapsed, connection.state(),
                connection.tools().size(), error));
        }
        return List.copyOf(report);
    }

    public List<String> listConnectedServers() {
        List<String> names = new ArrayList<>(connections.keySet());
        names.sort(null);
        return names;
    }

    public List<CatalogEntry<Tool>> listTools() {
        return tools.snapshot();
    }

    public List<CatalogEntry<Resource>> listResources() {
        return resources.snapshot();
    }

    public List<CatalogEntry<Prompt>> listPrompts() {
        return prompts.snapshot();
    }

    public Optional<ConnectionState> connectionState(String serverName) {
        return Optional.ofNullable(connections.get(serverName)).map(Connection::state);
    }

    /**
     * Registers the handler for one notification method, replacing any previous one.
     */
    public void onNotification(String method, NotificationHandler handler) {
        notificationHandlers.put(method, handler);
    }

    /**
     * Registers the handler answering one server to client request method.
     */
    public void onRequest(String method, RequestHandler handler) {
        requestHandlers.put(method, handler);
    }

    /**
     * Tears down every connection. Safe to call more than once and after servers went away on
     * their own.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        for (String name : listConnectedServers()) {
            disconnectServer(name);
        }
        LOGGER.info("Client {} shut down", clientInfo.displayLabel());
    }

    @Override
    public void close() {
        shutdown();
    }

    private void forget(Connection connection) {
        connections.remove(connection.serverName(), connection);
        tools.purge(connection);
        resources.purge(connection);
        prompts.purge(connection);
    }

    private static Duration timeoutFor(Connection owner, Duration timeout) {
        return timeout == null ? owner.config().requestTimeout() : timeout;
    }

    private static <T> T convert(JsonNode result, Class<T> type, McpMethod method) throws McpException {
        try {
            return Json.convert(result, type);
        } catch (IllegalArgumentException e) {
            throw new McpException(ErrorCode.INTERNAL_ERROR, "Malformed " + method.wireName() + " result", e);
        }
    }

    private final class ConnectionListener implements Connection.Listener {

        @Override
        public void onNotification(Connection connection, String method, JsonNode params) {
            NotificationHandler handler = notificationHandlers.get(method);
            if (handler == null) {
                LOGGER.debug("No handler for notification {} from {}", method, connection.serverName());
                return;
            }
            try {
                handler.handle(connection.serverName(), params);
            } catch (RuntimeException e) {
                LOGGER.warn("Notification handler for {} failed", method, e);
            }
        }

        @Override
        public void onClosed(Connection connection) {
            forget(connection);
        }
    }
}
