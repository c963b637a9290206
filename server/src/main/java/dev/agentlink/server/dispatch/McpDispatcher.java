package dev.agentlink.server.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.agentlink.protocol.Capability;
import dev.agentlink.protocol.Envelope;
import dev.agentlink.protocol.EnvelopeCodec;
import dev.agentlink.protocol.ErrorCode;
import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.McpException;
import dev.agentlink.protocol.McpMethod;
import dev.agentlink.protocol.model.Capabilities;
import dev.agentlink.protocol.model.InitializeResult;
import dev.agentlink.protocol.model.PeerInfo;
import dev.agentlink.protocol.model.ReadResourceResult;
import dev.agentlink.protocol.model.Resource;
import dev.agentlink.protocol.model.ResourceContents;
import dev.agentlink.protocol.model.ToolResult;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of one peer session: validates incoming messages, tracks the handshake state and
 * routes requests to the built-in handlers and the registries.
 *
 * <p>Screening (validation, handshake state, method and capability checks) and the lifecycle
 * methods run on the caller's thread, in arrival order. The remaining requests are handed to
 * an executor, so their responses may be emitted in any order.
 */
public class McpDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpDispatcher.class);

    private final String sessionId;
    private final PeerInfo serverInfo;
    private final Capabilities capabilities;
    private final ToolRegistry tools;
    private final ResourceRegistry resources;
    private final PromptRegistry prompts;

    private volatile ServerState state = ServerState.UNINITIALIZED;
    private volatile PeerInfo clientInfo;

    public McpDispatcher(String sessionId, PeerInfo serverInfo, Capabilities capabilities, ToolRegistry tools,
        ResourceRegistry resources, PromptRegistry prompts) {
        this.sessionId = sessionId;
        this.serverInfo = serverInfo;
        this.capabilities = capabilities;
        this.tools = tools;
        this.resources = resources;
        this.prompts = prompts;
    }

    /**
     * Handles one message to completion on the calling thread.
     *
     * @return the response to send, empty for notifications and dropped messages
     */
    public Optional<Envelope> handle(Envelope message) {
        AtomicReference<Envelope> reply = new AtomicReference<>();
        dispatch(message, Runnable::run, reply::set);
        return Optional.ofNullable(reply.get());
    }

    /**
     * Handles one message, running non-lifecycle requests on {@code handlers}. Every request
     * produces exactly one call to {@code replies}; notifications and responses produce none.
     */
    public void dispatch(Envelope message, Executor handlers, Consumer<Envelope> replies) {
        Optional<String> invalid = EnvelopeCodec.validate(message);
        if (invalid.isPresent()) {
            LOGGER.warn("Session {} received invalid message: {}", sessionId, invalid.get());
            if (message.id() != null) {
                replies.accept(Envelope.failure(message.id(), ErrorCode.INVALID_REQUEST, invalid.get(), null));
            }
            return;
        }
        if (message.isResponse()) {
            LOGGER.warn("Session {} ignoring response {}: no server requests are outstanding", sessionId, message.id());
            return;
        }
        if (message.isNotification()) {
            onNotification(message);
            return;
        }

        Object id = message.id();
        Optional<McpMethod> resolved = McpMethod.fromWireName(message.method());
        if (resolved.isEmpty()) {
            LOGGER.warn("Session {} has no handler for method {}", sessionId, message.method());
            replies.accept(Envelope.failure(id, ErrorCode.METHOD_NOT_FOUND,
                "Method " + message.method() + " not found", null));
            return;
        }
        McpMethod method = resolved.get();
        if (method != McpMethod.INITIALIZE && method != McpMethod.INITIALIZED
            && state == ServerState.UNINITIALIZED) {
            replies.accept(Envelope.failure(id, ErrorCode.INVALID_REQUEST, "Not initialized", null));
            return;
        }
        Capability required = method.capability();
        if (required != null && !capabilities.supports(required)) {
            replies.accept(Envelope.failure(id, ErrorCode.CAPABILITY_NOT_SUPPORTED,
                "Server does not support " + required.key(), null));
            return;
        }

        if (method.capability() == null) {
            replies.accept(invoke(method, message));
            return;
        }
        try {
            handlers.execute(() -> replies.accept(invoke(method, message)));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Session {} rejected {}: handler pool is shut down", sessionId, method.wireName());
            replies.accept(Envelope.failure(id, ErrorCode.INTERNAL_ERROR, "Server is shutting down", null));
        }
    }

    public ServerState state() {
        return state;
    }

    public PeerInfo clientInfo() {
        return clientInfo;
    }

    public String sessionId() {
        return sessionId;
    }

    private void onNotification(Envelope notification) {
        Optional<McpMethod> method = McpMethod.fromWireName(notification.method());
        if (method.isPresent() && method.get() == McpMethod.INITIALIZED) {
            markInitialized();
            return;
        }
        LOGGER.debug("Session {} ignoring notification {}", sessionId, notification.method());
    }

    private void markInitialized() {
        state = ServerState.INITIALIZED;
        LOGGER.info("Session {} initialized for client {}", sessionId,
            clientInfo == null ? "unknown" : clientInfo.displayLabel());
    }

    private Envelope invoke(McpMethod method, Envelope request) {
        JsonNode params = request.params() == null ? Json.object() : request.params();
        try {
            JsonNode result = switch (method) {
                case INITIALIZE -> initialize(params);
                case INITIALIZED -> {
                    markInitialized();
                    yield Json.object();
                }
                case PING -> Json.object();
                case LIST_TOOLS -> listing("tools", tools.list());
                case CALL_TOOL -> callTool(params);
                case LIST_RESOURCES -> listing("resources", resources.list());
                case READ_RESOURCE -> readResource(params);
                case LIST_PROMPTS -> listing("prompts", prompts.list());
                case GET_PROMPT -> getPrompt(params);
            };
            return Envelope.success(request.id(), result);
        } catch (McpException e) {
            LOGGER.debug("Session {} {} failed: {}", sessionId, method.wireName(), e.getMessage());
            return Envelope.failure(request.id(), e.toRpcError());
        } catch (Exception e) {
            LOGGER.error("Session {} handler for {} failed", sessionId, method.wireName(), e);
            ObjectNode data = Json.object()
                .put("message", e.getMessage())
                .put("exception", e.getClass().getName());
            return Envelope.failure(request.id(), ErrorCode.INTERNAL_ERROR,
                "Internal error: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), data);
        }
    }

    private JsonNode initialize(JsonNode params) {
        JsonNode info = params.path("clientInfo");
        clientInfo = info.isObject() ? Json.convert(info, PeerInfo.class) : null;
        state = ServerState.UNINITIALIZED;
        LOGGER.info("Session {} initialize from {} (protocol {})", sessionId,
            clientInfo == null ? "unknown" : clientInfo.displayLabel(), params.path("protocolVersion").asText("unspecified"));
        return Json.tree(new InitializeResult(InitializeResult.PROTOCOL_VERSION, capabilities, serverInfo));
    }

    private JsonNode callTool(JsonNode params) throws Exception {
        String name = requireText(params, "name", "Tool name required");
        ToolRegistry.Registration registration = tools.find(name)
            .orElseThrow(() -> new McpException(ErrorCode.TOOL_NOT_FOUND, "Tool " + name + " not found"));
        JsonNode arguments = params.path("arguments");
        if (!arguments.isObject()) {
            arguments = Json.object();
        }
        return Json.tree(toToolResult(registration.handler().handle(arguments)));
    }

    private JsonNode readResource(JsonNode params) throws Exception {
        String uri = requireText(params, "uri", "Resource URI required");
        ResourceRegistry.Registration registration = resources.find(uri)
            .orElseThrow(() -> new McpException(ErrorCode.RESOURCE_NOT_FOUND, "Resource " + uri + " not found"));
        Resource resource = registration.resource();
        String text = registration.reader().read(resource);
        String mimeType = resource.mimeType() == null ? "text/plain" : resource.mimeType();
        return Json.tree(new ReadResourceResult(List.of(new ResourceContents(uri, mimeType, text))));
    }

    private JsonNode getPrompt(JsonNode params) throws Exception {
        String name = requireText(params, "name", "Prompt name required");
        PromptRegistry.Registration registration = prompts.find(name)
            .orElseThrow(() -> new McpException(ErrorCode.PROMPT_NOT_FOUND, "Prompt " + name + " not found"));
        JsonNode arguments = params.path("arguments");
        if (!arguments.isObject()) {
            arguments = Json.object();
        }
        return Json.tree(registration.renderer().render(registration.prompt(), arguments));
    }

    private static String requireText(JsonNode params, String field, String message) throws McpException {
        JsonNode value = params.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new McpException(ErrorCode.INVALID_PARAMS, message);
        }
        return value.asText();
    }

    private static ObjectNode listing(String field, List<?> items) {
        ObjectNode result = Json.object();
        result.set(field, Json.tree(items));
        return result;
    }

    private static ToolResult toToolResult(Object value) {
        if (value instanceof ToolResult result) {
            return result;
        }
        if (value instanceof String text) {
            return ToolResult.text(text);
        }
        if (value == null) {
            return new ToolResult(List.of(), false);
        }
        return ToolResult.text(Json.write(value));
    }
}
