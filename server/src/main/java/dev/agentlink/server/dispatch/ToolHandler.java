package dev.agentlink.server.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation behind one registered tool.
 *
 * <p>The returned value becomes the {@code content} of the {@code tools/call} result: a
 * {@link dev.agentlink.protocol.model.ToolResult} is sent as is, a {@link String} becomes a
 * single text block, anything else is serialized to JSON text.
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(JsonNode arguments) throws Exception;
}
