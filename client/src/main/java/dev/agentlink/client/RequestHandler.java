package dev.agentlink.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answers a request a server sends to the client. Runs on that server's reader thread, so it
 * must not wait on another request to the same server.
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * @return the {@code result} of the response
     * @throws Exception answered as an {@code InternalError}, or with its own code when it is a
     *     {@link dev.agentlink.protocol.McpException}
     */
    JsonNode handle(String serverName, JsonNode params) throws Exception;
}
