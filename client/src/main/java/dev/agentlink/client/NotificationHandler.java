package dev.agentlink.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives notifications sent by a server. Runs on that server's reader thread.
 */
@FunctionalInterface
public interface NotificationHandler {

    void handle(String serverName, JsonNode params);
}
