package dev.agentlink.client;

import java.time.Duration;

/**
 * Result of pinging one connected server.
 *
 * @param serverName name the server was connected under
 * @param healthy whether the ping was answered in time
 * @param responseTime time until the ping completed or failed
 * @param state connection state after the ping
 * @param toolCount number of tools the server listed during discovery
 * @param error failure message, {@code null} when healthy
 */
public record ServerHealth(String serverName, boolean healthy, Duration responseTime, ConnectionState state,
                           int toolCount, String error) {
}
