package dev.agentlink.client;

/**
 * Lifecycle of a {@link Connection}. States only move forward; {@link #DISCONNECTED} is both the
 * initial and the terminal state.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AWAITING_INIT_RESPONSE,
    AWAITING_INITIALIZED_ACK,
    DISCOVERING,
    READY
}
