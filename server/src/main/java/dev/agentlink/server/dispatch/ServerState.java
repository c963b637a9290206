package dev.agentlink.server.dispatch;

/**
 * Handshake state of one peer session.
 */
public enum ServerState {

    /**
     * Only {@code initialize} is served.
     */
    UNINITIALIZED,

    /**
     * The peer has sent {@code initialized}; every method is served.
     */
    INITIALIZED
}
