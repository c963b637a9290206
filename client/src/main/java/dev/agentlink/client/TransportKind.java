package dev.agentlink.client;

/**
 * How a client reaches a server.
 */
public enum TransportKind {

    /**
     * Child process speaking newline-delimited envelopes on its standard streams.
     */
    STDIO,

    /**
     * TCP socket carrying length-prefixed frames.
     */
    TCP,

    /**
     * WebSocket carrying one text message per envelope.
     */
    WEBSOCKET
}
