package dev.agentlink.transport;

import java.io.IOException;

/**
 * I/O failure of a {@link Transport}.
 */
public class TransportException extends IOException {

    private final boolean closed;

    public TransportException(String message, Throwable cause, boolean closed) {
        super(message, cause);
        this.closed = closed;
    }

    public static TransportException closed(String transportId) {
        return new TransportException("Transport " + transportId + " is closed", null, true);
    }

    /**
     * Whether the failure is because the channel is no longer open, as opposed to a failure
     * while it still is.
     */
    public boolean isClosed() {
        return closed;
    }
}
