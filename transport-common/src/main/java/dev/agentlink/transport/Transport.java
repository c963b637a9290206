package dev.agentlink.transport;

import dev.agentlink.protocol.Envelope;
import java.io.Closeable;
import java.util.Iterator;

/**
 * Bidirectional message channel to one peer.
 *
 * <p>{@link #send(Envelope)} may be called from any thread, concurrently with consumption of
 * the receive stream. The receive stream is lazy, finite and can be obtained only once; it ends
 * when the peer disconnects or the transport is closed.
 */
public interface Transport extends Closeable {

    /**
     * Identifier used in log lines.
     */
    String id();

    /**
     * Writes one envelope as one frame.
     *
     * @throws TransportException with {@link TransportException#isClosed()} set once the channel
     *     has been closed or the peer has gone away
     */
    void send(Envelope envelope) throws TransportException;

    /**
     * Returns the stream of received envelopes. Frames that cannot be decoded are logged and
     * skipped; they never end the stream.
     *
     * @throws IllegalStateException when called a second time
     */
    Iterator<Envelope> receive();

    boolean isOpen();

    /**
     * Closes the channel and ends the receive stream. Idempotent.
     */
    @Override
    void close();
}
