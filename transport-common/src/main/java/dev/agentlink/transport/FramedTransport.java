package dev.agentlink.transport;

import dev.agentlink.protocol.Envelope;
import dev.agentlink.protocol.EnvelopeCodec;
import dev.agentlink.protocol.EnvelopeCodec.DecodeResult;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for transports that move one JSON text per frame. Subclasses supply the framing; this
 * class owns encoding, decoding, wire logging and the closed state.
 *
 * <p>The write side is serialized by a lock of its own, so a sender never waits on the thread
 * consuming {@link #receive()}.
 */
public abstract class FramedTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(FramedTransport.class);

    private final String id;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean receiving = new AtomicBoolean();

    protected FramedTransport(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(Envelope envelope) throws TransportException {
        if (closed.get()) {
            throw TransportException.closed(id);
        }
        String json = EnvelopeCodec.encode(envelope);
        Wire.tx(id, envelope, json);
        synchronized (writeLock) {
            if (closed.get()) {
                throw TransportException.closed(id);
            }
            try {
                writeFrame(json);
            } catch (IOException e) {
                LOGGER.warn("Write failed on {}, closing transport", id, e);
                close();
                throw new TransportException("Failed to write to " + id + ": " + e.getMessage(), e, true);
            }
        }
    }

    @Override
    public Iterator<Envelope> receive() {
        if (!receiving.compareAndSet(false, true)) {
            throw new IllegalStateException("Receive stream of " + id + " was already obtained");
        }
        return new FrameIterator();
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            closeResources();
        } catch (IOException e) {
            LOGGER.warn("Error closing transport {}", id, e);
        }
        LOGGER.debug("Transport {} closed", id);
    }

    /**
     * Writes one frame. Calls are serialized by the caller.
     */
    protected abstract void writeFrame(String json) throws IOException;

    /**
     * Blocks for the next frame.
     *
     * @return the frame text, or {@code null} at end of stream
     */
    protected abstract String readFrame() throws IOException;

    /**
     * Releases the underlying channel; must unblock a pending {@link #readFrame()}.
     */
    protected abstract void closeResources() throws IOException;

    private final class FrameIterator implements Iterator<Envelope> {

        private Envelope next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            while (next == null && !finished) {
                String frame;
                try {
                    frame = readFrame();
                } catch (IOException e) {
                    if (isOpen()) {
                        LOGGER.warn("Read failed on {}: {}", id, e.getMessage());
                    }
                    frame = null;
                }
                if (frame == null) {
                    finished = true;
                    close();
                    break;
                }
                if (frame.isBlank()) {
                    continue;
                }
                DecodeResult decoded = EnvelopeCodec.decode(frame);
                if (!decoded.isSuccess()) {
                    Wire.malformed(id, decoded.error(), frame);
                    continue;
                }
                Wire.rx(id, decoded.envelope(), frame);
                next = decoded.envelope();
            }
            return next != null;
        }

        @Override
        public Envelope next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Envelope result = next;
            next = null;
            return result;
        }
    }
}
