package dev.agentlink.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Base for channels that push inbound frames through callbacks, such as WebSocket sessions.
 * Callbacks hand frames to {@link #deliver(String)}; the receive stream drains them in arrival
 * order and ends after {@link #endOfStream()}.
 */
public abstract class QueuedFrameTransport extends FramedTransport {

    private static final String END_OF_STREAM = new String("<eos>");

    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();

    protected QueuedFrameTransport(String id) {
        super(id);
    }

    public void deliver(String frame) {
        if (frame != null) {
            inbound.offer(frame);
        }
    }

    /**
     * Signals that the peer has gone away. Frames delivered before remain readable.
     */
    public void endOfStream() {
        inbound.offer(END_OF_STREAM);
    }

    @Override
    protected String readFrame() throws IOException {
        try {
            String frame = inbound.take();
            if (frame == END_OF_STREAM) {
                inbound.offer(END_OF_STREAM);
                return null;
            }
            return frame;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for a frame on " + id());
        }
    }

    @Override
    public void close() {
        super.close();
        endOfStream();
    }
}
