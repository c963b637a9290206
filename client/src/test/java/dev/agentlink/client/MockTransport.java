package dev.agentlink.client;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import dev.agentlink.protocol.Envelope;
import dev.agentlink.protocol.EnvelopeCodec;
import dev.agentlink.protocol.EnvelopeCodec.DecodeResult;
import dev.agentlink.transport.QueuedFrameTransport;

/**
 * In-memory transport whose far end is played by the test. Frames go through the real codec in
 * both directions.
 */
final class MockTransport extends QueuedFrameTransport {

    private final List<Envelope> sent = new CopyOnWriteArrayList<>();

    private volatile Consumer<Envelope> peer = envelope -> {
    };

    MockTransport(String id) {
        super(id);
    }

    /**
     * Installs the far end; it sees every envelope the client writes, on the writing thread.
     */
    MockTransport peer(Consumer<Envelope> peer) {
        this.peer = peer;
        return this;
    }

    void push(Envelope envelope) {
        deliver(EnvelopeCodec.encode(envelope));
    }

    void pushRaw(String frame) {
        deliver(frame);
    }

    void peerCloses() {
        endOfStream();
    }

    List<Envelope> sent() {
        return List.copyOf(sent);
    }

    List<Envelope> sent(String method) {
        return sent.stream().filter(envelope -> method.equals(envelope.method())).collect(Collectors.toList());
    }

    @Override
    protected void writeFrame(String json) {
        DecodeResult decoded = EnvelopeCodec.decode(json);
        sent.add(decoded.envelope());
        peer.accept(decoded.envelope());
    }

    @Override
    protected void closeResources() {
    }

}
