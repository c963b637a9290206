package dev.agentlink.server.transport;

import dev.agentlink.protocol.Envelope;
import dev.agentlink.server.dispatch.McpDispatcher;
import dev.agentlink.transport.Transport;
import dev.agentlink.transport.TransportException;
import java.io.Closeable;
import java.util.Iterator;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one peer over one transport: reads messages until the peer goes away and hands each
 * to the session's dispatcher.
 */
public class ServerSession implements Runnable, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerSession.class);

    private final Transport transport;
    private final McpDispatcher dispatcher;
    private final Executor handlers;

    public ServerSession(Transport transport, McpDispatcher dispatcher, Executor handlers) {
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.handlers = handlers;
    }

    @Override
    public void run() {
        LOGGER.info("Session {} started on {}", dispatcher.sessionId(), transport.id());
        try {
            Iterator<Envelope> messages = transport.receive();
            while (messages.hasNext()) {
                dispatcher.dispatch(messages.next(), handlers, this::reply);
            }
        } catch (RuntimeException e) {
            LOGGER.error("Session {} stopped unexpectedly", dispatcher.sessionId(), e);
        } finally {
            transport.close();
            LOGGER.info("Session {} ended", dispatcher.sessionId());
        }
    }

    private void reply(Envelope response) {
        try {
            transport.send(response);
        } catch (TransportException e) {
            if (e.isClosed()) {
                LOGGER.debug("Session {} dropped response {}: transport closed", dispatcher.sessionId(), response.id());
            } else {
                LOGGER.warn("Session {} failed to send response {}", dispatcher.sessionId(), response.id(), e);
            }
        }
    }

    public McpDispatcher dispatcher() {
        return dispatcher;
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    @Override
    public void close() {
        transport.close();
    }
}
