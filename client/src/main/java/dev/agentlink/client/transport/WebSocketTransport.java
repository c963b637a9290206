package dev.agentlink.client.transport;

import dev.agentlink.transport.QueuedFrameTransport;
import dev.agentlink.transport.TransportException;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Client side of the WebSocket transport: one text message per envelope, received messages
 * queued for the connection's reader.
 */
public class WebSocketTransport extends QueuedFrameTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketTransport.class);

    public static final int DEFAULT_MAX_MESSAGE_BYTES = 4 * 1024 * 1024;

    private volatile WebSocketSession session;

    private WebSocketTransport(String id) {
        super(id);
    }

    public static WebSocketTransport connect(URI uri, Duration timeout) throws TransportException {
        return connect(uri, timeout, DEFAULT_MAX_MESSAGE_BYTES);
    }

    /**
     * Opens a WebSocket to {@code uri}.
     *
     * @throws TransportException when the handshake does not complete within the timeout
     */
    public static WebSocketTransport connect(URI uri, Duration timeout, int maxMessageBytes) throws TransportException {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(maxMessageBytes);
        StandardWebSocketClient client = new StandardWebSocketClient(container);
        WebSocketTransport transport = new WebSocketTransport(uri.toString());
        try {
            transport.session = client.execute(transport.new Handler(), new WebSocketHttpHeaders(), uri)
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TransportException("Unable to connect to " + uri + ": " + cause.getMessage(), cause, true);
        } catch (TimeoutException e) {
            throw new TransportException("Timed out connecting to " + uri, e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + uri, e, true);
        }
        LOGGER.info("WebSocket {} connected to {}", transport.session.getId(), uri);
        return transport;
    }

    @Override
    protected void writeFrame(String json) throws IOException {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new IOException("WebSocket session is closed");
        }
        current.sendMessage(new TextMessage(json));
    }

    @Override
    protected void closeResources() throws IOException {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            current.close(CloseStatus.NORMAL);
        }
    }

    private final class Handler extends TextWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession socketSession, TextMessage message) {
            deliver(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession socketSession, Throwable exception) {
            LOGGER.warn("Transport error on WebSocket {}", id(), exception);
            endOfStream();
        }

        @Override
        public void afterConnectionClosed(WebSocketSession socketSession, CloseStatus status) {
            LOGGER.info("WebSocket {} closed with status {}", id(), status);
            endOfStream();
        }
    }
}
