package dev.agentlink.server.transport;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.transport.QueuedFrameTransport;

/**
 * Serves peers over WebSocket, one text message per envelope. Each WebSocket connection hosts a
 * single {@link ServerSession} with its own dispatcher; inbound text messages are queued onto
 * the session's transport and consumed by a dedicated reader thread.
 */
public class WebSocketServerHandler extends TextWebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketServerHandler.class);

	private final McpServerDefinition definition;

	private final ExecutorService handlers;

	private final ExecutorService sessionExecutor = Executors.newCachedThreadPool(r -> {
		Thread t = new Thread(r, "ws-server-session");
		t.setDaemon(true);
		return t;
	});

	private final Map<String, ActiveSession> sessionsByWebSocketId = new ConcurrentHashMap<>();

	/**
	 * Create a handler serving the given definition.
	 * @param definition server identity, capabilities and registries
	 * @param handlers pool running non-lifecycle requests
	 */
	public WebSocketServerHandler(McpServerDefinition definition, ExecutorService handlers) {
		this.definition = definition;
		this.handlers = handlers;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession socketSession) {
		logger.info("WebSocket connection established: {}", socketSession.getId());
		WebSocketSessionTransport transport = new WebSocketSessionTransport(socketSession);
		ServerSession session = new ServerSession(transport, this.definition.newDispatcher("ws-" + socketSession.getId()),
				this.handlers);
		this.sessionsByWebSocketId.put(socketSession.getId(), new ActiveSession(session, transport));
		this.sessionExecutor.submit(session);
	}

	@Override
	protected void handleTextMessage(WebSocketSession socketSession, TextMessage message) {
		ActiveSession active = this.sessionsByWebSocketId.get(socketSession.getId());
		if (active == null) {
			logger.warn("Message received for unknown WebSocket {}", socketSession.getId());
			return;
		}
		active.transport().deliver(message.getPayload());
	}

	@Override
	public void handleTransportError(WebSocketSession socketSession, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", socketSession.getId(), exception);
		release(socketSession);
	}

	@Override
	public void afterConnectionClosed(WebSocketSession socketSession, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", socketSession.getId(), status);
		release(socketSession);
	}

	/**
	 * Close every open session and stop the reader threads.
	 */
	public void shutdown() {
		logger.info("Closing {} WebSocket session(s)", this.sessionsByWebSocketId.size());
		this.sessionsByWebSocketId.values().forEach(active -> active.session().close());
		this.sessionsByWebSocketId.clear();
		this.sessionExecutor.shutdownNow();
	}

	/**
	 * Number of WebSocket connections currently served.
	 * @return open session count
	 */
	public int sessionCount() {
		return this.sessionsByWebSocketId.size();
	}

	private void release(WebSocketSession socketSession) {
		ActiveSession active = this.sessionsByWebSocketId.remove(socketSession.getId());
		if (active != null) {
			active.transport().endOfStream();
		}
	}

	private record ActiveSession(ServerSession session, WebSocketSessionTransport transport) {
	}

	/**
	 * Transport adapter that writes envelopes to the underlying WebSocket session.
	 */
	private static final class WebSocketSessionTransport extends QueuedFrameTransport {

		private final WebSocketSession session;

		private WebSocketSessionTransport(WebSocketSession session) {
			super("ws-" + session.getId());
			this.session = session;
		}

		@Override
		protected void writeFrame(String json) throws IOException {
			if (!this.session.isOpen()) {
				throw new IOException("WebSocket session is closed");
			}
			this.session.sendMessage(new TextMessage(json));
		}

		@Override
		protected void closeResources() throws IOException {
			if (this.session.isOpen()) {
				this.session.close(CloseStatus.NORMAL);
			}
		}

	}

}
