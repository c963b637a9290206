package dev.agentlink.server.transport;

import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.transport.SocketTransport;
import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts TCP peers and serves each over length-prefixed frames with a dispatcher of its own.
 */
public class TcpServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpServer.class);

    private final McpServerDefinition definition;
    private final int port;
    private final int maxFrameBytes;
    private final ExecutorService handlers;
    private final AtomicInteger sessionCounter = new AtomicInteger();
    private final ExecutorService sessionExecutor;
    private final Set<ServerSession> sessions = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public TcpServer(McpServerDefinition definition, int port, int maxFrameBytes, ExecutorService handlers) {
        this(definition, port, maxFrameBytes, handlers, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tcp-server-session");
            t.setDaemon(true);
            return t;
        }));
    }

    TcpServer(McpServerDefinition definition, int port, int maxFrameBytes, ExecutorService handlers,
            ExecutorService sessionExecutor) {
        this.definition = definition;
        this.port = port;
        this.maxFrameBytes = maxFrameBytes;
        this.handlers = handlers;
        this.sessionExecutor = sessionExecutor;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(port);
        running = true;
        acceptThread = new Thread(this::acceptLoop, "tcp-server-accept");
        acceptThread.start();
        LOGGER.info("TCP server listening on port {}", serverSocket.getLocalPort());
    }

    /**
     * Port actually bound, which differs from the configured one when that was 0.
     */
    public int getLocalPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        while (running) {
            ServerSession session = null;
            try {
                Socket socket = serverSocket.accept();
                String sessionId = "tcp-" + sessionCounter.incrementAndGet();
                session = new ServerSession(new SocketTransport(socket, maxFrameBytes),
                    definition.newDispatcher(sessionId), handlers);
                sessions.add(session);
                LOGGER.info("Accepted connection {} as {}", socket.getRemoteSocketAddress(), sessionId);
                ServerSession accepted = session;
                sessionExecutor.submit(() -> {
                    try {
                        accepted.run();
                    } finally {
                        sessions.remove(accepted);
                    }
                });
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Session executor rejected connection, closing it");
                if (session != null) {
                    session.close();
                    sessions.remove(session);
                }
            }
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    public void stop() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing server socket", e);
            }
        }
        if (acceptThread != null && acceptThread != Thread.currentThread()) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (ServerSession session : new ArrayList<>(sessions)) {
            session.close();
        }
        sessionExecutor.shutdown();
        try {
            if (!sessionExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                sessionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("TCP server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
