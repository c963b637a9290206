package dev.agentlink.server.transport;

import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.transport.LineTransport;
import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves a single peer over newline-delimited standard streams. The reader thread is not a
 * daemon, so the process lives as long as the peer keeps its end of the pipe open.
 */
public class StdioServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StdioServer.class);

    private final McpServerDefinition definition;
    private final ExecutorService handlers;
    private final InputStream in;
    private final OutputStream out;

    private ServerSession session;
    private Thread readerThread;

    public StdioServer(McpServerDefinition definition, ExecutorService handlers) {
        this(definition, handlers, System.in, System.out);
    }

    public StdioServer(McpServerDefinition definition, ExecutorService handlers, InputStream in, OutputStream out) {
        this.definition = definition;
        this.handlers = handlers;
        this.in = in;
        this.out = out;
    }

    public synchronized void start() {
        if (session != null) {
            return;
        }
        session = new ServerSession(new LineTransport("stdio", in, out), definition.newDispatcher("stdio"), handlers);
        readerThread = new Thread(session, "stdio-server");
        readerThread.start();
        LOGGER.info("Serving {} on standard streams", definition.serverInfo().displayLabel());
    }

    /**
     * Blocks until the peer closes standard input.
     */
    public void awaitTermination() throws InterruptedException {
        Thread thread;
        synchronized (this) {
            thread = readerThread;
        }
        if (thread != null) {
            thread.join();
        }
    }

    public synchronized void stop() {
        if (session != null) {
            session.close();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
