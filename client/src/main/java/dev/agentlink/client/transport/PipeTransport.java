package dev.agentlink.client.transport;

import dev.agentlink.transport.LineTransport;
import dev.agentlink.transport.TransportException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a server as a child process and talks to it over its standard streams, one envelope per
 * line. The child's standard error is forwarded to the log.
 */
public class PipeTransport extends LineTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipeTransport.class);

    private static final long EXIT_GRACE_MILLIS = 2000;

    private final Process process;

    private PipeTransport(String id, Process process) {
        super(id, process.getInputStream(), process.getOutputStream());
        this.process = process;
    }

    /**
     * Spawns the child process.
     *
     * @throws TransportException when the process cannot be started
     */
    public static PipeTransport start(String serverName, List<String> command, Map<String, String> environment)
        throws TransportException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new TransportException("Unable to start " + String.join(" ", command) + ": " + e.getMessage(), e, true);
        }
        LOGGER.info("Started server {} as pid {}", serverName, process.pid());
        drainErrors(serverName, process);
        return new PipeTransport(serverName + "#" + process.pid(), process);
    }

    private static void drainErrors(String serverName, Process process) {
        Thread drain = new Thread(() -> {
            try (BufferedReader errors = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = errors.readLine()) != null) {
                    LOGGER.debug("[{} stderr] {}", serverName, line);
                }
            } catch (IOException e) {
                LOGGER.debug("Stopped reading stderr of {}: {}", serverName, e.getMessage());
            }
        }, "mcp-stderr-" + serverName);
        drain.setDaemon(true);
        drain.start();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Stops the child before releasing the streams, so a reader blocked on its output sees end
     * of stream.
     */
    @Override
    protected void closeResources() throws IOException {
        process.destroy();
        try {
            if (!process.waitFor(EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Server {} did not exit, killing it", id());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } finally {
            super.closeResources();
        }
    }
}
