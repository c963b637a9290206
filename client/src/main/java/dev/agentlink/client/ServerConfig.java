package dev.agentlink.client;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes how to reach one server and how long to wait for it.
 *
 * @param kind transport used to reach the server
 * @param command executable and arguments of the child process ({@link TransportKind#STDIO})
 * @param environment extra environment variables of the child process ({@link TransportKind#STDIO})
 * @param host host name ({@link TransportKind#TCP})
 * @param port port ({@link TransportKind#TCP})
 * @param uri WebSocket endpoint ({@link TransportKind#WEBSOCKET})
 * @param connectTimeout bound on opening the transport and on the {@code initialize} round trip
 * @param requestTimeout default bound on every later request
 */
public record ServerConfig(
    TransportKind kind,
    List<String> command,
    Map<String, String> environment,
    String host,
    int port,
    URI uri,
    Duration connectTimeout,
    Duration requestTimeout
) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public ServerConfig {
        Objects.requireNonNull(kind, "kind");
        command = command == null ? List.of() : List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        switch (kind) {
            case STDIO -> {
                if (command.isEmpty()) {
                    throw new IllegalArgumentException("A stdio server needs a command");
                }
            }
            case TCP -> {
                if (host == null || port <= 0 || port > 65535) {
                    throw new IllegalArgumentException("A TCP server needs a host and a port in 1-65535");
                }
            }
            case WEBSOCKET -> Objects.requireNonNull(uri, "A WebSocket server needs a URI");
        }
    }

    public static ServerConfig stdio(String executable, String... arguments) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(arguments));
        return new ServerConfig(TransportKind.STDIO, command, null, null, 0, null, null, null);
    }

    public static ServerConfig tcp(String host, int port) {
        return new ServerConfig(TransportKind.TCP, null, null, host, port, null, null, null);
    }

    public static ServerConfig websocket(URI uri) {
        return new ServerConfig(TransportKind.WEBSOCKET, null, null, null, 0, uri, null, null);
    }

    public ServerConfig withEnvironment(Map<String, String> environment) {
        return new ServerConfig(kind, command, environment, host, port, uri, connectTimeout, requestTimeout);
    }

    public ServerConfig withConnectTimeout(Duration connectTimeout) {
        return new ServerConfig(kind, command, environment, host, port, uri, connectTimeout, requestTimeout);
    }

    public ServerConfig withRequestTimeout(Duration requestTimeout) {
        return new ServerConfig(kind, command, environment, host, port, uri, connectTimeout, requestTimeout);
    }

    /**
     * Short human-readable address, used in logs.
     */
    public String describe() {
        return switch (kind) {
            case STDIO -> "stdio:" + String.join(" ", command);
            case TCP -> "tcp://" + host + ":" + port;
            case WEBSOCKET -> uri.toString();
        };
    }
}
