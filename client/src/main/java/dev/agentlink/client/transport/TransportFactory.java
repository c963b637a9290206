package dev.agentlink.client.transport;

import dev.agentlink.client.ServerConfig;
import dev.agentlink.transport.Transport;
import dev.agentlink.transport.TransportException;

/**
 * Opens the transport a connection runs on. Injected into the client so tests can substitute
 * in-memory transports.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport open(String serverName, ServerConfig config) throws TransportException;
}
