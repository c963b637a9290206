package dev.agentlink.client.transport;

import dev.agentlink.client.ServerConfig;
import dev.agentlink.transport.SocketTransport;
import dev.agentlink.transport.Transport;
import dev.agentlink.transport.TransportException;

public class DefaultTransportFactory implements TransportFactory {

    @Override
    public Transport open(String serverName, ServerConfig config) throws TransportException {
        return switch (config.kind()) {
            case STDIO -> PipeTransport.start(serverName, config.command(), config.environment());
            case TCP -> SocketTransport.connect(config.host(), config.port(), config.connectTimeout());
            case WEBSOCKET -> WebSocketTransport.connect(config.uri(), config.connectTimeout());
        };
    }
}
