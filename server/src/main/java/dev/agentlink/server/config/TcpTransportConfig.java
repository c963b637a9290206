package dev.agentlink.server.config;

import java.util.concurrent.ExecutorService;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.server.transport.TcpServer;

/**
 * Declares the length-prefixed TCP front end when {@code agentlink.server.transport=tcp}.
 */
@Configuration
@ConditionalOnProperty(prefix = "agentlink.server", name = "transport", havingValue = "tcp")
public class TcpTransportConfig {

	@Bean(initMethod = "start", destroyMethod = "stop")
	public TcpServer tcpServer(McpServerDefinition definition, ExecutorService handlerPool,
			AgentLinkServerProperties properties) {
		return new TcpServer(definition, properties.getTcp().getPort(), properties.getMaxMessageBytes(), handlerPool);
	}

}
