package dev.agentlink.server.config;

import java.util.concurrent.ExecutorService;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.server.transport.StdioServer;

/**
 * Declares the standard-streams front end when {@code agentlink.server.transport=stdio}, the
 * default.
 */
@Configuration
@ConditionalOnProperty(prefix = "agentlink.server", name = "transport", havingValue = "stdio", matchIfMissing = true)
public class StdioTransportConfig {

	@Bean(initMethod = "start", destroyMethod = "stop")
	public StdioServer stdioServer(McpServerDefinition definition, ExecutorService handlerPool) {
		return new StdioServer(definition, handlerPool);
	}

}
