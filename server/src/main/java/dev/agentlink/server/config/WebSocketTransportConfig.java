package dev.agentlink.server.config;

import java.util.concurrent.ExecutorService;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.server.transport.WebSocketServerHandler;

/**
 * Registers the WebSocket front end with the servlet container when
 * {@code agentlink.server.transport=websocket}. Requires a servlet web application, which the
 * {@code websocket} profile switches on.
 */
@Configuration
@EnableWebSocket
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "agentlink.server", name = "transport", havingValue = "websocket")
public class WebSocketTransportConfig implements WebSocketConfigurer {

	private final AgentLinkServerProperties properties;

	private final McpServerDefinition definition;

	private final ExecutorService handlerPool;

	public WebSocketTransportConfig(AgentLinkServerProperties properties, McpServerDefinition definition,
			ExecutorService handlerPool) {
		this.properties = properties;
		this.definition = definition;
		this.handlerPool = handlerPool;
	}

	@Bean(destroyMethod = "shutdown")
	public WebSocketServerHandler webSocketServerHandler() {
		return new WebSocketServerHandler(this.definition, this.handlerPool);
	}

	/**
	 * Raise the container's text buffer so whole envelopes fit in one message.
	 * @return container settings applied to every WebSocket session
	 */
	@Bean
	public ServletServerContainerFactoryBean webSocketContainer() {
		ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
		container.setMaxTextMessageBufferSize(this.properties.getMaxMessageBytes());
		container.setMaxBinaryMessageBufferSize(this.properties.getMaxMessageBytes());
		return container;
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(webSocketServerHandler(), this.properties.getWebsocket().getEndpoint())
			.setAllowedOrigins(this.properties.getWebsocket().getAllowedOrigins());
	}

}
