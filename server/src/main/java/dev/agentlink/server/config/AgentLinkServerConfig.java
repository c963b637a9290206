package dev.agentlink.server.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.agentlink.protocol.model.Capabilities;
import dev.agentlink.protocol.model.PeerInfo;
import dev.agentlink.server.dispatch.McpServerDefinition;
import dev.agentlink.server.dispatch.PromptRegistry;
import dev.agentlink.server.dispatch.ResourceRegistry;
import dev.agentlink.server.dispatch.ToolRegistry;
import dev.agentlink.server.tools.DemoTools;
import dev.agentlink.server.tools.ServerInfoResource;

/**
 * Spring configuration class that assembles the registries and the server definition shared by
 * every session, whatever front end is selected.
 */
@Configuration
@EnableConfigurationProperties(AgentLinkServerProperties.class)
public class AgentLinkServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(AgentLinkServerConfig.class);

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public ToolRegistry toolRegistry(DemoTools demoTools) {
		ToolRegistry registry = new ToolRegistry();
		registry.register(demoTools.echoTool(), demoTools::echo);
		registry.register(demoTools.timeTool(), demoTools::currentTime);
		return registry;
	}

	@Bean
	public ResourceRegistry resourceRegistry(ServerInfoResource serverInfoResource) {
		return new ResourceRegistry().register(serverInfoResource.resource(), serverInfoResource::read);
	}

	@Bean
	public PromptRegistry promptRegistry(DemoTools demoTools) {
		return new PromptRegistry().register(demoTools.summarizePrompt());
	}

	/**
	 * Build the definition every session dispatcher is created from.
	 * @param properties server properties
	 * @param tools tool registry
	 * @param resources resource registry
	 * @param prompts prompt registry
	 * @return shared server definition
	 */
	@Bean
	public McpServerDefinition serverDefinition(AgentLinkServerProperties properties, ToolRegistry tools,
			ResourceRegistry resources, PromptRegistry prompts) {
		McpServerDefinition definition = new McpServerDefinition(
				new PeerInfo(properties.getName(), properties.getVersion()),
				Capabilities.of(properties.getCapabilities()), tools, resources, prompts);
		logger.info("Server {} advertising {} via {} transport", definition.serverInfo().displayLabel(),
				properties.getCapabilities(), properties.getTransport());
		return definition;
	}

	/**
	 * Pool running non-lifecycle requests for all sessions. Its threads are daemons so the
	 * front end alone decides how long the process lives.
	 * @param properties server properties
	 * @return handler pool
	 */
	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService handlerPool(AgentLinkServerProperties properties) {
		AtomicInteger counter = new AtomicInteger();
		return Executors.newFixedThreadPool(Math.max(1, properties.getHandlerThreads()), r -> {
			Thread t = new Thread(r, "mcp-handler-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

}
