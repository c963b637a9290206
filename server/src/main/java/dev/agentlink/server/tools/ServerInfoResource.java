package dev.agentlink.server.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;

import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.model.Resource;
import dev.agentlink.server.config.AgentLinkServerProperties;

/**
 * Exposes the server's own configuration as a JSON resource.
 */
@Component
@RequiredArgsConstructor
public class ServerInfoResource {

	private static final Logger logger = LoggerFactory.getLogger(ServerInfoResource.class);

	static final String URI = "agentlink://server/info";

	private final AgentLinkServerProperties properties;

	public Resource resource() {
		return new Resource(URI, "server_info", "Name, version and transport of this server", "application/json");
	}

	/**
	 * Render the resource content.
	 * @param resource the registered descriptor
	 * @return JSON text describing this server
	 */
	public String read(Resource resource) {
		logger.debug("Serving {}", resource.uri());
		ObjectNode info = Json.object()
			.put("name", this.properties.getName())
			.put("version", this.properties.getVersion())
			.put("transport", this.properties.getTransport().name().toLowerCase());
		ArrayNode capabilities = info.putArray("capabilities");
		this.properties.getCapabilities().forEach(capability -> capabilities.add(capability.key()));
		return info.toString();
	}

}
