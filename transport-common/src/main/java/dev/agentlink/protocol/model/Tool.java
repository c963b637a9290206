package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import dev.agentlink.protocol.Json;

/**
 * Descriptor of an invocable tool as listed by {@code tools/list}.
 * @param name tool name, unique per server
 * @param description human description
 * @param inputSchema JSON schema of the accepted arguments
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Tool(String name, String description, JsonNode inputSchema) {

	public Tool {
		description = description == null ? "" : description;
		if (inputSchema == null || inputSchema.isNull()) {
			inputSchema = Json.object().put("type", "object");
		}
	}

}
