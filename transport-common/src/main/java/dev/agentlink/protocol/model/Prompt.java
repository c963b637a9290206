package dev.agentlink.protocol.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Descriptor of a prompt template as listed by {@code prompts/list}.
 * @param name prompt name
 * @param description human description
 * @param arguments declared parameters
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Prompt(String name, String description, List<PromptArgument> arguments) {

	public Prompt {
		arguments = arguments == null ? List.of() : List.copyOf(arguments);
	}

}
