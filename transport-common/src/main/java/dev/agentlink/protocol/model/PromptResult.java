package dev.agentlink.protocol.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of {@code prompts/get}.
 * @param description description of the rendered prompt
 * @param messages rendered messages
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptResult(String description, List<PromptMessage> messages) {

	public PromptResult {
		messages = messages == null ? List.of() : List.copyOf(messages);
	}

}
