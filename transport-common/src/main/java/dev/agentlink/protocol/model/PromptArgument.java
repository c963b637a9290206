package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One named parameter of a prompt template.
 * @param name parameter name
 * @param description optional human description
 * @param required whether {@code prompts/get} must supply the parameter
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptArgument(String name, String description, Boolean required) {
}
