package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One rendered message of a prompt.
 * @param role conversational role, {@code user} or {@code assistant}
 * @param content message body
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptMessage(String role, Content content) {
}
