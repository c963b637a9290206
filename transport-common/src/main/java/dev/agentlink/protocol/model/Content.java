package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One content block of a tool result or prompt message.
 * @param type block type, {@code text} for plain text
 * @param text text payload for text blocks
 * @param data base64 payload for binary blocks
 * @param mimeType content type of binary blocks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Content(String type, String text, String data, String mimeType) {

	public static Content text(String text) {
		return new Content("text", text, null, null);
	}

}
