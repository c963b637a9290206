package dev.agentlink.protocol.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@code tools/call}.
 * @param content content blocks produced by the tool
 * @param isError {@code true} when the tool reports a domain-level failure in its content
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolResult(List<Content> content, @JsonProperty("isError") boolean isError) {

	public ToolResult {
		content = content == null ? List.of() : List.copyOf(content);
	}

	public static ToolResult text(String text) {
		return new ToolResult(List.of(Content.text(text)), false);
	}

}
