package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Contents of one resource returned by {@code resources/read}.
 * @param uri resource address
 * @param mimeType content type
 * @param text textual contents
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceContents(String uri, String mimeType, String text) {
}
