package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Descriptor of a readable resource as listed by {@code resources/list}.
 * @param uri address used by {@code resources/read}
 * @param name short name
 * @param description optional human description
 * @param mimeType optional content type of the resource
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Resource(String uri, String name, String description, String mimeType) {
}
