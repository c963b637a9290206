package dev.agentlink.protocol.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of {@code resources/read}.
 * @param contents one entry per returned resource
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadResourceResult(List<ResourceContents> contents) {

	public ReadResourceResult {
		contents = contents == null ? List.of() : List.copyOf(contents);
	}

}
