package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a successful {@code initialize} request.
 * @param protocolVersion protocol revision the server speaks
 * @param capabilities categories the server advertises
 * @param serverInfo server name and version
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InitializeResult(String protocolVersion, Capabilities capabilities, PeerInfo serverInfo) {

	public static final String PROTOCOL_VERSION = "2024-11-05";

	public InitializeResult {
		capabilities = capabilities == null ? Capabilities.none() : capabilities;
	}

}
