package dev.agentlink.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Name and version one side of a connection announces during the handshake.
 * @param name implementation name
 * @param version implementation version
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeerInfo(String name, String version) {

	/**
	 * Produce the {@code name/version} label used in log lines.
	 * @return display label
	 */
	public String displayLabel() {
		return "%s/%s".formatted(name, version);
	}

}
