package dev.agentlink.server.config;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.agentlink.protocol.Capability;

/**
 * Configuration properties for the server: identity reported in {@code initialize}, the session
 * front end to expose and the capability categories to advertise.
 */
@ConfigurationProperties(prefix = "agentlink.server")
public class AgentLinkServerProperties {

	/**
	 * Server name reported to clients.
	 */
	private String name = "agentlink-server";

	/**
	 * Server version reported to clients.
	 */
	private String version = "0.1.0";

	/**
	 * Session front end. Defaults to standard streams.
	 */
	private TransportType transport = TransportType.STDIO;

	/**
	 * Number of threads running tool, resource and prompt handlers.
	 */
	private int handlerThreads = 4;

	/**
	 * Largest accepted message, in bytes, on the TCP and WebSocket front ends.
	 */
	private int maxMessageBytes = 4 * 1024 * 1024;

	/**
	 * Capability categories advertised during the handshake.
	 */
	private Set<Capability> capabilities = EnumSet.of(Capability.TOOLS, Capability.RESOURCES, Capability.PROMPTS);

	private final Tcp tcp = new Tcp();

	private final WebSocket websocket = new WebSocket();

	/**
	 * Retrieve the server name.
	 * @return name reported in {@code serverInfo}
	 */
	public String getName() {
		return name;
	}

	/**
	 * Update the server name.
	 * @param name name reported in {@code serverInfo}
	 */
	public void setName(String name) {
		this.name = name;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	/**
	 * Retrieve the selected front end.
	 * @return currently configured transport
	 */
	public TransportType getTransport() {
		return transport;
	}

	/**
	 * Update the selected front end.
	 * @param transport new transport, {@code null} restores the default
	 */
	public void setTransport(TransportType transport) {
		this.transport = Objects.requireNonNullElse(transport, TransportType.STDIO);
	}

	public int getHandlerThreads() {
		return handlerThreads;
	}

	public void setHandlerThreads(int handlerThreads) {
		this.handlerThreads = handlerThreads;
	}

	public int getMaxMessageBytes() {
		return maxMessageBytes;
	}

	public void setMaxMessageBytes(int maxMessageBytes) {
		this.maxMessageBytes = maxMessageBytes;
	}

	/**
	 * Retrieve the advertised capability categories.
	 * @return categories listed in the {@code initialize} result
	 */
	public Set<Capability> getCapabilities() {
		return capabilities;
	}

	/**
	 * Replace the advertised capability categories.
	 * @param capabilities categories to advertise, {@code null} advertises none
	 */
	public void setCapabilities(Set<Capability> capabilities) {
		this.capabilities = capabilities == null || capabilities.isEmpty() ? EnumSet.noneOf(Capability.class)
				: EnumSet.copyOf(capabilities);
	}

	public Tcp getTcp() {
		return tcp;
	}

	public WebSocket getWebsocket() {
		return websocket;
	}

	/**
	 * Available session front ends.
	 */
	public enum TransportType {
		STDIO, TCP, WEBSOCKET
	}

	/**
	 * Settings of the TCP front end.
	 */
	public static class Tcp {

		/**
		 * Port to listen on; 0 picks a free port.
		 */
		private int port = 7071;

		public int getPort() {
			return port;
		}

		public void setPort(int port) {
			this.port = port;
		}

	}

	/**
	 * Settings of the WebSocket front end.
	 */
	public static class WebSocket {

		/**
		 * HTTP path the WebSocket handler binds to.
		 */
		private String endpoint = "/mcp";

		/**
		 * Origins allowed to open a WebSocket.
		 */
		private String[] allowedOrigins = { "*" };

		public String getEndpoint() {
			return endpoint;
		}

		public void setEndpoint(String endpoint) {
			this.endpoint = endpoint;
		}

		public String[] getAllowedOrigins() {
			return allowedOrigins;
		}

		public void setAllowedOrigins(String[] allowedOrigins) {
			this.allowedOrigins = allowedOrigins;
		}

	}

}
