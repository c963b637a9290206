package dev.agentlink.server.dispatch;

import dev.agentlink.protocol.model.Capabilities;
import dev.agentlink.protocol.model.PeerInfo;

/**
 * Everything a session needs to serve a peer: identity, advertised capabilities and the three
 * registries. One definition is shared by all sessions of a server; each session gets its own
 * {@link McpDispatcher}.
 */
public record McpServerDefinition(
    PeerInfo serverInfo,
    Capabilities capabilities,
    ToolRegistry tools,
    ResourceRegistry resources,
    PromptRegistry prompts
) {

    public McpDispatcher newDispatcher(String sessionId) {
        return new McpDispatcher(sessionId, serverInfo, capabilities, tools, resources, prompts);
    }
}
