package dev.agentlink.server.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import dev.agentlink.protocol.model.Prompt;
import dev.agentlink.protocol.model.PromptResult;

@FunctionalInterface
public interface PromptRenderer {

    PromptResult render(Prompt prompt, JsonNode arguments) throws Exception;
}
