package dev.agentlink.server.dispatch;

import dev.agentlink.protocol.model.Content;
import dev.agentlink.protocol.model.Prompt;
import dev.agentlink.protocol.model.PromptMessage;
import dev.agentlink.protocol.model.PromptResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prompts served by {@code prompts/get}, keyed by prompt name.
 */
public class PromptRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PromptRegistry.class);

    /**
     * Renderer used for prompts registered without one: a single user message naming the prompt
     * and echoing its arguments.
     */
    public static final PromptRenderer ECHO = (prompt, arguments) -> new PromptResult(prompt.description(),
        List.of(new PromptMessage("user", Content.text(
            "This is the " + prompt.name() + " prompt with arguments: " + arguments))));

    private final Map<String, Registration> prompts = new LinkedHashMap<>();

    public PromptRegistry register(Prompt prompt) {
        return register(prompt, ECHO);
    }

    public synchronized PromptRegistry register(Prompt prompt, PromptRenderer renderer) {
        if (prompt.name() == null || prompt.name().isBlank()) {
            throw new IllegalArgumentException("Prompt name must not be empty");
        }
        if (prompts.putIfAbsent(prompt.name(), new Registration(prompt, renderer)) != null) {
            throw new IllegalArgumentException("Prompt already registered: " + prompt.name());
        }
        LOGGER.info("Registered prompt {}", prompt.name());
        return this;
    }

    public synchronized Optional<Registration> find(String name) {
        return Optional.ofNullable(prompts.get(name));
    }

    public synchronized List<Prompt> list() {
        List<Prompt> descriptors = new ArrayList<>(prompts.size());
        prompts.values().forEach(registration -> descriptors.add(registration.prompt()));
        return descriptors;
    }

    public synchronized boolean isEmpty() {
        return prompts.isEmpty();
    }

    public record Registration(Prompt prompt, PromptRenderer renderer) {
    }
}
