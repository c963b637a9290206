package dev.agentlink.server.dispatch;

import dev.agentlink.protocol.model.Tool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open registry of tools served by {@code tools/call}, keyed by tool name. Listing order is
 * registration order.
 */
public class ToolRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Registration> tools = new LinkedHashMap<>();

    public synchronized ToolRegistry register(Tool tool, ToolHandler handler) {
        if (tool.name() == null || tool.name().isBlank()) {
            throw new IllegalArgumentException("Tool name must not be empty");
        }
        if (tools.putIfAbsent(tool.name(), new Registration(tool, handler)) != null) {
            throw new IllegalArgumentException("Tool already registered: " + tool.name());
        }
        LOGGER.info("Registered tool {}", tool.name());
        return this;
    }

    public synchronized boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    public synchronized Optional<Registration> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized List<Tool> list() {
        List<Tool> descriptors = new ArrayList<>(tools.size());
        tools.values().forEach(registration -> descriptors.add(registration.tool()));
        return descriptors;
    }

    public synchronized boolean isEmpty() {
        return tools.isEmpty();
    }

    public record Registration(Tool tool, ToolHandler handler) {
    }
}
