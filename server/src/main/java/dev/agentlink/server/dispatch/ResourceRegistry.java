package dev.agentlink.server.dispatch;

import dev.agentlink.protocol.model.Resource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resources served by {@code resources/read}, keyed by URI.
 */
public class ResourceRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceRegistry.class);

    /**
     * Reader used for resources registered without one: it answers with a short placeholder.
     */
    public static final ResourceReader PLACEHOLDER = resource -> "Content of " + resource.name();

    private final Map<String, Registration> resources = new LinkedHashMap<>();

    public ResourceRegistry register(Resource resource) {
        return register(resource, PLACEHOLDER);
    }

    public synchronized ResourceRegistry register(Resource resource, ResourceReader reader) {
        if (resource.uri() == null || resource.uri().isBlank()) {
            throw new IllegalArgumentException("Resource URI must not be empty");
        }
        if (resources.putIfAbsent(resource.uri(), new Registration(resource, reader)) != null) {
            throw new IllegalArgumentException("Resource already registered: " + resource.uri());
        }
        LOGGER.info("Registered resource {}", resource.uri());
        return this;
    }

    public synchronized Optional<Registration> find(String uri) {
        return Optional.ofNullable(resources.get(uri));
    }

    public synchronized List<Resource> list() {
        List<Resource> descriptors = new ArrayList<>(resources.size());
        resources.values().forEach(registration -> descriptors.add(registration.resource()));
        return descriptors;
    }

    public synchronized boolean isEmpty() {
        return resources.isEmpty();
    }

    public record Registration(Resource resource, ResourceReader reader) {
    }
}
