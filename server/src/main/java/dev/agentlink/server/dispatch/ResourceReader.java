package dev.agentlink.server.dispatch;

import dev.agentlink.protocol.model.Resource;

@FunctionalInterface
public interface ResourceReader {

    /**
     * Produces the text content of a resource.
     */
    String read(Resource resource) throws Exception;
}
