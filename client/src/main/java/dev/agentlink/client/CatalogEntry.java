package dev.agentlink.client;

/**
 * One discovered item as seen from the client: which server offers it, under which name.
 *
 * @param serverName name the owning server was connected under
 * @param name item name, or URI for resources
 * @param descriptor descriptor as the server listed it
 */
public record CatalogEntry<T>(String serverName, String name, T descriptor) {

    /**
     * {@code server:name}, unique across the client.
     */
    public String qualifiedName() {
        return serverName + ":" + name;
    }
}
