package dev.agentlink.protocol;

/**
 * Categories of functionality a server may advertise during the handshake.
 */
public enum Capability {

    TOOLS("tools"),
    RESOURCES("resources"),
    PROMPTS("prompts"),
    LOGGING("logging");

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    /**
     * Member name inside the {@code capabilities} object.
     */
    public String key() {
        return key;
    }
}
