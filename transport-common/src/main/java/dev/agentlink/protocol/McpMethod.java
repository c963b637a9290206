package dev.agentlink.protocol;

import java.util.Optional;

/**
 * Closed set of built-in protocol methods. Tool calls are routed further by tool name; nothing
 * else is dispatched by free-form strings.
 */
public enum McpMethod {

    INITIALIZE("initialize", null),
    INITIALIZED("initialized", null),
    PING("ping", null),
    LIST_TOOLS("tools/list", Capability.TOOLS),
    CALL_TOOL("tools/call", Capability.TOOLS),
    LIST_RESOURCES("resources/list", Capability.RESOURCES),
    READ_RESOURCE("resources/read", Capability.RESOURCES),
    LIST_PROMPTS("prompts/list", Capability.PROMPTS),
    GET_PROMPT("prompts/get", Capability.PROMPTS);

    /**
     * Spelling of the initialized notification used by peers that namespace notifications.
     */
    public static final String INITIALIZED_NAMESPACED = "notifications/initialized";

    private final String wireName;
    private final Capability capability;

    McpMethod(String wireName, Capability capability) {
        this.wireName = wireName;
        this.capability = capability;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Capability a server has to advertise for this method to be served, or {@code null} for
     * lifecycle methods.
     */
    public Capability capability() {
        return capability;
    }

    public static Optional<McpMethod> fromWireName(String name) {
        if (INITIALIZED_NAMESPACED.equals(name)) {
            return Optional.of(INITIALIZED);
        }
        for (McpMethod method : values()) {
            if (method.wireName.equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
