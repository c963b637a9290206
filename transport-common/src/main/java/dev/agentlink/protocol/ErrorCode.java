package dev.agentlink.protocol;

import java.util.Optional;

/**
 * Error taxonomy: the standard JSON-RPC codes, the domain extensions servers send, and a few
 * client-local conditions that never travel on the wire.
 */
public enum ErrorCode {

    PARSE_ERROR(-32700, true),
    INVALID_REQUEST(-32600, true),
    METHOD_NOT_FOUND(-32601, true),
    INVALID_PARAMS(-32602, true),
    INTERNAL_ERROR(-32603, true),

    TOOL_NOT_FOUND(-32000, true),
    RESOURCE_NOT_FOUND(-32001, true),
    PROMPT_NOT_FOUND(-32002, true),
    CAPABILITY_NOT_SUPPORTED(-32003, true),

    TIMEOUT(-32010, false),
    CONNECTION_CLOSED(-32011, false),
    CONNECT_FAILED(-32012, false),
    TRANSPORT_FAILURE(-32013, false);

    private final int code;
    private final boolean wire;

    ErrorCode(int code, boolean wire) {
        this.code = code;
        this.wire = wire;
    }

    public int code() {
        return code;
    }

    /**
     * Whether a peer may legitimately send this code in an error response.
     */
    public boolean isWireCode() {
        return wire;
    }

    public static Optional<ErrorCode> fromCode(int code) {
        for (ErrorCode candidate : values()) {
            if (candidate.code == code) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
