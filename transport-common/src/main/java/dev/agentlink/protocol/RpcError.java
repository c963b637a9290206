package dev.agentlink.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Structured failure carried in the {@code error} member of a response.
 *
 * @param code numeric JSON-RPC error code
 * @param message human readable description
 * @param data optional diagnostic payload; a JSON {@code null} is stored as absent
 */
public record RpcError(int code, String message, JsonNode data) {

    public RpcError {
        message = message == null ? "" : message;
        data = data == null || data.isNull() ? null : data;
    }
}
