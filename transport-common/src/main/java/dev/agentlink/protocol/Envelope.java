package dev.agentlink.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One JSON-RPC 2.0 message: a request, a notification or a response.
 *
 * <p>The id is kept as it arrived on the wire, either a {@link String} or a {@link Long}.
 * Responses echo the id of the request they answer unchanged.
 *
 * @param jsonrpc protocol version tag, {@value #VERSION} for every valid message
 * @param id correlation token, {@code null} for notifications
 * @param method invoked operation, present on requests and notifications only
 * @param params argument bag of a request or notification
 * @param result success payload of a response
 * @param error failure payload of a response
 */
public record Envelope(
    String jsonrpc,
    Object id,
    String method,
    JsonNode params,
    JsonNode result,
    RpcError error
) {

    public static final String VERSION = "2.0";

    public Envelope {
        if (id instanceof Integer value) {
            id = value.longValue();
        }
    }

    public static Envelope request(Object id, String method, JsonNode params) {
        return new Envelope(VERSION, id, method, params, null, null);
    }

    public static Envelope notification(String method, JsonNode params) {
        return new Envelope(VERSION, null, method, params, null, null);
    }

    public static Envelope success(Object id, JsonNode result) {
        return new Envelope(VERSION, id, null, null, result == null ? Json.object() : result, null);
    }

    public static Envelope failure(Object id, RpcError error) {
        return new Envelope(VERSION, id, null, null, null, error);
    }

    public static Envelope failure(Object id, ErrorCode code, String message, JsonNode data) {
        return failure(id, new RpcError(code.code(), message, data));
    }

    public boolean hasMethod() {
        return method != null;
    }

    public boolean isRequest() {
        return method != null && id != null;
    }

    /**
     * A notification carries a method and no id; it never receives a response.
     */
    public boolean isNotification() {
        return method != null && id == null;
    }

    public boolean isResponse() {
        return method == null && (result != null || error != null);
    }

    /**
     * Key under which pending calls are correlated. String and numeric ids that print the same
     * resolve to the same pending call.
     */
    public String idKey() {
        return id == null ? null : id.toString();
    }
}
