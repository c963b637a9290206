package dev.agentlink.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Encodes envelopes to JSON text and back. Decoding is total: malformed input yields a failed
 * {@link DecodeResult} instead of an exception, so a reader loop can drop the message and carry
 * on.
 */
public final class EnvelopeCodec {

    private EnvelopeCodec() {
    }

    public static ObjectNode toTree(Envelope envelope) {
        ObjectNode node = Json.object();
        node.put("jsonrpc", envelope.jsonrpc());
        Object id = envelope.id();
        if (id instanceof Long value) {
            node.put("id", value);
        } else if (id != null) {
            node.put("id", id.toString());
        }
        if (envelope.method() != null) {
            node.put("method", envelope.method());
        }
        if (envelope.params() != null) {
            node.set("params", envelope.params());
        }
        if (envelope.result() != null) {
            node.set("result", envelope.result());
        }
        RpcError error = envelope.error();
        if (error != null) {
            ObjectNode errorNode = node.putObject("error");
            errorNode.put("code", error.code());
            errorNode.put("message", error.message());
            if (error.data() != null) {
                errorNode.set("data", error.data());
            }
        }
        return node;
    }

    public static String encode(Envelope envelope) {
        return toTree(envelope).toString();
    }

    public static byte[] encodeBytes(Envelope envelope) {
        return encode(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public static DecodeResult decode(byte[] bytes) {
        if (bytes == null) {
            return DecodeResult.failure("no input");
        }
        return decode(new String(bytes, StandardCharsets.UTF_8));
    }

    public static DecodeResult decode(String text) {
        if (text == null || text.isBlank()) {
            return DecodeResult.failure("empty message");
        }
        JsonNode node;
        try {
            node = Json.parse(text);
        } catch (JsonProcessingException e) {
            return DecodeResult.failure("malformed JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            return DecodeResult.failure("message is not a JSON object");
        }
        return fromTree((ObjectNode) node);
    }

    public static DecodeResult fromTree(ObjectNode node) {
        JsonNode version = node.get("jsonrpc");
        if (version != null && !version.isTextual()) {
            return DecodeResult.failure("jsonrpc must be a string");
        }

        Object id = null;
        JsonNode idNode = node.get("id");
        if (idNode != null && !idNode.isNull()) {
            if (idNode.isTextual()) {
                id = idNode.asText();
            } else if (idNode.isIntegralNumber() && idNode.canConvertToLong()) {
                id = idNode.longValue();
            } else {
                return DecodeResult.failure("id must be a string or an integer");
            }
        }

        JsonNode methodNode = node.get("method");
        if (methodNode != null && !methodNode.isTextual()) {
            return DecodeResult.failure("method must be a string");
        }

        RpcError error = null;
        JsonNode errorNode = node.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            if (!errorNode.isObject() || !errorNode.path("code").isIntegralNumber()) {
                return DecodeResult.failure("error must be an object with an integer code");
            }
            JsonNode data = errorNode.get("data");
            error = new RpcError(errorNode.get("code").intValue(), errorNode.path("message").asText(""),
                data == null || data.isNull() ? null : data);
        }

        return DecodeResult.success(new Envelope(
            version == null ? null : version.asText(),
            id,
            methodNode == null ? null : methodNode.asText(),
            node.get("params"),
            node.get("result"),
            error));
    }

    /**
     * Checks the structural invariants of a decoded message.
     *
     * @return a description of the first violated rule, or empty when the message is valid
     */
    public static Optional<String> validate(Envelope envelope) {
        if (!Envelope.VERSION.equals(envelope.jsonrpc())) {
            return Optional.of("Invalid JSON-RPC version: " + envelope.jsonrpc());
        }
        boolean hasResult = envelope.result() != null;
        boolean hasError = envelope.error() != null;
        if (envelope.method() != null) {
            if (hasResult || hasError) {
                return Optional.of("Request cannot have result or error");
            }
            if (envelope.method().isEmpty()) {
                return Optional.of("Method name must not be empty");
            }
            return Optional.empty();
        }
        if (hasResult || hasError) {
            if (envelope.id() == null) {
                return Optional.of("Response must have id");
            }
            if (hasResult && hasError) {
                return Optional.of("Response cannot have both result and error");
            }
            return Optional.empty();
        }
        return Optional.of("Message must be either request or response");
    }

    /**
     * Outcome of {@link #decode(String)}: exactly one of envelope and error is set.
     */
    public record DecodeResult(Envelope envelope, String error) {

        static DecodeResult success(Envelope envelope) {
            return new DecodeResult(envelope, null);
        }

        static DecodeResult failure(String error) {
            return new DecodeResult(null, error);
        }

        public boolean isSuccess() {
            return envelope != null;
        }
    }
}
