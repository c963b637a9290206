package dev.agentlink.protocol;

import java.util.List;

import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.agentlink.protocol.EnvelopeCodec.DecodeResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EnvelopeCodecTests {

    @Test
    void requestSurvivesEncodeAndDecode() {
        ObjectNode params = Json.object().put("name", "read_file");
        params.putObject("arguments").put("path", "/tmp/x");
        Envelope request = Envelope.request(7L, "tools/call", params);

        DecodeResult decoded = EnvelopeCodec.decode(EnvelopeCodec.encodeBytes(request));

        assertThat(decoded.isSuccess()).isTrue();
        assertThat(decoded.envelope()).isEqualTo(request);
        assertThat(decoded.envelope().isRequest()).isTrue();
    }

    @Test
    void validEnvelopesDecodeToTheEnvelopeThatWasEncoded() {
        ObjectNode params = Json.object().put("uri", "mem://a");
        List<Envelope> envelopes = List.of(
            Envelope.request("req-1", "resources/read", params),
            Envelope.request(42L, "ping", null),
            Envelope.notification("initialized", null),
            Envelope.notification("notifications/progress", Json.object().put("progress", 3)),
            Envelope.success("req-1", Json.object().put("ok", true)),
            Envelope.success(5L, NullNode.getInstance()),
            Envelope.failure(1L, new RpcError(-32603, "x", NullNode.getInstance())),
            Envelope.failure("e", new RpcError(-32001, "Resource mem://b not found", Json.object().put("uri", "mem://b"))),
            Envelope.failure(9L, new RpcError(-32099, "custom", null)));

        for (Envelope envelope : envelopes) {
            DecodeResult decoded = EnvelopeCodec.decode(EnvelopeCodec.encode(envelope));

            assertThat(decoded.isSuccess()).isTrue();
            assertThat(decoded.envelope()).isEqualTo(envelope);
            assertThat(EnvelopeCodec.validate(decoded.envelope())).isEmpty();
        }
    }

    @Test
    void nullErrorDataIsTreatedAsAbsent() {
        RpcError error = new RpcError(-32603, "x", NullNode.getInstance());

        assertThat(error.data()).isNull();
        assertThat(EnvelopeCodec.encode(Envelope.failure(1L, error))).doesNotContain("data");
    }

    @Test
    void stringIdsArePreserved() {
        DecodeResult decoded = EnvelopeCodec.decode("{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"result\":{}}");

        assertThat(decoded.envelope().id()).isEqualTo("abc");
        assertThat(decoded.envelope().isResponse()).isTrue();
    }

    @Test
    void integerIdsAreNormalizedToLong() {
        Envelope envelope = Envelope.success(3, null);

        assertThat(envelope.id()).isEqualTo(3L);
        assertThat(envelope.idKey()).isEqualTo("3");
        assertThat(envelope.result().isObject()).isTrue();
    }

    @Test
    void errorResponseCarriesCodeMessageAndData() {
        Envelope failure = Envelope.failure(1L, ErrorCode.INTERNAL_ERROR, "boom", Json.object().put("message", "boom"));

        Envelope decoded = EnvelopeCodec.decode(EnvelopeCodec.encode(failure)).envelope();

        assertThat(decoded.error().code()).isEqualTo(-32603);
        assertThat(decoded.error().message()).isEqualTo("boom");
        assertThat(decoded.error().data().path("message").asText()).isEqualTo("boom");
    }

    @Test
    void notificationHasNoId() {
        String json = EnvelopeCodec.encode(Envelope.notification("initialized", null));

        assertThat(json).isEqualTo("{\"jsonrpc\":\"2.0\",\"method\":\"initialized\"}");
        assertThat(EnvelopeCodec.decode(json).envelope().isNotification()).isTrue();
    }

    @Test
    void malformedInputYieldsFailureInsteadOfThrowing() {
        assertThat(EnvelopeCodec.decode("{not json").isSuccess()).isFalse();
        assertThat(EnvelopeCodec.decode("[1,2]").error()).contains("not a JSON object");
        assertThat(EnvelopeCodec.decode("").isSuccess()).isFalse();
        assertThat(EnvelopeCodec.decode((byte[]) null).isSuccess()).isFalse();
        assertThat(EnvelopeCodec.decode("{\"jsonrpc\":\"2.0\",\"id\":1.5,\"result\":{}}").error()).contains("id");
        assertThat(EnvelopeCodec.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":5}").error()).contains("method");
        assertThat(EnvelopeCodec.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":\"bad\"}").error()).contains("error");
    }

    @Test
    void validateRejectsWrongVersion() {
        Envelope envelope = new Envelope("1.0", 1L, "ping", null, null, null);

        assertThat(EnvelopeCodec.validate(envelope)).hasValueSatisfying(msg -> assertThat(msg).contains("version"));
    }

    @Test
    void validateRejectsRequestWithResult() {
        Envelope envelope = new Envelope(Envelope.VERSION, 1L, "ping", null, Json.object(), null);

        assertThat(EnvelopeCodec.validate(envelope)).contains("Request cannot have result or error");
    }

    @Test
    void validateRejectsResponseWithoutIdOrWithBothPayloads() {
        Envelope noId = new Envelope(Envelope.VERSION, null, null, null, Json.object(), null);
        Envelope both = new Envelope(Envelope.VERSION, 1L, null, null, Json.object(), new RpcError(-32603, "x", null));
        Envelope empty = new Envelope(Envelope.VERSION, 1L, null, null, null, null);

        assertThat(EnvelopeCodec.validate(noId)).contains("Response must have id");
        assertThat(EnvelopeCodec.validate(both)).contains("Response cannot have both result and error");
        assertThat(EnvelopeCodec.validate(empty)).contains("Message must be either request or response");
    }

    @Test
    void validateAcceptsWellFormedMessages() {
        assertThat(EnvelopeCodec.validate(Envelope.request(1L, "ping", null))).isEmpty();
        assertThat(EnvelopeCodec.validate(Envelope.notification("initialized", null))).isEmpty();
        assertThat(EnvelopeCodec.validate(Envelope.success("a", Json.object()))).isEmpty();
    }

    @Test
    void unknownErrorCodesKeepTheirNumericValue() {
        McpException exception = McpException.fromRpcError(new RpcError(-31999, "custom", null));

        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(exception.getCode()).isEqualTo(-31999);
        assertThat(exception.toRpcError().code()).isEqualTo(-31999);
    }

}
