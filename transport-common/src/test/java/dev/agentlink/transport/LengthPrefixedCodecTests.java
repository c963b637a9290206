package dev.agentlink.transport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LengthPrefixedCodecTests {

    @Test
    void framesAreReadBackInOrder() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LengthPrefixedCodec.writeFrame(out, "{\"a\":1}");
        LengthPrefixedCodec.writeFrame(out, "{\"b\":\"é\"}");

        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());

        assertThat(LengthPrefixedCodec.readFrame(in)).isEqualTo("{\"a\":1}");
        assertThat(LengthPrefixedCodec.readFrame(in)).isEqualTo("{\"b\":\"é\"}");
        assertThat(LengthPrefixedCodec.readFrame(in)).isNull();
    }

    @Test
    void headerIsBigEndianByteLength() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LengthPrefixedCodec.writeFrame(out, "é");

        byte[] bytes = out.toByteArray();

        assertThat(ByteBuffer.wrap(bytes, 0, 4).getInt()).isEqualTo(2);
        assertThat(bytes).hasSize(6);
    }

    @Test
    void oversizedFrameIsRejected() {
        byte[] header = ByteBuffer.allocate(4).putInt(1024).array();

        assertThatThrownBy(() -> LengthPrefixedCodec.readFrame(new ByteArrayInputStream(header), 512))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Invalid frame length");
    }

    @Test
    void truncatedPayloadIsAnError() {
        byte[] bytes = ByteBuffer.allocate(6).putInt(10).put((byte) '{').put((byte) '}').array();

        assertThatThrownBy(() -> LengthPrefixedCodec.readFrame(new ByteArrayInputStream(bytes)))
            .isInstanceOf(EOFException.class);
    }

}
