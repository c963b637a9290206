package dev.agentlink.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Frames that start with a four-byte big-endian length followed by that many bytes of UTF-8
 * JSON text.
 */
public final class LengthPrefixedCodec {

    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private LengthPrefixedCodec() {
    }

    public static void writeFrame(OutputStream out, String json) throws IOException {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        byte[] header = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(header);
        out.write(payload);
        out.flush();
    }

    /**
     * Reads the next frame.
     *
     * @return the frame text, or {@code null} when the stream ended cleanly between frames
     * @throws IOException when the declared length is negative or above {@code maxFrameBytes},
     *     or the stream ends inside a frame
     */
    public static String readFrame(InputStream in, int maxFrameBytes) throws IOException {
        byte[] header = readFully(in, 4);
        if (header == null) {
            return null;
        }
        int length = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (length < 0 || length > maxFrameBytes) {
            throw new IOException("Invalid frame length: " + length);
        }
        byte[] payload = readFully(in, length);
        if (payload == null) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    public static String readFrame(InputStream in) throws IOException {
        return readFrame(in, DEFAULT_MAX_FRAME_BYTES);
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                if (offset == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream after reading " + offset + " bytes");
            }
            offset += read;
        }
        return buffer;
    }
}
