package dev.agentlink.transport;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * Newline-delimited envelopes over a pair of byte streams: a child process's standard streams
 * on the client side, or the server's own stdin/stdout.
 */
public class LineTransport extends FramedTransport {

    private final InputStream in;
    private final BufferedReader reader;
    private final BufferedWriter writer;

    public LineTransport(String id, InputStream in, OutputStream out) {
        super(id);
        this.in = in;
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    @Override
    protected void writeFrame(String json) throws IOException {
        writer.write(json);
        writer.write('\n');
        writer.flush();
    }

    @Override
    protected String readFrame() throws IOException {
        String line = reader.readLine();
        return line == null ? null : line.trim();
    }

    /**
     * Closes the raw input stream rather than the reader: closing the reader would wait for a
     * {@code readLine} blocked on another thread.
     */
    @Override
    protected void closeResources() throws IOException {
        try {
            writer.close();
        } finally {
            in.close();
        }
    }
}
