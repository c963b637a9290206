package dev.agentlink.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Length-prefixed envelopes over a TCP socket, one envelope per frame in each direction.
 */
public class SocketTransport extends FramedTransport {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final int maxFrameBytes;

    public SocketTransport(Socket socket) throws IOException {
        this(socket, LengthPrefixedCodec.DEFAULT_MAX_FRAME_BYTES);
    }

    public SocketTransport(Socket socket, int maxFrameBytes) throws IOException {
        super(String.valueOf(socket.getRemoteSocketAddress()));
        this.socket = socket;
        this.socket.setTcpNoDelay(true);
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Opens a connection to {@code host:port}.
     *
     * @throws TransportException when the connection cannot be established within the timeout
     */
    public static SocketTransport connect(String host, int port, Duration connectTimeout) throws TransportException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            return new SocketTransport(socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new TransportException("Unable to connect to " + host + ":" + port + ": " + e.getMessage(), e, true);
        }
    }

    @Override
    protected void writeFrame(String json) throws IOException {
        LengthPrefixedCodec.writeFrame(out, json);
    }

    @Override
    protected String readFrame() throws IOException {
        return LengthPrefixedCodec.readFrame(in, maxFrameBytes);
    }

    @Override
    protected void closeResources() throws IOException {
        if (!socket.isClosed()) {
            socket.close();
        }
    }
}
