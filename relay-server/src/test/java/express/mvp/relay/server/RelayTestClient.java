package express.mvp.relay.server;

import static org.junit.jupiter.api.Assertions.*;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/** Blocking loopback client that reads exact byte counts. */
final class RelayTestClient implements AutoCloseable {

    private static final int READ_TIMEOUT_MILLIS = 5000;

    private final Socket socket;
    private final DataInputStream in;
    private final OutputStream out;

    private RelayTestClient(Socket socket) throws IOException {
        this.socket = socket;
        socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        socket.setTcpNoDelay(true);
        this.in = new DataInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    static RelayTestClient connect(int port) throws IOException {
        return new RelayTestClient(new Socket("127.0.0.1", port));
    }

    /** Connects and consumes the greeting, so the server has attached this client. */
    static RelayTestClient join(int port) throws IOException {
        RelayTestClient client = connect(port);
        client.expect("Hello");
        return client;
    }

    void send(String message) throws IOException {
        out.write(message.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /** Reads exactly as many bytes as {@code expected} encodes to and compares them. */
    void expect(String expected) throws IOException {
        byte[] buffer = new byte[expected.getBytes(StandardCharsets.UTF_8).length];
        in.readFully(buffer);
        assertEquals(expected, new String(buffer, StandardCharsets.UTF_8));
    }

    void expectEndOfStream() throws IOException {
        assertEquals(-1, in.read(), "expected the server to close the connection");
    }

    /** Asserts nothing arrives within {@code millis}. */
    void expectSilence(int millis) throws IOException {
        socket.setSoTimeout(millis);
        try {
            assertThrows(SocketTimeoutException.class, in::read);
        } finally {
            socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        }
    }

    /** Closes with a TCP reset instead of an orderly shutdown. */
    void abort() throws IOException {
        socket.setSoLinger(true, 0);
        socket.close();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
