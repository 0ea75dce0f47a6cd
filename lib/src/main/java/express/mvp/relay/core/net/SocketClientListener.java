package express.mvp.relay.core.net;

import express.mvp.relay.core.ClientListener;
import express.mvp.relay.core.ClientStream;
import express.mvp.relay.core.RelayException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ClientListener} backed by a blocking {@link ServerSocket}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (SocketClientListener listener =
 *         SocketClientListener.bind("0.0.0.0", 7000, 50, Duration.ZERO)) {
 *     ClientStream client = listener.accept();
 *     client.write("Hello".getBytes(StandardCharsets.UTF_8));
 * }
 * }</pre>
 */
public final class SocketClientListener implements ClientListener {

    private static final Logger LOGGER = Logger.getLogger(SocketClientListener.class.getName());

    private final ServerSocket serverSocket;

    /** Read timeout applied to accepted sockets, 0 for none. */
    private final int readTimeoutMillis;

    private SocketClientListener(ServerSocket serverSocket, int readTimeoutMillis) {
        this.serverSocket = serverSocket;
        this.readTimeoutMillis = readTimeoutMillis;
    }

    /**
     * Creates a listening socket bound to {@code host:port}.
     *
     * @param host the local address to bind, e.g. {@code "0.0.0.0"}
     * @param port the TCP port, or 0 for an ephemeral port
     * @param backlog the accept backlog
     * @param readTimeout read timeout for accepted clients; zero or negative disables it
     * @return the bound listener
     * @throws RelayException if the socket cannot be created or bound
     */
    public static SocketClientListener bind(
            String host, int port, int backlog, Duration readTimeout) {
        ServerSocket socket = null;
        try {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(host, port), backlog);
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            if (socket != null) {
                try {
                    socket.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new RelayException("Failed to bind listening socket to " + host + ":" + port, e);
        }

        long timeoutMillis = readTimeout == null || readTimeout.isNegative()
                ? 0
                : readTimeout.toMillis();
        return new SocketClientListener(socket, (int) Math.min(timeoutMillis, Integer.MAX_VALUE));
    }

    @Override
    public ClientStream accept() throws IOException {
        Socket socket = serverSocket.accept();
        try {
            socket.setTcpNoDelay(true);
            if (readTimeoutMillis > 0) {
                socket.setSoTimeout(readTimeoutMillis);
            }
            return new SocketClientStream(socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public int localPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public boolean isClosed() {
        return serverSocket.isClosed();
    }

    @Override
    public void close() throws IOException {
        if (!serverSocket.isClosed()) {
            LOGGER.log(Level.FINE, "Closing listener on port {0}", serverSocket.getLocalPort());
            serverSocket.close();
        }
    }
}
