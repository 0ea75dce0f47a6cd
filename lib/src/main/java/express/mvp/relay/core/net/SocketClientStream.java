package express.mvp.relay.core.net;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.relay.core.ClientStream;
import express.mvp.relay.core.PeerAddress;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ClientStream} over a connected {@link Socket}.
 *
 * <p>Writes are serialized with a dedicated lock so an echo from the owning handler and forwards
 * from peer handlers never interleave on the wire. Reads take no lock; only the owning handler
 * reads.
 */
public final class SocketClientStream implements ClientStream {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final PeerAddress remoteAddress;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Wraps an accepted socket.
     *
     * @param socket the connected socket; ownership passes to this stream
     * @throws IOException if the socket's streams cannot be obtained
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Ownership of the accepted socket passes to this stream.")
    public SocketClientStream(Socket socket) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.remoteAddress = PeerAddress.of(socket.getRemoteSocketAddress());
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        return in.read(buffer, 0, buffer.length);
    }

    @Override
    public void write(byte[] data) throws IOException {
        writeLock.lock();
        try {
            out.write(data);
            out.flush();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public PeerAddress remoteAddress() {
        return remoteAddress;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            socket.close();
        }
    }

    @Override
    public String toString() {
        return "SocketClientStream[" + remoteAddress + (closed.get() ? ", closed]" : "]");
    }
}
