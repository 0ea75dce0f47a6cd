package express.mvp.relay.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Bidirectional byte stream for one accepted client.
 *
 * <p>This is the transport boundary of the relay core. The core only reads chunks, writes
 * payloads and closes the stream; it never inspects anything transport-specific beyond the
 * displayable {@link #remoteAddress()}.
 *
 * <h2>Thread Safety</h2>
 *
 * <ul>
 *   <li>{@link #read(byte[])} is only ever called by the connection's own handler thread
 *   <li>{@link #write(byte[])} may be called concurrently by the owning handler (echo) and by
 *       peer handlers (broadcast); implementations must serialize writes so payloads never
 *       interleave
 *   <li>{@link #close()} may be called from any thread and must be idempotent; a close must
 *       unblock a pending read
 * </ul>
 *
 * @see ClientListener
 */
public interface ClientStream extends Closeable {

    /**
     * Reads the next chunk of bytes into {@code buffer}, blocking until data is available.
     *
     * @param buffer the destination buffer; at most {@code buffer.length} bytes are read
     * @return the number of bytes read, or -1 at end of stream
     * @throws IOException if the read fails, times out or the stream has been closed
     */
    int read(byte[] buffer) throws IOException;

    /**
     * Writes the whole payload to the client.
     *
     * @param data the bytes to send
     * @throws IOException if the write fails or the stream has been closed
     */
    void write(byte[] data) throws IOException;

    /**
     * Returns the remote endpoint captured when the connection was accepted.
     *
     * @return the peer address
     */
    PeerAddress remoteAddress();

    /**
     * Checks whether {@link #close()} has been called.
     *
     * @return true once the stream is closed
     */
    boolean isClosed();

    /**
     * Closes the stream. Subsequent calls have no effect.
     *
     * @throws IOException if the underlying transport fails to close cleanly
     */
    @Override
    void close() throws IOException;
}
