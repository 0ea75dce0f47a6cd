package express.mvp.relay.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Listening endpoint that yields one {@link ClientStream} per inbound connection.
 *
 * <p>Accept is called from a single accept thread. {@link #close()} may be called from any thread
 * and must cause a blocked {@link #accept()} to fail promptly.
 */
public interface ClientListener extends Closeable {

    /**
     * Blocks until a client connects.
     *
     * @return the accepted client stream
     * @throws IOException if this accept attempt fails or the listener has been closed
     */
    ClientStream accept() throws IOException;

    /**
     * Returns the local port the listener is bound to.
     *
     * @return the bound port
     */
    int localPort();

    /**
     * Checks whether the listener has been closed.
     *
     * @return true once closed
     */
    boolean isClosed();
}
