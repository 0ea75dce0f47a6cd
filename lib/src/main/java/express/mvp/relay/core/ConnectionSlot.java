package express.mvp.relay.core;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One reusable slot of the {@link ConnectionPool}.
 *
 * <p>A slot has a stable numeric {@link #id()} assigned when the pool creates it, and at most one
 * attached {@link ClientStream}. Occupancy is derived from the stream reference: a slot with no
 * stream is empty and may be handed out again by {@link ConnectionPool#findOrCreateEmptySlot()}.
 *
 * <h2>Locking</h2>
 *
 * <p>Each slot owns a {@link ReentrantLock} that guards only the stream reference. The lock is held
 * for attach, release, occupancy checks and stream lookups, and never across a blocking read, a
 * network write or a close. Writes are serialized by the stream itself, so a handler forwarding to
 * this slot holds at most one lock at any time.
 *
 * <pre>
 *   empty ──attach(stream)──▶ occupied ──release(stream)──▶ empty
 * </pre>
 */
public final class ConnectionSlot {

    private static final Logger LOGGER = Logger.getLogger(ConnectionSlot.class.getName());

    private final long id;

    private final ReentrantLock lock = new ReentrantLock();

    /** Attached stream, or null while the slot is empty. Guarded by {@link #lock}. */
    private ClientStream stream;

    /**
     * Creates an empty slot.
     *
     * @param id the slot identity, fixed for the slot's lifetime
     */
    ConnectionSlot(long id) {
        this.id = id;
    }

    /**
     * Returns the slot identity.
     *
     * @return the id assigned by the pool
     */
    public long id() {
        return id;
    }

    /**
     * Checks whether a stream is currently attached.
     *
     * @return true if occupied
     */
    public boolean isOccupied() {
        lock.lock();
        try {
            return stream != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the attached stream.
     *
     * @return the current stream, or null if the slot is empty
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Peers forward through this stream; it serializes its own writes.")
    public ClientStream stream() {
        lock.lock();
        try {
            return stream;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the remote address of the attached client.
     *
     * @return the peer address, or null if the slot is empty
     */
    public PeerAddress peerAddress() {
        ClientStream current = stream();
        return current != null ? current.remoteAddress() : null;
    }

    /**
     * Attaches a freshly accepted stream to this slot.
     *
     * @param newStream the accepted client stream
     * @throws IllegalStateException if the slot is already occupied
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The slot takes ownership of the accepted stream.")
    public void attach(ClientStream newStream) {
        if (newStream == null) {
            throw new NullPointerException("stream must not be null");
        }
        lock.lock();
        try {
            if (stream != null) {
                throw new IllegalStateException("Slot " + id + " is already occupied");
            }
            stream = newStream;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes {@code expected} and empties the slot, provided it is still the attached stream.
     *
     * <p>The slot is emptied under its lock and the stream is closed after the lock is dropped, so
     * occupancy checks never wait on a slow close. A close failure is logged; the slot stays empty.
     *
     * @param expected the stream the caller attached or was handed
     * @return true if the slot was emptied by this call
     */
    public boolean release(ClientStream expected) {
        lock.lock();
        try {
            if (expected == null || stream != expected) {
                return false;
            }
            stream = null;
        } finally {
            lock.unlock();
        }
        closeQuietly(expected);
        return true;
    }

    /**
     * Closes whatever stream is attached without emptying the slot.
     *
     * <p>Used on shutdown: the close unblocks the owning handler's read, and the handler then
     * releases the slot through its normal closing path.
     */
    void forceClose() {
        ClientStream current = stream();
        if (current != null) {
            closeQuietly(current);
        }
    }

    /**
     * Sends {@code data} to the attached client.
     *
     * <p>The stream reference is taken under the slot lock; the write itself happens outside it.
     *
     * @param data the payload
     * @return false if the slot was empty and nothing was sent
     * @throws IOException if the write fails
     */
    public boolean send(byte[] data) throws IOException {
        ClientStream current = stream();
        if (current == null) {
            return false;
        }
        current.write(data);
        return true;
    }

    private void closeQuietly(ClientStream target) {
        try {
            target.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to close stream of slot " + id, e);
        }
    }

    @Override
    public String toString() {
        ClientStream current = stream();
        return current != null
                ? "ConnectionSlot[" + id + ":" + current.remoteAddress() + "]"
                : "ConnectionSlot[" + id + ":empty]";
    }
}
