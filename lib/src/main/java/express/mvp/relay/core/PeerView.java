package express.mvp.relay.core;

import java.util.List;
import java.util.Objects;

/**
 * Source of broadcast targets for one connection.
 *
 * <p>Two views are available:
 *
 * <ul>
 *   <li>{@link #live(ConnectionPool, long)} re-queries the pool on every broadcast, so clients that
 *       join later receive the connection's messages
 *   <li>{@link #snapshot(List)} freezes the peers occupied when the connection was accepted; later
 *       arrivals are never added
 * </ul>
 *
 * <p>In both cases the handler checks each peer's current occupancy before forwarding, so a peer
 * that has disconnected is skipped rather than removed.
 */
@FunctionalInterface
public interface PeerView {

    /**
     * Returns the peers to forward the next message to.
     *
     * @return candidate peer slots, in creation order
     */
    List<ConnectionSlot> peers();

    /**
     * Creates a view that asks the pool for the current occupied peers on every call.
     *
     * @param pool the pool to query
     * @param selfId the id of the connection's own slot
     * @return a live peer view
     */
    static PeerView live(ConnectionPool pool, long selfId) {
        Objects.requireNonNull(pool, "pool must not be null");
        return () -> pool.snapshotOthers(selfId);
    }

    /**
     * Creates a view over a fixed list of peers.
     *
     * @param peers the peers captured at accept time
     * @return a frozen peer view
     */
    static PeerView snapshot(List<ConnectionSlot> peers) {
        List<ConnectionSlot> frozen = List.copyOf(peers);
        return () -> frozen;
    }
}
