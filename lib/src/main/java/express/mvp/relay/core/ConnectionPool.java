package express.mvp.relay.core;

import java.util.List;
import java.util.Optional;

/**
 * Growable pool of {@link ConnectionSlot}s for accepted client connections.
 *
 * <p>The pool owns every slot for the lifetime of the server. Slots are never removed; a slot is
 * reused by attaching a new stream once its previous session has released it.
 *
 * <h2>Slot Lifecycle</h2>
 *
 * <ol>
 *   <li><b>Find:</b> {@link #findOrCreateEmptySlot()}
 *       <ul>
 *         <li>Returns the first empty slot in creation order
 *         <li>Appends one new slot if every slot is occupied
 *         <li>Fails with {@link PoolExhaustedException} if a bounded pool is full
 *       </ul>
 *   <li><b>Attach:</b> the accept loop attaches the accepted stream with {@link
 *       ConnectionSlot#attach(ClientStream)}
 *   <li><b>Release:</b> the connection's handler empties the slot with {@link
 *       ConnectionSlot#release(ClientStream)}
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionPool pool = new ConnectionPoolImpl(10);
 *
 * ConnectionSlot slot = pool.findOrCreateEmptySlot();
 * slot.attach(listener.accept());
 *
 * for (ConnectionSlot peer : pool.snapshotOthers(slot.id())) {
 *     peer.send(payload);
 * }
 * }</pre>
 *
 * @see ConnectionSlot
 * @see PeerView
 */
public interface ConnectionPool {

    /**
     * Returns an empty slot, growing the pool by one slot if none is free.
     *
     * <p>The returned slot is empty at the time of the call. Callers are expected to attach a
     * stream from a single accept thread.
     *
     * @return an empty slot
     * @throws PoolExhaustedException if the pool is bounded and already at its maximum size
     */
    ConnectionSlot findOrCreateEmptySlot();

    /**
     * Returns every slot occupied at call time except the one with {@code excludeId}.
     *
     * @param excludeId the id of the slot to leave out
     * @return an unmodifiable list of occupied slots, in creation order
     */
    List<ConnectionSlot> snapshotOthers(long excludeId);

    /**
     * Looks up a slot by id.
     *
     * @param id the slot id
     * @return the slot, or empty if no slot has that id
     */
    Optional<ConnectionSlot> findSlot(long id);

    /**
     * Returns all slots in creation order.
     *
     * @return an unmodifiable view of the slots
     */
    List<ConnectionSlot> slots();

    /**
     * Returns the number of slots, empty or occupied.
     *
     * @return the pool size
     */
    int size();

    /**
     * Returns the number of occupied slots.
     *
     * @return the occupied slot count
     */
    int occupiedCount();

    /**
     * Closes every attached stream.
     *
     * <p>Slots are emptied by their handlers once the close unblocks their reads.
     */
    void closeAll();
}
