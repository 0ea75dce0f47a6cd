package express.mvp.relay.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe connection pool implementation.
 *
 * <h2>Implementation Details</h2>
 *
 * <ul>
 *   <li><b>Stable references:</b> slots live in an append-only {@link CopyOnWriteArrayList}, so
 *       growth never invalidates a slot reference held by another thread
 *   <li><b>Growth lock:</b> a pool-wide {@link ReentrantLock} guards the scan-then-append path of
 *       {@link #findOrCreateEmptySlot()}; it is separate from the per-slot locks and never held
 *       across I/O
 *   <li><b>Lock-free reads:</b> snapshots and lookups iterate the list without the growth lock
 * </ul>
 *
 * <h2>Sizing</h2>
 *
 * <p>The pool starts with {@code initialSize} empty slots with ids {@code 0..initialSize-1}.
 * Each growth step appends exactly one slot whose id is one more than the largest existing id.
 * A {@code maxSize} of 0 leaves growth unbounded.
 *
 * @see ConnectionPool
 */
public final class ConnectionPoolImpl implements ConnectionPool {

    private static final Logger LOGGER = Logger.getLogger(ConnectionPoolImpl.class.getName());

    /** Slots in creation order. Append-only. */
    private final List<ConnectionSlot> slots = new CopyOnWriteArrayList<>();

    /** Guards scanning and appending in {@link #findOrCreateEmptySlot()}. */
    private final ReentrantLock growthLock = new ReentrantLock();

    /** Maximum number of slots, or 0 for unbounded. */
    private final int maxSize;

    /**
     * Creates an unbounded pool.
     *
     * @param initialSize number of empty slots to create up front
     */
    public ConnectionPoolImpl(int initialSize) {
        this(initialSize, 0);
    }

    /**
     * Creates a pool with an optional cap.
     *
     * @param initialSize number of empty slots to create up front
     * @param maxSize maximum number of slots, or 0 for unbounded
     * @throws IllegalArgumentException if the sizes are negative or {@code initialSize} exceeds a
     *     non-zero {@code maxSize}
     */
    public ConnectionPoolImpl(int initialSize, int maxSize) {
        if (initialSize < 0) {
            throw new IllegalArgumentException("initialSize must be >= 0: " + initialSize);
        }
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0: " + maxSize);
        }
        if (maxSize > 0 && initialSize > maxSize) {
            throw new IllegalArgumentException(
                    "initialSize " + initialSize + " exceeds maxSize " + maxSize);
        }
        this.maxSize = maxSize;

        List<ConnectionSlot> initial = new ArrayList<>(initialSize);
        for (int i = 0; i < initialSize; i++) {
            initial.add(new ConnectionSlot(i));
        }
        slots.addAll(initial);
    }

    @Override
    public ConnectionSlot findOrCreateEmptySlot() {
        growthLock.lock();
        try {
            for (ConnectionSlot slot : slots) {
                if (!slot.isOccupied()) {
                    return slot;
                }
            }

            if (maxSize > 0 && slots.size() >= maxSize) {
                throw new PoolExhaustedException(maxSize);
            }

            long nextId = 0;
            for (ConnectionSlot slot : slots) {
                nextId = Math.max(nextId, slot.id() + 1);
            }
            ConnectionSlot grown = new ConnectionSlot(nextId);
            slots.add(grown);
            LOGGER.log(Level.FINE, "Connection pool grew to {0} slots", slots.size());
            return grown;
        } finally {
            growthLock.unlock();
        }
    }

    @Override
    public List<ConnectionSlot> snapshotOthers(long excludeId) {
        List<ConnectionSlot> others = new ArrayList<>();
        for (ConnectionSlot slot : slots) {
            if (slot.id() != excludeId && slot.isOccupied()) {
                others.add(slot);
            }
        }
        return Collections.unmodifiableList(others);
    }

    @Override
    public Optional<ConnectionSlot> findSlot(long id) {
        for (ConnectionSlot slot : slots) {
            if (slot.id() == id) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<ConnectionSlot> slots() {
        return Collections.unmodifiableList(slots);
    }

    @Override
    public int size() {
        return slots.size();
    }

    @Override
    public int occupiedCount() {
        int count = 0;
        for (ConnectionSlot slot : slots) {
            if (slot.isOccupied()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void closeAll() {
        for (ConnectionSlot slot : slots) {
            slot.forceClose();
        }
    }

    /**
     * Returns the configured slot cap.
     *
     * @return the maximum size, or 0 if unbounded
     */
    public int getMaxSize() {
        return maxSize;
    }

    @Override
    public String toString() {
        return "ConnectionPoolImpl[size=" + slots.size() + ", occupied=" + occupiedCount() + "]";
    }
}
