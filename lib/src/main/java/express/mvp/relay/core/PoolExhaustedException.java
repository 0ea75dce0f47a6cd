package express.mvp.relay.core;

/**
 * Thrown by a bounded {@link ConnectionPool} when every slot is occupied and the pool has already
 * grown to its configured maximum.
 */
public class PoolExhaustedException extends RelayException {

    private final int maxSize;

    /**
     * Creates the exception for a pool capped at {@code maxSize} slots.
     *
     * @param maxSize the configured maximum number of slots
     */
    public PoolExhaustedException(int maxSize) {
        super("Connection pool exhausted: all " + maxSize + " slots are occupied");
        this.maxSize = maxSize;
    }

    /**
     * Returns the slot cap that was reached.
     *
     * @return the maximum pool size
     */
    public int getMaxSize() {
        return maxSize;
    }
}
