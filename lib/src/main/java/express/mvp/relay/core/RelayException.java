package express.mvp.relay.core;

/**
 * Unchecked exception thrown when relay operations fail.
 *
 * <p>This exception wraps failures that cannot be contained within a single connection, such as
 * the listening socket failing to bind. Per-connection I/O errors never surface as this exception;
 * they end the affected session inside its {@link ConnectionHandler}.
 *
 * <h2>Common Causes</h2>
 *
 * <ul>
 *   <li>Listening socket could not be created, bound or put into listen mode
 *   <li>Pool growth refused by a bounded pool (see {@link PoolExhaustedException})
 *   <li>Invalid configuration values
 * </ul>
 */
public class RelayException extends RuntimeException {

    /**
     * Constructs a new relay exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public RelayException(String message) {
        super(message);
    }

    /**
     * Constructs a new relay exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
