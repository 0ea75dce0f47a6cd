package express.mvp.relay.core.error;

/**
 * Categories of relay errors, used to decide how far a failure is allowed to reach.
 *
 * <ul>
 *   <li><b>NETWORK:</b> The client went away; ends that session only
 *   <li><b>TIMEOUT:</b> A read timed out; ends that session only
 *   <li><b>RESOURCE:</b> The process is short of file descriptors, memory or threads
 *   <li><b>FATAL:</b> No recovery possible; the accept loop stops
 *   <li><b>UNKNOWN:</b> Unclassified; treated like a per-connection failure
 * </ul>
 *
 * @see ErrorClassifier
 */
public enum ErrorCategory {

    /**
     * The remote side closed or reset the connection.
     *
     * <p>Examples: connection reset by peer, broken pipe, socket closed.
     */
    NETWORK(true, "Network error - client disconnected"),

    /**
     * A blocking read exceeded the configured timeout.
     */
    TIMEOUT(true, "Timeout - client idle too long"),

    /**
     * Resource exhaustion.
     *
     * <p>Examples: too many open files, thread creation refused, pool exhausted. The accept loop
     * keeps running so the condition can clear once sessions end.
     */
    RESOURCE(true, "Resource exhaustion - wait for availability"),

    /**
     * Errors after which the relay cannot keep serving.
     *
     * <p>Examples: {@link VirtualMachineError}, {@link LinkageError}, {@link SecurityException}.
     */
    FATAL(false, "Fatal error - stop accepting"),

    /** Unknown or unclassified errors. */
    UNKNOWN(true, "Unknown error");

    private final boolean recoverable;
    private final String description;

    ErrorCategory(boolean recoverable, String description) {
        this.recoverable = recoverable;
        this.description = description;
    }

    /**
     * Checks if the relay can keep running after an error in this category.
     *
     * @return false only for {@link #FATAL}
     */
    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Checks if this is an ordinary client departure that does not merit a warning.
     *
     * @return true for {@link #NETWORK} and {@link #TIMEOUT}
     */
    public boolean isExpectedDisconnect() {
        return this == NETWORK || this == TIMEOUT;
    }

    /**
     * Checks if this is a fatal error.
     *
     * @return true only for {@link #FATAL}
     */
    public boolean isFatal() {
        return this == FATAL;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
