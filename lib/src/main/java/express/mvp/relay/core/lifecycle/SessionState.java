package express.mvp.relay.core.lifecycle;

/**
 * Represents the states of a client session handled by a {@link
 * express.mvp.relay.core.ConnectionHandler}.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌──────────┐  greeting sent  ┌──────────┐
 * │ GREETING │────────────────▶│ RELAYING │◀──┐ message relayed
 * └──────────┘                 └──────────┘───┘
 *      │                            │
 *      │ send failed                │ EOF, error, timeout or termination token
 *      ▼                            ▼
 * ┌─────────────────────────────────────────┐  stream closed,  ┌──────────┐
 * │                 CLOSING                 │─────────────────▶│  CLOSED  │
 * └─────────────────────────────────────────┘  slot emptied    └──────────┘
 * </pre>
 *
 * @see SessionStateMachine
 */
public enum SessionState {

    /** Sending the greeting payload to a freshly accepted client. */
    GREETING(0, "Greeting", false, false),

    /** Reading messages and relaying them to the sender and its peers. */
    RELAYING(1, "Relaying", true, false),

    /** Closing the stream and emptying the slot. */
    CLOSING(2, "Closing", false, true),

    /** Terminal state. The handler has returned and the slot is reusable. */
    CLOSED(3, "Closed", false, true);

    private final int order;
    private final String displayName;
    private final boolean active;
    private final boolean terminal;

    SessionState(int order, String displayName, boolean active, boolean terminal) {
        this.order = order;
        this.displayName = displayName;
        this.active = active;
        this.terminal = terminal;
    }

    /**
     * Returns the numeric order of this state.
     *
     * @return the state order
     */
    public int order() {
        return order;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if the session is relaying messages.
     *
     * @return true only in {@link #RELAYING}
     */
    public boolean isActive() {
        return active;
    }

    /**
     * Checks if the session is shutting down or finished.
     *
     * @return true in {@link #CLOSING} or {@link #CLOSED}
     */
    public boolean isClosingOrClosed() {
        return terminal;
    }

    /**
     * Checks if this is the final state.
     *
     * @return true only in {@link #CLOSED}
     */
    public boolean isClosed() {
        return this == CLOSED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
