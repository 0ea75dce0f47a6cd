package express.mvp.relay.core.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for a client session.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * GREETING → RELAYING, CLOSING
 * RELAYING → CLOSING
 * CLOSING  → CLOSED
 * CLOSED   → (terminal, no transitions)
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Transitions are performed with compare-and-set, so a concurrent observer always sees a state
 * that was reached through a valid transition. Listeners are notified after the state has changed.
 *
 * @see SessionState
 * @see SessionStateListener
 */
public final class SessionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(SessionStateMachine.class.getName());

    private static final Set<SessionState> FROM_GREETING =
            EnumSet.of(SessionState.RELAYING, SessionState.CLOSING);

    private static final Set<SessionState> FROM_RELAYING = EnumSet.of(SessionState.CLOSING);

    private static final Set<SessionState> FROM_CLOSING = EnumSet.of(SessionState.CLOSED);

    private static final Set<SessionState> FROM_CLOSED = EnumSet.noneOf(SessionState.class);

    private final AtomicReference<SessionState> state =
            new AtomicReference<>(SessionState.GREETING);

    private final List<SessionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final long sessionId;

    /**
     * Creates a state machine in {@link SessionState#GREETING}.
     *
     * @param sessionId the id of the slot the session occupies
     */
    public SessionStateMachine(long sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * Returns the current state.
     *
     * @return the current session state
     */
    public SessionState getState() {
        return state.get();
    }

    /**
     * Returns the id of the slot this session occupies.
     *
     * @return the session id
     */
    public long getSessionId() {
        return sessionId;
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(SessionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(SessionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired new state
     * @return true if the transition was successful
     */
    public boolean transitionTo(SessionState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state with a cause.
     *
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if the transition was successful
     */
    public boolean transitionTo(SessionState newState, Throwable cause) {
        while (true) {
            SessionState current = state.get();

            if (!isValidTransition(current, newState)) {
                return false;
            }

            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState, cause);
                return true;
            }
        }
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(SessionState from, SessionState to) {
        if (from == to) {
            return false;
        }

        return switch (from) {
            case GREETING -> FROM_GREETING.contains(to);
            case RELAYING -> FROM_RELAYING.contains(to);
            case CLOSING -> FROM_CLOSING.contains(to);
            case CLOSED -> FROM_CLOSED.contains(to);
        };
    }

    /**
     * Returns the set of valid target states from a given state.
     *
     * @param from the source state
     * @return set of valid target states
     */
    public static Set<SessionState> getValidTransitions(SessionState from) {
        return switch (from) {
            case GREETING -> EnumSet.copyOf(FROM_GREETING);
            case RELAYING -> EnumSet.copyOf(FROM_RELAYING);
            case CLOSING -> EnumSet.copyOf(FROM_CLOSING);
            case CLOSED -> EnumSet.noneOf(SessionState.class);
        };
    }

    private void notifyListeners(SessionState previous, SessionState current, Throwable cause) {
        for (SessionStateListener listener : listeners) {
            try {
                listener.onStateChanged(sessionId, previous, current, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Session state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "SessionStateMachine[" + sessionId + ":" + state.get() + "]";
    }
}
