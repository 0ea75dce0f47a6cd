package express.mvp.relay.core.lifecycle;

/**
 * Callback interface for session state change events.
 *
 * <p>Callbacks run synchronously on the handler thread that performed the transition and should
 * return quickly.
 *
 * @see SessionStateMachine
 */
@FunctionalInterface
public interface SessionStateListener {

    /**
     * Called when the session state changes.
     *
     * @param sessionId the id of the slot the session occupies
     * @param previousState the state before the transition
     * @param currentState the new state after the transition
     * @param cause the reason for the transition (may be null for normal transitions)
     */
    void onStateChanged(
            long sessionId,
            SessionState previousState,
            SessionState currentState,
            Throwable cause);
}
