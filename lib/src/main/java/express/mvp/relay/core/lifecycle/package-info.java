/**
 * Session lifecycle for relayed client connections.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.core.lifecycle.SessionState} - States a session passes through
 *   <li>{@link express.mvp.relay.core.lifecycle.SessionStateMachine} - Enforces valid transitions
 *   <li>{@link express.mvp.relay.core.lifecycle.SessionStateListener} - Callback for transitions
 * </ul>
 *
 * <p>A session moves {@code GREETING → RELAYING → CLOSING → CLOSED}; a failed greeting skips
 * straight to {@code CLOSING}.
 *
 * @see express.mvp.relay.core.ConnectionHandler
 */
package express.mvp.relay.core.lifecycle;
