package express.mvp.relay.core;

import express.mvp.relay.core.error.ErrorCategory;
import express.mvp.relay.core.error.ErrorClassifier;
import express.mvp.relay.core.framing.MessageFramer;
import express.mvp.relay.core.lifecycle.SessionState;
import express.mvp.relay.core.lifecycle.SessionStateListener;
import express.mvp.relay.core.lifecycle.SessionStateMachine;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relays messages for one accepted client until the session ends.
 *
 * <p>One handler runs per connection on its own worker thread. It greets the client, then reads
 * messages and, for each one, echoes it back to the sender before forwarding identical bytes to
 * every occupied peer. A message starting with the termination token is answered with the
 * farewell and is never relayed.
 *
 * <h2>Session Flow</h2>
 *
 * <pre>
 * GREETING  send greeting ─────────────── failure ──┐
 *    │                                              │
 *    ▼                                              │
 * RELAYING  read ─▶ decode ─▶ termination token? ─yes─▶ farewell ─┐
 *    ▲                             │ no             │             │
 *    │                             ▼                │             │
 *    └──────────── echo to sender, forward to peers │             │
 *                                                   ▼             ▼
 * CLOSING   close stream, empty slot ◀── EOF, read/echo failure ──┘
 *    │
 *    ▼
 * CLOSED
 * </pre>
 *
 * <h2>Locking</h2>
 *
 * <p>Reads need no lock; this handler is the only reader of its stream. Forwarding takes one
 * peer's slot lock just long enough to fetch its stream, then writes through that stream's own
 * write lock. A failed forward is logged and skipped: the peer's own handler notices the broken
 * connection and tears it down.
 *
 * <h2>Failure Isolation</h2>
 *
 * <p>I/O failures end this session only. An unexpected runtime exception is logged and the slot is
 * still released, so the rest of the relay keeps running.
 */
public final class ConnectionHandler implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionHandler.class.getName());

    private final ConnectionSlot slot;
    private final ClientStream stream;
    private final PeerView peers;
    private final SessionSettings settings;
    private final MessageFramer framer;
    private final SessionStateMachine state;

    private final AtomicLong messagesReceived = new AtomicLong(0);
    private final AtomicLong messagesForwarded = new AtomicLong(0);

    /** Reason the session is closing; null for a voluntary or clean end. */
    private Throwable closeCause;

    /**
     * Creates a handler for the stream currently attached to {@code slot}.
     *
     * @param slot the occupied slot of the accepted client
     * @param peers source of broadcast targets
     * @param settings protocol settings
     * @throws IllegalStateException if {@code slot} is empty
     */
    public ConnectionHandler(ConnectionSlot slot, PeerView peers, SessionSettings settings) {
        ClientStream attached = slot.stream();
        if (attached == null) {
            throw new IllegalStateException("Slot " + slot.id() + " has no attached stream");
        }
        this.slot = slot;
        this.stream = attached;
        this.peers = peers;
        this.settings = settings;
        this.framer = settings.framing().newFramer(settings.bufferSize());
        this.state = new SessionStateMachine(slot.id());
    }

    /**
     * Registers a listener for this session's state transitions.
     *
     * <p>Must be called before the handler is started to observe every transition.
     *
     * @param listener the listener
     */
    public void addStateListener(SessionStateListener listener) {
        state.addListener(listener);
    }

    @Override
    public void run() {
        try {
            if (greet()) {
                state.transitionTo(SessionState.RELAYING);
                relay();
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Session " + slot.id() + " aborted unexpectedly", e);
            closeCause = e;
        } finally {
            closeSession();
        }
    }

    private boolean greet() {
        try {
            stream.write(settings.greeting().getBytes(StandardCharsets.UTF_8));
            return true;
        } catch (IOException e) {
            logIoFailure("greeting", e);
            closeCause = e;
            return false;
        }
    }

    private void relay() {
        byte[] buffer = new byte[settings.bufferSize()];
        while (true) {
            int read;
            try {
                read = stream.read(buffer);
            } catch (IOException e) {
                logIoFailure("read", e);
                closeCause = e;
                return;
            }

            if (read <= 0) {
                LOGGER.log(Level.FINE, "Session {0} ended by client", slot.id());
                return;
            }

            for (String message : framer.decode(buffer, read)) {
                if (!handleMessage(message)) {
                    return;
                }
            }
        }
    }

    /**
     * Processes one decoded message.
     *
     * @return false if the session must end
     */
    private boolean handleMessage(String message) {
        messagesReceived.incrementAndGet();

        if (settings.isTermination(message)) {
            LOGGER.log(Level.FINE, "Session {0} sent termination token", slot.id());
            try {
                stream.write(settings.farewell().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                logIoFailure("farewell", e);
            }
            return false;
        }

        byte[] payload = framer.encode(message);
        try {
            stream.write(payload);
        } catch (IOException e) {
            logIoFailure("echo", e);
            closeCause = e;
            return false;
        }

        broadcast(payload);
        return true;
    }

    private void broadcast(byte[] payload) {
        for (ConnectionSlot peer : peers.peers()) {
            if (peer.id() == slot.id()) {
                continue;
            }
            ClientStream target = peer.stream();
            if (target == null) {
                continue;
            }
            try {
                target.write(payload);
                messagesForwarded.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.log(Level.FINEST, slot.id() + " -> " + peer.id() + ": " + payload.length
                            + " bytes");
                }
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Skipping peer " + peer.id() + " of session " + slot.id()
                        + ": " + ErrorClassifier.describeError(e));
            }
        }
    }

    private void closeSession() {
        state.transitionTo(SessionState.CLOSING, closeCause);
        if (!slot.release(stream)) {
            try {
                stream.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to close stream of session " + slot.id(), e);
            }
        }
        state.transitionTo(SessionState.CLOSED, closeCause);
        LOGGER.log(Level.FINE, "Session {0} closed", slot.id());
    }

    private void logIoFailure(String operation, IOException e) {
        ErrorCategory category = ErrorClassifier.classify(e);
        Level level = category.isExpectedDisconnect() ? Level.FINE : Level.WARNING;
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, "Session " + slot.id() + " " + operation + " failed: "
                    + ErrorClassifier.describeError(e));
        }
    }

    /**
     * Returns the id of the slot this handler serves.
     *
     * @return the session id
     */
    public long getSessionId() {
        return slot.id();
    }

    /**
     * Returns the current session state.
     *
     * @return the state
     */
    public SessionState getState() {
        return state.getState();
    }

    /**
     * Returns the number of messages decoded from the client, including the termination token.
     *
     * @return the received message count
     */
    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    /**
     * Returns the number of successful forwards to peers.
     *
     * @return the forward count
     */
    public long getMessagesForwarded() {
        return messagesForwarded.get();
    }

    @Override
    public String toString() {
        return "ConnectionHandler[" + slot.id() + ":" + state.getState() + "]";
    }
}
