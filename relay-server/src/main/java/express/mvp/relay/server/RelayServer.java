package express.mvp.relay.server;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.relay.core.ClientListener;
import express.mvp.relay.core.ClientStream;
import express.mvp.relay.core.ConnectionHandler;
import express.mvp.relay.core.ConnectionPool;
import express.mvp.relay.core.ConnectionPoolImpl;
import express.mvp.relay.core.ConnectionSlot;
import express.mvp.relay.core.PeerView;
import express.mvp.relay.core.PoolExhaustedException;
import express.mvp.relay.core.RelayException;
import express.mvp.relay.core.SessionSettings;
import express.mvp.relay.core.WorkerPool;
import express.mvp.relay.core.error.ErrorCategory;
import express.mvp.relay.core.error.ErrorClassifier;
import express.mvp.relay.core.lifecycle.SessionState;
import express.mvp.relay.core.lifecycle.SessionStateListener;
import express.mvp.relay.core.net.SocketClientListener;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Multi-client chat relay server.
 *
 * <p>The server owns a listening socket, a {@link ConnectionPool} of reusable slots and a {@link
 * WorkerPool}. A dedicated accept thread places every accepted client into a free slot and hands
 * it to a {@link ConnectionHandler} running on its own worker thread, then goes straight back to
 * accepting.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                        RelayServer                          │
 * ├─────────────────────────────────────────────────────────────┤
 * │                                                             │
 * │   ┌──────────────┐      ┌─────────────────────────────────┐ │
 * │   │ relay-accept │─────▶│         Connection Pool         │ │
 * │   │    thread    │      │  ┌───────┐ ┌───────┐ ┌───────┐  │ │
 * │   └──────┬───────┘      │  │ slot0 │ │ slot1 │ │ slot2 │  │ │
 * │          │ submit       │  └───▲───┘ └───▲───┘ └───▲───┘  │ │
 * │          ▼              └──────┼─────────┼─────────┼──────┘ │
 * │   ┌─────────────────────────┐  │ forward │         │        │
 * │   │       WorkerPool        │  │         │         │        │
 * │   │ relay-handler-1 ────────┼──┘─────────┘         │        │
 * │   │ relay-handler-2 ────────┼──────────────────────┘        │
 * │   └─────────────────────────┘                               │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RelayServerConfig config = RelayServerConfig.builder().port(7000).build();
 *
 * try (RelayServer server = new RelayServer(config)) {
 *     server.start();
 *     server.awaitReady(5, TimeUnit.SECONDS);
 *     // Server runs until stopped
 *     Thread.sleep(Long.MAX_VALUE);
 * }
 * }</pre>
 *
 * <h2>Thread Model</h2>
 *
 * <ul>
 *   <li>One accept thread, {@code relay-accept}
 *   <li>One worker thread per connected client; the accept loop never waits for handlers
 *   <li>Handlers forward to peers directly, taking one slot lock at a time
 * </ul>
 *
 * @see RelayServerConfig
 * @see ConnectionHandler
 */
public class RelayServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RelayServer.class.getName());

    /** Pause before accepting again after running out of a resource such as file handles. */
    private static final Duration RESOURCE_BACKOFF = Duration.ofMillis(100);

    /** Server configuration. */
    private final RelayServerConfig config;

    /** Binds the listening socket on {@link #start()}. */
    private final Function<RelayServerConfig, ClientListener> listenerFactory;

    /** Protocol settings shared by every session. */
    private final SessionSettings sessionSettings;

    /** Slots for connected clients. */
    private final ConnectionPoolImpl pool;

    /** Runs one handler per connection. */
    private final WorkerPool workers;

    /** Logs connects and disconnects. */
    private final SessionStateListener connectionLogger = new ConnectionLogger();

    /** Listening socket; set by {@link #start()}. */
    @SuppressFBWarnings(
            value = "AT_UNSAFE_RESOURCE_ACCESS_IN_THREAD",
            justification = "Listener is published before the accept thread starts; close is "
                    + "the only cross-thread call and unblocks accept.")
    private volatile ClientListener listener;

    /** Flag indicating whether the server is running. */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** Set once stop has begun, so accept failures caused by the close are not reported. */
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    /** Latch to signal when the server is accepting connections. */
    private final CountDownLatch readyLatch = new CountDownLatch(1);

    /** The thread that runs the accept loop. */
    private volatile Thread acceptThread;

    /**
     * Creates a server with the given configuration.
     *
     * <p>The connection pool and worker pool are created immediately; the listening socket is not
     * bound until {@link #start()}.
     *
     * @param config server configuration
     */
    public RelayServer(RelayServerConfig config) {
        this(config, c -> SocketClientListener.bind(
                c.getHost(), c.getPort(), c.getBacklog(), c.getReadTimeout()));
    }

    /**
     * Creates a server that obtains its listener from {@code listenerFactory}.
     *
     * @param config server configuration
     * @param listenerFactory binds a listener for the configuration; may throw {@link
     *     RelayException}
     */
    RelayServer(RelayServerConfig config,
            Function<RelayServerConfig, ClientListener> listenerFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listenerFactory =
                Objects.requireNonNull(listenerFactory, "listenerFactory must not be null");
        this.sessionSettings = config.toSessionSettings();
        this.pool = new ConnectionPoolImpl(config.getInitialPoolSize(), config.getMaxPoolSize());
        this.workers = WorkerPool.builder()
                .namePrefix(config.getHandlerThreadPrefix())
                .build();
    }

    /**
     * Binds the listening socket and starts the accept thread.
     *
     * <p>Binding happens on the calling thread, so a port conflict surfaces here rather than in
     * the background. This method returns as soon as the accept thread is running. Calling it on a
     * running server has no effect.
     *
     * @throws RelayException if the listening socket cannot be bound
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            listener = listenerFactory.apply(config);
        } catch (RelayException e) {
            running.set(false);
            throw e;
        }

        LOGGER.log(Level.INFO, "Relay listening on {0}:{1,number,#} ({2})",
                new Object[] {config.getHost(), listener.localPort(), config});

        Thread thread = new Thread(this::acceptLoop, "relay-accept");
        thread.setDaemon(true);
        acceptThread = thread;
        thread.start();
    }

    /**
     * Waits for the server to be ready to accept connections.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit of the timeout argument
     * @return true if the server is ready, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        return readyLatch.await(timeout, unit);
    }

    /**
     * Returns the port the server is listening on.
     *
     * <p>Useful when the configured port is 0.
     *
     * @return the bound port, or -1 if the server has not been started
     */
    public int getLocalPort() {
        ClientListener current = listener;
        return current != null ? current.localPort() : -1;
    }

    /**
     * Returns the connection pool.
     *
     * @return the live pool
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Pool is exposed for monitoring and tests; slots guard their own state.")
    public ConnectionPool getPool() {
        return pool;
    }

    /**
     * Returns the worker pool statistics.
     *
     * @return the current stats
     */
    public WorkerPool.Stats getWorkerStats() {
        return workers.getStats();
    }

    /**
     * Returns whether the server has been started and not yet stopped.
     *
     * @return true if running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops the server.
     *
     * <p>Closes the listening socket, closes every client stream so blocked handlers return,
     * waits up to {@link RelayServerConfig#getShutdownTimeout()} for handlers to finish and joins
     * the accept thread.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        running.set(false);

        ClientListener current = listener;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to close listening socket", e);
            }
        }

        pool.closeAll();

        try {
            if (!workers.shutdown(config.getShutdownTimeout())) {
                LOGGER.log(Level.WARNING,
                        "Handlers still running after {0}; interrupting",
                        config.getShutdownTimeout());
                workers.shutdownNow();
            }
            Thread thread = acceptThread;
            if (thread != null) {
                thread.join(config.getShutdownTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.log(Level.INFO, "Relay stopped ({0})", workers.getStats());
    }

    @Override
    public void close() {
        stop();
    }

    /** Accepts clients until the listener is closed or a fatal error occurs. */
    private void acceptLoop() {
        readyLatch.countDown();
        ClientListener current = listener;
        while (running.get()) {
            ClientStream stream;
            try {
                stream = current.accept();
            } catch (IOException | RuntimeException e) {
                if (stopping.get() || current.isClosed()) {
                    break;
                }
                ErrorCategory category = ErrorClassifier.classify(e);
                if (category.isFatal()) {
                    LOGGER.log(Level.SEVERE, "Accept failed fatally; no longer accepting", e);
                    break;
                }
                LOGGER.log(Level.WARNING,
                        "Accept failed: " + ErrorClassifier.describeError(e), e);
                if (category == ErrorCategory.RESOURCE && !backOff()) {
                    break;
                }
                continue;
            }
            dispatch(stream);
        }
        running.set(false);
        LOGGER.log(Level.FINE, "Accept loop exited");
    }

    /** Sleeps for {@link #RESOURCE_BACKOFF}; returns false if interrupted. */
    private boolean backOff() {
        try {
            Thread.sleep(RESOURCE_BACKOFF.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Places an accepted stream into a slot and starts its handler. */
    private void dispatch(ClientStream stream) {
        ConnectionSlot slot;
        try {
            slot = pool.findOrCreateEmptySlot();
        } catch (PoolExhaustedException e) {
            LOGGER.log(Level.WARNING, "Rejecting {0}: {1}",
                    new Object[] {stream.remoteAddress(), e.getMessage()});
            closeRejected(stream);
            return;
        }

        slot.attach(stream);
        // stop() may have swept the pool between accept and attach
        if (stopping.get()) {
            LOGGER.log(Level.FINE, "Closing {0} accepted during shutdown", stream.remoteAddress());
            slot.release(stream);
            return;
        }
        LOGGER.log(Level.INFO, "Client {0} connected from {1}",
                new Object[] {slot.id(), stream.remoteAddress()});

        PeerView peers = config.getPeerSelection() == RelayServerConfig.PeerSelection.SNAPSHOT
                ? PeerView.snapshot(pool.snapshotOthers(slot.id()))
                : PeerView.live(pool, slot.id());

        ConnectionHandler handler = new ConnectionHandler(slot, peers, sessionSettings);
        handler.addStateListener(connectionLogger);
        if (workers.submit(handler) == null) {
            LOGGER.log(Level.WARNING, "Worker pool rejected client {0}; closing", slot.id());
            if (!slot.release(stream)) {
                closeRejected(stream);
            }
        }
    }

    private void closeRejected(ClientStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to close rejected client", e);
        }
    }

    /** Logs session ends at INFO. */
    private static final class ConnectionLogger implements SessionStateListener {
        @Override
        public void onStateChanged(
                long sessionId, SessionState previous, SessionState current, Throwable cause) {
            if (current != SessionState.CLOSED) {
                return;
            }
            if (cause == null) {
                LOGGER.log(Level.INFO, "Client {0} disconnected", sessionId);
            } else {
                LOGGER.log(Level.INFO, "Client {0} disconnected: {1}",
                        new Object[] {sessionId, ErrorClassifier.describeError(cause)});
            }
        }
    }
}
