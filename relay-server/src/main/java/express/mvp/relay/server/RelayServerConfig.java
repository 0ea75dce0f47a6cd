package express.mvp.relay.server;

import express.mvp.relay.core.RelayException;
import express.mvp.relay.core.SessionSettings;
import express.mvp.relay.core.framing.Framing;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for a {@link RelayServer} instance.
 *
 * <p>This class uses the builder pattern to configure network binding, pool sizing and the chat
 * protocol. Instances are immutable.
 *
 * <h2>Configuration Categories</h2>
 *
 * <table border="1">
 *   <caption>Configuration options by category</caption>
 *   <tr><th>Category</th><th>Options</th><th>Description</th></tr>
 *   <tr><td>Network</td><td>host, port, backlog</td><td>Listening socket</td></tr>
 *   <tr><td>Pool</td><td>initialPoolSize, maxPoolSize</td><td>Connection slot pool</td></tr>
 *   <tr><td>Protocol</td><td>greeting, farewell, terminationToken, bufferSize, framing</td>
 *       <td>Per-session behaviour</td></tr>
 *   <tr><td>Broadcast</td><td>peerSelection</td><td>Live or frozen peer lists</td></tr>
 *   <tr><td>Timeouts</td><td>readTimeout, shutdownTimeout</td><td>Idle clients and stop</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RelayServerConfig config = RelayServerConfig.builder()
 *     .port(7000)
 *     .initialPoolSize(10)
 *     .bufferSize(2048)
 *     .peerSelection(RelayServerConfig.PeerSelection.LIVE)
 *     .build();
 * }</pre>
 *
 * <h2>Properties</h2>
 *
 * <p>{@link #fromProperties(Properties)} reads the same options from {@code relay.*} keys, for
 * example {@code relay.port=7000} or {@code relay.read-timeout-ms=30000}.
 *
 * @see RelayServer
 */
public final class RelayServerConfig {

    /** Property key prefix used by {@link #fromProperties(Properties)}. */
    public static final String PROPERTY_PREFIX = "relay.";

    /** How a connection's broadcast targets are determined. */
    public enum PeerSelection {
        /** Query the pool for occupied peers on every broadcast. */
        LIVE,
        /** Freeze the occupied peers when the connection is accepted. */
        SNAPSHOT
    }

    private final String host;
    private final int port;
    private final int backlog;
    private final int initialPoolSize;
    private final int maxPoolSize;
    private final int bufferSize;
    private final String greeting;
    private final String farewell;
    private final String terminationToken;
    private final Framing framing;
    private final PeerSelection peerSelection;
    private final Duration readTimeout;
    private final Duration shutdownTimeout;
    private final String handlerThreadPrefix;

    private RelayServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.backlog = builder.backlog;
        this.initialPoolSize = builder.initialPoolSize;
        this.maxPoolSize = builder.maxPoolSize;
        this.bufferSize = builder.bufferSize;
        this.greeting = builder.greeting;
        this.farewell = builder.farewell;
        this.terminationToken = builder.terminationToken;
        this.framing = builder.framing;
        this.peerSelection = builder.peerSelection;
        this.readTimeout = builder.readTimeout;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.handlerThreadPrefix = builder.handlerThreadPrefix;
    }

    /**
     * Returns the host address to bind to.
     *
     * @return the host address (e.g., "0.0.0.0" or "127.0.0.1")
     */
    public String getHost() {
        return host;
    }

    /**
     * Returns the TCP port to listen on.
     *
     * @return the port number, or 0 for an ephemeral port
     */
    public int getPort() {
        return port;
    }

    /**
     * Returns the accept backlog of the listening socket.
     *
     * @return the backlog
     */
    public int getBacklog() {
        return backlog;
    }

    /**
     * Returns the number of slots created when the server starts.
     *
     * @return the initial pool size
     */
    public int getInitialPoolSize() {
        return initialPoolSize;
    }

    /**
     * Returns the slot cap.
     *
     * <p>When every slot is occupied and the cap is reached, further connections are accepted and
     * closed immediately.
     *
     * @return the maximum pool size, or 0 if growth is unbounded
     */
    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    /**
     * Returns the receive buffer size.
     *
     * @return the buffer size in bytes
     */
    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Returns the payload sent to each client after it connects.
     *
     * @return the greeting
     */
    public String getGreeting() {
        return greeting;
    }

    /**
     * Returns the payload sent to a client that sends the termination token.
     *
     * @return the farewell
     */
    public String getFarewell() {
        return farewell;
    }

    /**
     * Returns the prefix that ends a client's session.
     *
     * @return the termination token
     */
    public String getTerminationToken() {
        return terminationToken;
    }

    /**
     * Returns how received bytes are split into messages.
     *
     * @return the framing
     */
    public Framing getFraming() {
        return framing;
    }

    /**
     * Returns how broadcast targets are chosen.
     *
     * @return the peer selection mode
     */
    public PeerSelection getPeerSelection() {
        return peerSelection;
    }

    /**
     * Returns the idle read timeout for clients.
     *
     * @return the timeout; {@link Duration#ZERO} disables it
     */
    public Duration getReadTimeout() {
        return readTimeout;
    }

    /**
     * Returns how long {@link RelayServer#stop()} waits for handlers to finish.
     *
     * @return the shutdown timeout
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Returns the name prefix of handler threads.
     *
     * @return the thread name prefix
     */
    public String getHandlerThreadPrefix() {
        return handlerThreadPrefix;
    }

    /**
     * Returns the per-session settings derived from this configuration.
     *
     * @return the session settings
     */
    public SessionSettings toSessionSettings() {
        return new SessionSettings(greeting, farewell, terminationToken, bufferSize, framing);
    }

    /**
     * Creates a new builder for constructing RelayServerConfig instances.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from {@code relay.*} properties, starting from the defaults.
     *
     * <p>Recognised keys: {@code host}, {@code port}, {@code backlog}, {@code initial-pool-size},
     * {@code max-pool-size}, {@code buffer-size}, {@code greeting}, {@code farewell}, {@code
     * termination-token}, {@code framing}, {@code peer-selection}, {@code read-timeout-ms}, {@code
     * shutdown-timeout-ms} and {@code handler-thread-prefix}, each prefixed with {@code relay.}.
     *
     * @param properties the properties to read; unknown keys are ignored
     * @return the configuration
     * @throws RelayException if a value cannot be parsed or is out of range
     */
    public static RelayServerConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;

        if ((value = get(properties, "host")) != null) {
            builder.host(value);
        }
        if ((value = get(properties, "port")) != null) {
            builder.port(parseInt("port", value));
        }
        if ((value = get(properties, "backlog")) != null) {
            builder.backlog(parseInt("backlog", value));
        }
        if ((value = get(properties, "initial-pool-size")) != null) {
            builder.initialPoolSize(parseInt("initial-pool-size", value));
        }
        if ((value = get(properties, "max-pool-size")) != null) {
            builder.maxPoolSize(parseInt("max-pool-size", value));
        }
        if ((value = get(properties, "buffer-size")) != null) {
            builder.bufferSize(parseInt("buffer-size", value));
        }
        if ((value = properties.getProperty(PROPERTY_PREFIX + "greeting")) != null) {
            builder.greeting(value);
        }
        if ((value = properties.getProperty(PROPERTY_PREFIX + "farewell")) != null) {
            builder.farewell(value);
        }
        if ((value = get(properties, "termination-token")) != null) {
            builder.terminationToken(value);
        }
        if ((value = get(properties, "framing")) != null) {
            builder.framing(parseEnum(Framing.class, "framing", value));
        }
        if ((value = get(properties, "peer-selection")) != null) {
            builder.peerSelection(parseEnum(PeerSelection.class, "peer-selection", value));
        }
        if ((value = get(properties, "read-timeout-ms")) != null) {
            builder.readTimeout(Duration.ofMillis(parseInt("read-timeout-ms", value)));
        }
        if ((value = get(properties, "shutdown-timeout-ms")) != null) {
            builder.shutdownTimeout(Duration.ofMillis(parseInt("shutdown-timeout-ms", value)));
        }
        if ((value = get(properties, "handler-thread-prefix")) != null) {
            builder.handlerThreadPrefix(value);
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new RelayException("Invalid relay configuration: " + e.getMessage(), e);
        }
    }

    private static String get(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RelayException(
                    "Invalid value for " + PROPERTY_PREFIX + key + ": '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new RelayException(
                    "Invalid value for " + PROPERTY_PREFIX + key + ": '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "RelayServerConfig[host=" + host
                + ", port=" + port
                + ", initialPoolSize=" + initialPoolSize
                + ", maxPoolSize=" + maxPoolSize
                + ", bufferSize=" + bufferSize
                + ", framing=" + framing
                + ", peerSelection=" + peerSelection
                + ", readTimeout=" + readTimeout
                + "]";
    }

    /**
     * Builder for creating RelayServerConfig instances.
     *
     * <h2>Default Values</h2>
     *
     * <ul>
     *   <li>host: "0.0.0.0" (all interfaces)
     *   <li>port: 7000
     *   <li>backlog: 50
     *   <li>initialPoolSize: 10
     *   <li>maxPoolSize: 0 (unbounded)
     *   <li>bufferSize: 2048 bytes
     *   <li>greeting: "Hello"
     *   <li>farewell: "Bye!"
     *   <li>terminationToken: ":end"
     *   <li>framing: CHUNK
     *   <li>peerSelection: LIVE
     *   <li>readTimeout: none
     *   <li>shutdownTimeout: 5 seconds
     *   <li>handlerThreadPrefix: "relay-handler"
     * </ul>
     */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 7000;
        private int backlog = 50;
        private int initialPoolSize = 10;
        private int maxPoolSize = 0;
        private int bufferSize = SessionSettings.DEFAULT_BUFFER_SIZE;
        private String greeting = SessionSettings.DEFAULT_GREETING;
        private String farewell = SessionSettings.DEFAULT_FAREWELL;
        private String terminationToken = SessionSettings.DEFAULT_TERMINATION_TOKEN;
        private Framing framing = Framing.CHUNK;
        private PeerSelection peerSelection = PeerSelection.LIVE;
        private Duration readTimeout = Duration.ZERO;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private String handlerThreadPrefix = "relay-handler";

        private Builder() {}

        /**
         * Sets the host address to bind to.
         *
         * @param host the host address (e.g., "0.0.0.0" for all interfaces)
         * @return this builder for method chaining
         */
        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the TCP port to listen on.
         *
         * @param port the port number (0-65535, 0 for ephemeral)
         * @return this builder for method chaining
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Sets the accept backlog.
         *
         * @param backlog the backlog
         * @return this builder for method chaining
         */
        public Builder backlog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        /**
         * Sets the number of slots created at start.
         *
         * @param initialPoolSize the initial pool size
         * @return this builder for method chaining
         */
        public Builder initialPoolSize(int initialPoolSize) {
            this.initialPoolSize = initialPoolSize;
            return this;
        }

        /**
         * Sets the slot cap.
         *
         * @param maxPoolSize the maximum pool size, or 0 for unbounded
         * @return this builder for method chaining
         */
        public Builder maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        /**
         * Sets the receive buffer size.
         *
         * @param bufferSize the buffer size in bytes
         * @return this builder for method chaining
         */
        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        /**
         * Sets the greeting payload.
         *
         * @param greeting the greeting
         * @return this builder for method chaining
         */
        public Builder greeting(String greeting) {
            this.greeting = Objects.requireNonNull(greeting, "greeting");
            return this;
        }

        /**
         * Sets the farewell payload.
         *
         * @param farewell the farewell
         * @return this builder for method chaining
         */
        public Builder farewell(String farewell) {
            this.farewell = Objects.requireNonNull(farewell, "farewell");
            return this;
        }

        /**
         * Sets the termination token.
         *
         * @param terminationToken the prefix that ends a session
         * @return this builder for method chaining
         */
        public Builder terminationToken(String terminationToken) {
            this.terminationToken = Objects.requireNonNull(terminationToken, "terminationToken");
            return this;
        }

        /**
         * Sets the message framing.
         *
         * @param framing the framing
         * @return this builder for method chaining
         */
        public Builder framing(Framing framing) {
            this.framing = Objects.requireNonNull(framing, "framing");
            return this;
        }

        /**
         * Sets how broadcast targets are chosen.
         *
         * @param peerSelection the peer selection mode
         * @return this builder for method chaining
         */
        public Builder peerSelection(PeerSelection peerSelection) {
            this.peerSelection = Objects.requireNonNull(peerSelection, "peerSelection");
            return this;
        }

        /**
         * Sets the idle read timeout.
         *
         * @param readTimeout the timeout; zero disables it
         * @return this builder for method chaining
         */
        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
            return this;
        }

        /**
         * Sets how long stop waits for handlers.
         *
         * @param shutdownTimeout the timeout
         * @return this builder for method chaining
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
            return this;
        }

        /**
         * Sets the name prefix of handler threads.
         *
         * @param handlerThreadPrefix the prefix
         * @return this builder for method chaining
         */
        public Builder handlerThreadPrefix(String handlerThreadPrefix) {
            this.handlerThreadPrefix =
                    Objects.requireNonNull(handlerThreadPrefix, "handlerThreadPrefix");
            return this;
        }

        /**
         * Builds a new RelayServerConfig with the configured values.
         *
         * @return a new immutable configuration instance
         * @throws IllegalArgumentException if a value is out of range
         */
        public RelayServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be within 0-65535: " + port);
            }
            if (backlog <= 0) {
                throw new IllegalArgumentException("backlog must be > 0: " + backlog);
            }
            if (initialPoolSize < 0) {
                throw new IllegalArgumentException(
                        "initialPoolSize must be >= 0: " + initialPoolSize);
            }
            if (maxPoolSize < 0 || (maxPoolSize > 0 && maxPoolSize < initialPoolSize)) {
                throw new IllegalArgumentException(
                        "maxPoolSize must be 0 or >= initialPoolSize: " + maxPoolSize);
            }
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("bufferSize must be > 0: " + bufferSize);
            }
            if (terminationToken.isEmpty()) {
                throw new IllegalArgumentException("terminationToken must not be empty");
            }
            if (readTimeout.isNegative() || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("timeouts must not be negative");
            }
            return new RelayServerConfig(this);
        }
    }
}
