package express.mvp.relay.core;

import express.mvp.relay.core.framing.Framing;
import java.util.Objects;

/**
 * Per-session protocol settings shared by every {@link ConnectionHandler} of a server.
 *
 * @param greeting payload sent to a client right after it is accepted
 * @param farewell payload sent to a client that sends the termination token
 * @param terminationToken prefix that ends a session when a message starts with it
 * @param bufferSize receive buffer size in bytes; longer reads are split
 * @param framing how received bytes are cut into messages
 */
public record SessionSettings(
        String greeting,
        String farewell,
        String terminationToken,
        int bufferSize,
        Framing framing) {

    /** Default greeting payload. */
    public static final String DEFAULT_GREETING = "Hello";

    /** Default farewell payload. */
    public static final String DEFAULT_FAREWELL = "Bye!";

    /** Default termination token. */
    public static final String DEFAULT_TERMINATION_TOKEN = ":end";

    /** Default receive buffer size in bytes. */
    public static final int DEFAULT_BUFFER_SIZE = 2048;

    public SessionSettings {
        Objects.requireNonNull(greeting, "greeting must not be null");
        Objects.requireNonNull(farewell, "farewell must not be null");
        Objects.requireNonNull(framing, "framing must not be null");
        if (terminationToken == null || terminationToken.isEmpty()) {
            throw new IllegalArgumentException("terminationToken must not be empty");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0: " + bufferSize);
        }
    }

    /**
     * Returns the settings used when nothing is configured.
     *
     * @return greeting {@code Hello}, farewell {@code Bye!}, token {@code :end}, 2048-byte
     *     buffer, chunk framing
     */
    public static SessionSettings defaults() {
        return new SessionSettings(
                DEFAULT_GREETING,
                DEFAULT_FAREWELL,
                DEFAULT_TERMINATION_TOKEN,
                DEFAULT_BUFFER_SIZE,
                Framing.CHUNK);
    }

    /**
     * Checks whether a message ends the session.
     *
     * <p>Matching is a case-sensitive prefix test, so {@code ":ending"} matches {@code ":end"}.
     *
     * @param message the decoded message
     * @return true if the message starts with the termination token
     */
    public boolean isTermination(String message) {
        return message.startsWith(terminationToken);
    }
}
