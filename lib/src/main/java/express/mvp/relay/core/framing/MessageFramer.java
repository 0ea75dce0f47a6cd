package express.mvp.relay.core.framing;

import java.util.List;

/**
 * Strategy for cutting a client's byte stream into text messages and encoding messages for
 * delivery.
 *
 * <h2>Framing Process</h2>
 *
 * <pre>
 *  read() chunk                         decode()                 encode()
 * ┌──────────────────┐            ┌──────────┬──────────┐      ┌────────────────┐
 * │ bytes from client│ ─────────▶ │ message 1│ message 2│ ───▶ │ bytes to peers │
 * └──────────────────┘            └──────────┴──────────┘      └────────────────┘
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Framers may buffer partial input between reads and are therefore <b>not</b> thread-safe.
 * Each connection gets its own instance, used only by that connection's handler thread. {@link
 * #encode(String)} is stateless.
 *
 * @see Framing
 */
public interface MessageFramer {

    /**
     * Decodes the next chunk read from the client.
     *
     * <p>Invalid UTF-8 sequences are replaced with U+FFFD; decoding never fails.
     *
     * @param chunk the buffer the chunk was read into
     * @param length the number of valid bytes in {@code chunk}
     * @return the complete messages contained in the chunk, possibly none
     */
    List<String> decode(byte[] chunk, int length);

    /**
     * Encodes a message for sending to clients.
     *
     * @param message the message text
     * @return the bytes to write
     */
    byte[] encode(String message);
}
