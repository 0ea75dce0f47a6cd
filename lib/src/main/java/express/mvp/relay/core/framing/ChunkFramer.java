package express.mvp.relay.core.framing;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Treats every transport read as exactly one message.
 *
 * <p>No delimiter is added or expected. A message longer than the receive buffer arrives as
 * several messages, and two quick client writes may arrive as one. Clients relying on this framing
 * must not split a logical message across writes.
 */
public final class ChunkFramer implements MessageFramer {

    @Override
    public List<String> decode(byte[] chunk, int length) {
        if (length <= 0) {
            return List.of();
        }
        return List.of(new String(chunk, 0, length, StandardCharsets.UTF_8));
    }

    @Override
    public byte[] encode(String message) {
        return message.getBytes(StandardCharsets.UTF_8);
    }
}
