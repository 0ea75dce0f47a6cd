package express.mvp.relay.core.framing;

/**
 * Selects how client bytes are cut into messages.
 */
public enum Framing {

    /** One transport read is one message. */
    CHUNK,

    /** One {@code '\n'}-terminated line is one message. */
    LINE;

    /**
     * Creates a new framer for one connection.
     *
     * @param bufferSize the receive buffer size, also the longest line buffered by {@link #LINE}
     * @return a fresh framer instance
     */
    public MessageFramer newFramer(int bufferSize) {
        return switch (this) {
            case CHUNK -> new ChunkFramer();
            case LINE -> new LineFramer(bufferSize);
        };
    }
}
