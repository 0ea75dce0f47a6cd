package express.mvp.relay.core.framing;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Newline-delimited framing.
 *
 * <p>Bytes are accumulated until a {@code '\n'} arrives; the line without its delimiter (and
 * without a trailing {@code '\r'}) is one message. Partial lines carry over to the next read. A
 * line longer than {@code maxLineBytes} is emitted in pieces so a client cannot grow the buffer
 * without bound; a piece is cut only when another non-delimiter byte arrives at the limit, and the
 * cut never falls inside a UTF-8 sequence.
 *
 * <p>Encoded messages are terminated with {@code '\n'}.
 */
public final class LineFramer implements MessageFramer {

    private static final byte LF = '\n';
    private static final byte CR = '\r';

    private final int maxLineBytes;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    /**
     * Creates a line framer.
     *
     * @param maxLineBytes the longest line buffered before it is emitted undelimited
     * @throws IllegalArgumentException if {@code maxLineBytes} is not positive
     */
    public LineFramer(int maxLineBytes) {
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be > 0: " + maxLineBytes);
        }
        this.maxLineBytes = maxLineBytes;
    }

    @Override
    public List<String> decode(byte[] chunk, int length) {
        List<String> messages = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            byte b = chunk[i];
            if (b == LF) {
                messages.add(drain(true));
            } else {
                if (pending.size() >= maxLineBytes) {
                    messages.add(flushPiece());
                }
                pending.write(b);
            }
        }
        return messages;
    }

    @Override
    public byte[] encode(String message) {
        return (message + "\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns the number of bytes of an incomplete line held between reads.
     *
     * @return the pending byte count
     */
    public int pendingBytes() {
        return pending.size();
    }

    /** Emits the pending bytes up to the last complete UTF-8 sequence and keeps the rest. */
    private String flushPiece() {
        byte[] line = pending.toByteArray();
        int cut = utf8Boundary(line);
        pending.reset();
        pending.write(line, cut, line.length - cut);
        return new String(line, 0, cut, StandardCharsets.UTF_8);
    }

    /**
     * Returns the length of the longest prefix of {@code bytes} that does not end inside an
     * incomplete UTF-8 sequence, or the full length when no such cut exists.
     */
    private static int utf8Boundary(byte[] bytes) {
        int lead = bytes.length - 1;
        while (lead > 0 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if ((bytes[lead] & 0xC0) == 0x80) {
            return bytes.length;
        }
        if (bytes.length - lead >= sequenceLength(bytes[lead])) {
            return bytes.length;
        }
        return lead > 0 ? lead : bytes.length;
    }

    private static int sequenceLength(byte lead) {
        if ((lead & 0xE0) == 0xC0) {
            return 2;
        }
        if ((lead & 0xF0) == 0xE0) {
            return 3;
        }
        if ((lead & 0xF8) == 0xF0) {
            return 4;
        }
        return 1;
    }

    private String drain(boolean stripCarriageReturn) {
        byte[] line = pending.toByteArray();
        pending.reset();
        int end = line.length;
        if (stripCarriageReturn && end > 0 && line[end - 1] == CR) {
            end--;
        }
        return new String(line, 0, end, StandardCharsets.UTF_8);
    }
}
