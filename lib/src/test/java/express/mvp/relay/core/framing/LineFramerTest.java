package express.mvp.relay.core.framing;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LineFramer}.
 */
@DisplayName("LineFramer")
class LineFramerTest {

    private LineFramer framer;

    @BeforeEach
    void setUp() {
        framer = new LineFramer(8);
    }

    private List<String> decode(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return framer.decode(bytes, bytes.length);
    }

    @Test
    @DisplayName("Splits several lines in one read")
    void splitsLines() {
        assertEquals(List.of("a", "bc"), decode("a\nbc\n"));
        assertEquals(0, framer.pendingBytes());
    }

    @Test
    @DisplayName("Buffers a partial line across reads")
    void buffersPartialLine() {
        assertEquals(List.of(), decode("he"));
        assertEquals(2, framer.pendingBytes());
        assertEquals(List.of("hey"), decode("y\n"));
    }

    @Test
    @DisplayName("Strips a trailing carriage return")
    void stripsCarriageReturn() {
        assertEquals(List.of("hi", ""), decode("hi\r\n\n"));
    }

    @Test
    @DisplayName("Flushes an over-long line without a delimiter")
    void flushesLongLine() {
        assertEquals(List.of("12345678"), decode("123456789"));
        assertEquals(1, framer.pendingBytes());
    }

    @Test
    @DisplayName("A line of exactly the limit is one message")
    void lineAtLimit() {
        LineFramer four = new LineFramer(4);
        byte[] bytes = "abcd\n".getBytes(StandardCharsets.UTF_8);

        assertEquals(List.of("abcd"), four.decode(bytes, bytes.length));
        assertEquals(0, four.pendingBytes());
    }

    @Test
    @DisplayName("A multi-byte character ending at the limit stays whole")
    void multiByteAtLimit() {
        LineFramer five = new LineFramer(5);
        byte[] bytes = "abc\u00e9\n".getBytes(StandardCharsets.UTF_8);

        assertEquals(List.of("abc\u00e9"), five.decode(bytes, bytes.length));
    }

    @Test
    @DisplayName("An over-long line is never cut inside a multi-byte character")
    void flushKeepsCharacterWhole() {
        LineFramer four = new LineFramer(4);
        byte[] bytes = "abc\u00e9z\n".getBytes(StandardCharsets.UTF_8);

        List<String> messages = four.decode(bytes, bytes.length);

        assertEquals(List.of("abc", "\u00e9z"), messages);
        assertFalse(String.join("", messages).contains("\ufffd"));
    }

    @Test
    @DisplayName("A character split across reads and the limit is carried over")
    void carriesCharacterAcrossReads() {
        LineFramer four = new LineFramer(4);
        byte[] bytes = "xy\u20ac\n".getBytes(StandardCharsets.UTF_8);

        assertEquals(List.of(), four.decode(bytes, 4));
        assertEquals(List.of("xy"), four.decode(new byte[] {bytes[4]}, 1));
        assertEquals(3, four.pendingBytes());
        assertEquals(List.of("\u20ac"), four.decode(new byte[] {bytes[5]}, 1));
    }

    @Test
    @DisplayName("Only the given length is decoded")
    void honoursLength() {
        byte[] bytes = "ab\ncd\n".getBytes(StandardCharsets.UTF_8);
        assertEquals(List.of("ab"), framer.decode(bytes, 3));
    }

    @Test
    @DisplayName("Encode appends a newline")
    void encode() {
        assertArrayEquals("hi\n".getBytes(StandardCharsets.UTF_8), framer.encode("hi"));
    }

    @Test
    @DisplayName("Rejects a non-positive line limit")
    void rejectsBadLimit() {
        assertThrows(IllegalArgumentException.class, () -> new LineFramer(0));
    }
}
