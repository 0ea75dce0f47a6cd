package express.mvp.relay.core.framing;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChunkFramer} and {@link Framing}.
 */
@DisplayName("ChunkFramer")
class ChunkFramerTest {

    private final ChunkFramer framer = new ChunkFramer();

    @Test
    @DisplayName("Each read is one message, newlines included")
    void oneMessagePerRead() {
        byte[] bytes = "a\nb".getBytes(StandardCharsets.UTF_8);
        assertEquals(List.of("a\nb"), framer.decode(bytes, bytes.length));
    }

    @Test
    @DisplayName("Only the bytes read are decoded")
    void honoursLength() {
        byte[] buffer = "hello world".getBytes(StandardCharsets.UTF_8);
        assertEquals(List.of("hello"), framer.decode(buffer, 5));
    }

    @Test
    @DisplayName("Empty read yields no message")
    void emptyRead() {
        assertTrue(framer.decode(new byte[4], 0).isEmpty());
    }

    @Test
    @DisplayName("Encode is plain UTF-8")
    void encode() {
        assertArrayEquals("hé".getBytes(StandardCharsets.UTF_8), framer.encode("hé"));
    }

    @Test
    @DisplayName("Framing creates the matching framer")
    void framingFactory() {
        assertInstanceOf(ChunkFramer.class, Framing.CHUNK.newFramer(16));
        assertInstanceOf(LineFramer.class, Framing.LINE.newFramer(16));
    }
}
