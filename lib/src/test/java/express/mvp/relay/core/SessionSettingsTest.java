package express.mvp.relay.core;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.relay.core.framing.Framing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SessionSettings}.
 */
@DisplayName("SessionSettings")
class SessionSettingsTest {

    @Test
    @DisplayName("Defaults match the chat protocol")
    void defaults() {
        SessionSettings settings = SessionSettings.defaults();
        assertEquals("Hello", settings.greeting());
        assertEquals("Bye!", settings.farewell());
        assertEquals(":end", settings.terminationToken());
        assertEquals(2048, settings.bufferSize());
        assertEquals(Framing.CHUNK, settings.framing());
    }

    @Test
    @DisplayName("Termination is a case-sensitive prefix match")
    void terminationPrefix() {
        SessionSettings settings = SessionSettings.defaults();
        assertTrue(settings.isTermination(":end"));
        assertTrue(settings.isTermination(":ending"));
        assertFalse(settings.isTermination(" :end"));
        assertFalse(settings.isTermination(":END"));
        assertFalse(settings.isTermination(":en"));
    }

    @Test
    @DisplayName("Rejects invalid values")
    void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> new SessionSettings("Hello", "Bye!", "", 2048, Framing.CHUNK));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionSettings("Hello", "Bye!", ":end", 0, Framing.CHUNK));
        assertThrows(NullPointerException.class,
                () -> new SessionSettings(null, "Bye!", ":end", 1, Framing.CHUNK));
        assertThrows(NullPointerException.class,
                () -> new SessionSettings("Hello", "Bye!", ":end", 1, null));
    }
}
