package express.mvp.relay.server;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.relay.core.RelayException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the configuration layering of {@link RelayServerMain}.
 */
@DisplayName("RelayServerMain")
@SuppressFBWarnings(
        value = {"THROWS_METHOD_THROWS_CLAUSE_BASIC_EXCEPTION"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class RelayServerMainTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Classpath defaults are loaded")
    void classpathDefaults() {
        Properties merged = RelayServerMain.loadProperties(new String[0], new Properties());

        RelayServerConfig config = RelayServerConfig.fromProperties(merged);
        assertEquals(7000, config.getPort());
        assertEquals("Hello", config.getGreeting());
        assertEquals(10, config.getInitialPoolSize());
    }

    @Test
    @DisplayName("File overrides defaults and system properties override the file")
    void layering() throws Exception {
        Path file = tempDir.resolve("relay.properties");
        Files.writeString(file, "relay.port=7200\nrelay.greeting=Hi\n", StandardCharsets.UTF_8);
        Properties system = new Properties();
        system.setProperty("relay.port", "7300");
        system.setProperty("java.home", "/ignored");

        Properties merged =
                RelayServerMain.loadProperties(new String[] {file.toString()}, system);

        assertEquals("7300", merged.getProperty("relay.port"));
        assertEquals("Hi", merged.getProperty("relay.greeting"));
        assertEquals("Bye!", merged.getProperty("relay.farewell"));
        assertNull(merged.getProperty("java.home"));
    }

    @Test
    @DisplayName("A missing configuration file is a startup failure")
    void missingFile() {
        String missing = tempDir.resolve("absent.properties").toString();
        assertThrows(RelayException.class,
                () -> RelayServerMain.loadProperties(new String[] {missing}, new Properties()));
    }
}
