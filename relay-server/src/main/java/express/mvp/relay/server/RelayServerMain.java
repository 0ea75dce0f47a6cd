package express.mvp.relay.server;

import express.mvp.relay.core.RelayException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point: {@code RelayServerMain [config.properties]}.
 *
 * <p>Configuration is layered, later sources overriding earlier ones:
 *
 * <ol>
 *   <li>{@code relay.properties} on the classpath
 *   <li>the optional properties file named by the first argument
 *   <li>{@code relay.*} JVM system properties
 * </ol>
 *
 * <p>The process runs until it is interrupted; a shutdown hook stops the server. A startup failure
 * exits with status 1.
 */
public final class RelayServerMain {

    private static final Logger LOGGER = Logger.getLogger(RelayServerMain.class.getName());

    static final String DEFAULTS_RESOURCE = "/relay.properties";
    static final String LOGGING_RESOURCE = "/relay-logging.properties";

    private RelayServerMain() {}

    public static void main(String[] args) {
        configureLogging();

        RelayServer server;
        try {
            RelayServerConfig config =
                    RelayServerConfig.fromProperties(loadProperties(args, System.getProperties()));
            server = new RelayServer(config);
            server.start();
        } catch (RelayException e) {
            LOGGER.log(Level.SEVERE, "Relay failed to start: " + e.getMessage(), e);
            System.exit(1);
            return;
        }

        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            main.interrupt();
        }, "relay-shutdown"));

        try {
            while (server.isRunning()) {
                Thread.sleep(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Merges the configuration layers into one property set.
     *
     * @param args command-line arguments; the first, if present, names a properties file
     * @param system properties consulted last, normally {@link System#getProperties()}
     * @return the merged properties
     * @throws RelayException if a layer cannot be read
     */
    static Properties loadProperties(String[] args, Properties system) {
        Properties merged = new Properties();

        try (InputStream in = RelayServerMain.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new RelayException("Failed to read " + DEFAULTS_RESOURCE, e);
        }

        if (args.length > 0) {
            Path file = Paths.get(args[0]);
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                merged.load(reader);
            } catch (IOException e) {
                throw new RelayException("Failed to read configuration file " + file, e);
            }
        }

        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(RelayServerConfig.PROPERTY_PREFIX)) {
                merged.setProperty(name, system.getProperty(name));
            }
        }
        return merged;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = RelayServerMain.class.getResourceAsStream(LOGGING_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to load " + LOGGING_RESOURCE, e);
        }
    }
}
