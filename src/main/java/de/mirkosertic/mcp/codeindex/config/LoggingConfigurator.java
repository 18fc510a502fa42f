package de.mirkosertic.mcp.codeindex.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logback to file-only output when the server talks JSON-RPC over STDIO.
 * <p>
 * The default {@code logback.xml} logs to the console and is picked up by logback itself.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "codeindex.log.dir";
    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true if running with the STDIO transport
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDirectory = ApplicationConfig.getConfigDirectory().resolve("log");
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDirectory);
        }
        System.setProperty(LOG_DIR_PROPERTY, logDirectory.toString());
        reload(DEPLOYED_CONFIG);
    }

    private static void reload(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
