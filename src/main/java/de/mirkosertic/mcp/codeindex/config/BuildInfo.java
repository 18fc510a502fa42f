package de.mirkosertic.mcp.codeindex.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Name, version and build time of this server, from the Maven-filtered build-info.properties.
 * Outside a packaged build the version is "dev".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final Properties properties = new Properties();

    static {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                properties.load(input);
            } else {
                logger.debug("{} not found, running with development build info", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load {}", BUILD_INFO_FILE, e);
        }
    }

    private BuildInfo() {
    }

    public static String getName() {
        return property("build.name", "mcp-codeindex-server");
    }

    public static String getVersion() {
        return property("build.version", "dev");
    }

    public static String getBuildTimestamp() {
        return property("build.timestamp", "unknown");
    }

    /**
     * Name and version for logs and the MCP server info, e.g. {@code mcp-codeindex-server 1.0.0 (2026-01-01)}.
     */
    public static String describe() {
        return getName() + " " + getVersion() + " (" + getBuildTimestamp() + ")";
    }

    private static String property(final String key, final String fallback) {
        final String value = properties.getProperty(key);
        // unfiltered placeholders when running from the IDE
        return value == null || value.isBlank() || value.startsWith("${") ? fallback : value;
    }
}
