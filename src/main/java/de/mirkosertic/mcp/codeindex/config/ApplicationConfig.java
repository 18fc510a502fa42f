package de.mirkosertic.mcp.codeindex.config;

import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.HybridSearchOrchestrator;
import de.mirkosertic.mcp.codeindex.hybrid.ReciprocalRankFusion;
import de.mirkosertic.mcp.codeindex.hybrid.SearchResultCache;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.query.Bm25Parameters;
import de.mirkosertic.mcp.codeindex.snippet.SnippetExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Central configuration of the code index server.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpcodeindex/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_STORE_PATH = "CODEINDEX_STORE_PATH";
    private static final String PROP_STORE_PATH = "codeindex.store.path";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".mcpcodeindex";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private String storePath;

    private double bm25K1 = Bm25Parameters.DEFAULT_K1;
    private double bm25B = Bm25Parameters.DEFAULT_B;

    private int rrfK = ReciprocalRankFusion.DEFAULT_K;
    private final Map<SourceType, Double> weights = new EnumMap<>(HybridConfig.defaults().weights());
    private final Map<SourceType, Long> timeoutsMs = new EnumMap<>(HybridConfig.defaults().timeoutsMs());
    private final Map<SourceType, Long> cacheTtlSeconds = new EnumMap<>(HybridConfig.defaults().cacheTtlSeconds());
    private boolean semanticEnabled = true;
    private boolean fuzzyEnabled = true;
    private long cacheMaxEntries = SearchResultCache.DEFAULT_MAX_ENTRIES;
    private int threadPoolSize = HybridSearchOrchestrator.DEFAULT_THREAD_POOL_SIZE;

    private int snippetWindow = SnippetExtractor.DEFAULT_WINDOW;

    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadYaml(config.getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE),
                "classpath:" + DEFAULT_CONFIG_FILE);

        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try {
                config.loadYaml(Files.newInputStream(userConfigPath), userConfigPath.toString());
            } catch (final IOException e) {
                logger.warn("Failed to open user config {}", userConfigPath, e);
            }
        }

        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: storePath={}, rrfK={}, weights={}, semantic={}, fuzzy={}, deployedMode={}",
                config.storePath, config.rrfK, config.weights, config.semanticEnabled, config.fuzzyEnabled,
                config.deployedMode);

        return config;
    }

    /**
     * Built-in defaults only, no files and no environment. The store path is the given directory.
     */
    public static ApplicationConfig defaults(final Path storePath) {
        final ApplicationConfig config = new ApplicationConfig();
        config.storePath = storePath.toString();
        return config;
    }

    /**
     * Defaults overlaid with the given YAML, used for tests and embedding.
     */
    public static ApplicationConfig fromYaml(final InputStream yaml, final Path defaultStorePath) {
        final ApplicationConfig config = defaults(defaultStorePath);
        config.loadYaml(yaml, "stream");
        return config;
    }

    private void loadYaml(final InputStream stream, final String origin) {
        if (stream == null) {
            return;
        }
        try (final InputStream is = stream) {
            final Map<String, Object> config = new Yaml().load(is);
            if (config != null) {
                applyYamlConfig(config);
                logger.debug("Loaded configuration from {}", origin);
            }
        } catch (final IOException | RuntimeException e) {
            logger.warn("Failed to load configuration from {}", origin, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Map<String, Object> parent, final String key) {
        final Object value = parent.get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = section(config, "codeindex");
        if (root.isEmpty()) {
            return;
        }

        final Map<String, Object> store = section(root, "store");
        if (store.get("path") != null) {
            this.storePath = resolveVariables(store.get("path").toString());
        }

        final Map<String, Object> bm25 = section(root, "bm25");
        if (bm25.containsKey("k1")) {
            this.bm25K1 = ((Number) bm25.get("k1")).doubleValue();
        }
        if (bm25.containsKey("b")) {
            this.bm25B = ((Number) bm25.get("b")).doubleValue();
        }

        final Map<String, Object> hybrid = section(root, "hybrid");
        if (hybrid.containsKey("rrf-k")) {
            this.rrfK = ((Number) hybrid.get("rrf-k")).intValue();
        }
        if (hybrid.containsKey("enable-semantic")) {
            this.semanticEnabled = (Boolean) hybrid.get("enable-semantic");
        }
        if (hybrid.containsKey("enable-fuzzy")) {
            this.fuzzyEnabled = (Boolean) hybrid.get("enable-fuzzy");
        }
        if (hybrid.containsKey("cache-max-entries")) {
            this.cacheMaxEntries = ((Number) hybrid.get("cache-max-entries")).longValue();
        }
        if (hybrid.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) hybrid.get("thread-pool-size")).intValue();
        }

        final Map<String, Object> weightConfig = section(hybrid, "weights");
        final Map<String, Object> timeoutConfig = section(hybrid, "timeouts-ms");
        final Map<String, Object> ttlConfig = section(hybrid, "cache-ttl-seconds");
        for (final SourceType source : SourceType.values()) {
            if (weightConfig.containsKey(source.key())) {
                weights.put(source, ((Number) weightConfig.get(source.key())).doubleValue());
            }
            if (timeoutConfig.containsKey(source.key())) {
                timeoutsMs.put(source, ((Number) timeoutConfig.get(source.key())).longValue());
            }
            if (ttlConfig.containsKey(source.key())) {
                cacheTtlSeconds.put(source, ((Number) ttlConfig.get(source.key())).longValue());
            }
        }

        final Map<String, Object> snippet = section(root, "snippet");
        if (snippet.containsKey("window")) {
            this.snippetWindow = ((Number) snippet.get("window")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String propStorePath = System.getProperty(PROP_STORE_PATH);
        if (propStorePath != null && !propStorePath.isBlank()) {
            this.storePath = propStorePath.trim();
        }

        final String envStorePath = System.getenv(ENV_STORE_PATH);
        if (envStorePath != null && !envStorePath.isBlank()) {
            this.storePath = envStorePath.trim();
            logger.info("Store path from environment: {}", this.storePath);
        }

        if (this.storePath == null || this.storePath.isEmpty()) {
            this.storePath = getConfigDirectory().resolve("store").toString();
        }
    }

    private void determineProfile() {
        this.deployedMode = "deployed".equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        final StringBuilder result = new StringBuilder();
        int position = 0;
        int start;
        while ((start = value.indexOf("${", position)) >= 0) {
            final int end = value.indexOf('}', start);
            if (end < 0) {
                break;
            }
            result.append(value, position, start);

            final String[] parts = value.substring(start + 2, end).split(":", 2);
            String replacement = System.getenv(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], parts.length > 1 ? parts[1] : "");
            }
            result.append(resolveVariables(replacement));
            position = end + 1;
        }
        result.append(value.substring(position));
        return result.toString();
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * The hybrid configuration the service starts with.
     */
    public HybridConfig toHybridConfig() {
        final Set<SourceType> enabled = EnumSet.of(SourceType.BM25);
        if (semanticEnabled) {
            enabled.add(SourceType.SEMANTIC);
        }
        if (fuzzyEnabled) {
            enabled.add(SourceType.FUZZY);
        }
        return new HybridConfig(weights, enabled, rrfK, timeoutsMs, cacheTtlSeconds);
    }

    public Bm25Parameters getBm25Parameters() {
        return new Bm25Parameters(bm25K1, bm25B);
    }

    public String getStorePath() {
        return storePath;
    }

    public int getRrfK() {
        return rrfK;
    }

    public boolean isSemanticEnabled() {
        return semanticEnabled;
    }

    public boolean isFuzzyEnabled() {
        return fuzzyEnabled;
    }

    public long getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getSnippetWindow() {
        return snippetWindow;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
