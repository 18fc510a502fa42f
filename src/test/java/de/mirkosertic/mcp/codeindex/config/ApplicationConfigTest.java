package de.mirkosertic.mcp.codeindex.config;

import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ApplicationConfig}.
 */
@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("codeindex.test.dir");
    }

    private static InputStream yaml(final String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Defaults should match the built-in hybrid configuration")
    void defaultsMatchHybridDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults(tempDir);

        assertThat(config.getStorePath()).isEqualTo(tempDir.toString());
        assertThat(config.toHybridConfig()).isEqualTo(HybridConfig.defaults());
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    @DisplayName("YAML values should override the defaults")
    void yamlOverridesDefaults() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                codeindex:
                  bm25:
                    k1: 1.5
                    b: 0.5
                  hybrid:
                    rrf-k: 30
                    enable-semantic: false
                    thread-pool-size: 8
                    weights:
                      bm25: 0.7
                      fuzzy: 0.3
                    timeouts-ms:
                      fuzzy: 500
                    cache-ttl-seconds:
                      bm25: 60
                  snippet:
                    window: 40
                """), tempDir);

        final HybridConfig hybrid = config.toHybridConfig();
        assertThat(config.getBm25Parameters().k1()).isEqualTo(1.5);
        assertThat(config.getBm25Parameters().b()).isEqualTo(0.5);
        assertThat(config.getRrfK()).isEqualTo(30);
        assertThat(config.getThreadPoolSize()).isEqualTo(8);
        assertThat(config.getSnippetWindow()).isEqualTo(40);
        assertThat(hybrid.enabledSources()).containsExactlyInAnyOrder(SourceType.BM25, SourceType.FUZZY);
        assertThat(hybrid.weights()).containsEntry(SourceType.BM25, 0.7).containsEntry(SourceType.FUZZY, 0.3);
        assertThat(hybrid.timeoutMs(SourceType.FUZZY)).isEqualTo(500);
        assertThat(hybrid.cacheTtlSeconds()).containsEntry(SourceType.BM25, 60L);
        assertThat(hybrid.rrfK()).isEqualTo(30);
    }

    @Test
    @DisplayName("Store path should resolve variables")
    void storePathResolvesVariables() {
        System.setProperty("codeindex.test.dir", "/data");

        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                codeindex:
                  store:
                    path: ${codeindex.test.dir}/store
                """), tempDir);

        assertThat(config.getStorePath()).isEqualTo("/data/store");
    }

    @Test
    @DisplayName("Broken YAML should keep the defaults")
    void brokenYamlKeepsDefaults() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("codeindex: [unclosed"), tempDir);

        assertThat(config.toHybridConfig()).isEqualTo(HybridConfig.defaults());
    }

    @Test
    @DisplayName("Unknown sections should be ignored")
    void unknownSectionsAreIgnored() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                other:
                  key: value
                """), tempDir);

        assertThat(config.getStorePath()).isEqualTo(tempDir.toString());
    }

    @Test
    @DisplayName("Variables should fall back to their default value")
    void resolveVariablesUsesDefault() {
        assertThat(ApplicationConfig.resolveVariables("${CODEINDEX_SURELY_UNSET_VARIABLE:/fallback}/x"))
                .isEqualTo("/fallback/x");
        assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
        assertThat(ApplicationConfig.resolveVariables(null)).isNull();
    }
}
