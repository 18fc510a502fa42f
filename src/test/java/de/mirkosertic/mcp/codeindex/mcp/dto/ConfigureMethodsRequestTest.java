package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigureMethodsRequestTest {

    @Test
    void testOmittedFlagsKeepCurrentValue() {
        final HybridConfig current = HybridConfig.defaults().withoutSources(EnumSet.of(SourceType.FUZZY));
        final ConfigureMethodsRequest request = ConfigureMethodsRequest.fromMap(Map.of("enableSemantic", false));

        assertThat(request.effectiveBm25(current)).isTrue();
        assertThat(request.effectiveSemantic(current)).isFalse();
        assertThat(request.effectiveFuzzy(current)).isFalse();
    }

    @Test
    void testIncompleteWeights() {
        assertThat(ConfigureWeightsRequest.fromMap(Map.of("bm25", 1, "semantic", 0.5)).isComplete()).isFalse();
        assertThat(ConfigureWeightsRequest.fromMap(Map.of("bm25", 1, "semantic", 0.5, "fuzzy", 0)).isComplete())
                .isTrue();
    }
}
