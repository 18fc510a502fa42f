package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for the configureWeights and configureMethods tools: the configuration now in effect.
 *
 * @param weights           stored, sum-normalized weights per source
 * @param effectiveWeights  weights re-normalized over the enabled sources, as used by the fusion
 * @param registeredSources sources that have an implementation; enabled but unregistered sources
 *                          are skipped at search time
 */
public record ConfigurationResponse(
        boolean success,
        Map<String, Double> weights,
        Map<String, Double> effectiveWeights,
        List<String> enabledSources,
        List<String> registeredSources,
        int rrfK,
        long cacheTtlSeconds,
        String message,
        String error
) {

    public static ConfigurationResponse success(final HybridConfig config, final Collection<SourceType> registered,
                                                final String message) {
        return new ConfigurationResponse(true, keyed(config.weights()), keyed(config.normalizedWeights()),
                keys(config.enabledSources()), keys(registered), config.rrfK(), config.effectiveCacheTtlSeconds(),
                message, null);
    }

    public static ConfigurationResponse error(final String errorMessage) {
        return new ConfigurationResponse(false, null, null, null, null, 0, 0, null, errorMessage);
    }

    private static Map<String, Double> keyed(final Map<SourceType, Double> values) {
        final Map<String, Double> result = new LinkedHashMap<>();
        for (final Map.Entry<SourceType, Double> entry : values.entrySet()) {
            result.put(entry.getKey().key(), entry.getValue());
        }
        return result;
    }

    private static List<String> keys(final Collection<SourceType> sources) {
        final List<String> result = new ArrayList<>();
        for (final SourceType source : SourceType.values()) {
            if (sources.contains(source)) {
                result.add(source.key());
            }
        }
        return result;
    }
}
