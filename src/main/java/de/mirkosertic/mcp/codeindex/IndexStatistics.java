package de.mirkosertic.mcp.codeindex;

import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SourceLatencyStats;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Point-in-time view of the service's counters.
 *
 * @param cacheHitRate     hits divided by lookups of the hybrid result cache, 0.0 without lookups
 * @param sourceLatencies  call statistics per source, including sources never called
 * @param queryPercentiles null before the first search
 */
public record IndexStatistics(
        int documentCount,
        int termCount,
        int symbolCount,
        long indexVersion,
        double averageDocumentLength,
        double cacheHitRate,
        long cacheLookups,
        long cacheStaleEntries,
        long cacheEvictions,
        long cacheSize,
        Map<SourceType, SourceLatencyStats.SourceSnapshot> sourceLatencies,
        long totalQueries,
        double averageQueryDurationMs,
        QueryRuntimeStats.@Nullable Percentiles queryPercentiles,
        HybridConfig config
) {

    public IndexStatistics {
        sourceLatencies = Map.copyOf(sourceLatencies);
    }

    public double averageLatencyMs(final SourceType source) {
        final SourceLatencyStats.SourceSnapshot snapshot = sourceLatencies.get(source);
        return snapshot != null ? snapshot.averageLatencyMs() : 0.0;
    }
}
