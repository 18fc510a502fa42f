package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.Map;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        int documentCount,
        int termCount,
        int symbolCount,
        long indexVersion,
        String averageDocumentLength,
        String softwareVersion,
        String buildTimestamp,
        CacheMetrics cacheMetrics,
        Map<String, SourceMetrics> sourceMetrics,
        QueryRuntimeMetrics queryRuntimeMetrics,
        String error
) {

    /**
     * Hybrid result cache counters.
     */
    public record CacheMetrics(
            String hitRate,
            long lookups,
            long staleEntries,
            long evictions,
            long size
    ) {
    }

    /**
     * Fan-out statistics of one source.
     */
    public record SourceMetrics(
            boolean registered,
            boolean enabled,
            long calls,
            String averageLatencyMs,
            String maxLatencyMs,
            long timeouts,
            long failures
    ) {
    }

    /**
     * Aggregate search performance.
     */
    public record QueryRuntimeMetrics(
            long totalQueries,
            String averageDurationMs,
            Long p50Ms,
            Long p75Ms,
            Long p90Ms,
            Long p95Ms,
            Long p99Ms
    ) {
    }

    public static IndexStatsResponse success(final int documentCount, final int termCount, final int symbolCount,
                                             final long indexVersion, final String averageDocumentLength,
                                             final String softwareVersion, final String buildTimestamp,
                                             final CacheMetrics cacheMetrics,
                                             final Map<String, SourceMetrics> sourceMetrics,
                                             final QueryRuntimeMetrics queryRuntimeMetrics) {
        return new IndexStatsResponse(true, documentCount, termCount, symbolCount, indexVersion,
                averageDocumentLength, softwareVersion, buildTimestamp, cacheMetrics, sourceMetrics,
                queryRuntimeMetrics, null);
    }

    public static IndexStatsResponse error(final String errorMessage) {
        return new IndexStatsResponse(false, 0, 0, 0, 0, null, null, null, null, null, null, errorMessage);
    }
}
