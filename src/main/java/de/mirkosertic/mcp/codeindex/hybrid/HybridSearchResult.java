package de.mirkosertic.mcp.codeindex.hybrid;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a hybrid search.
 *
 * @param results         fused results, already filtered and truncated
 * @param degradedSources enabled sources that failed or timed out and contributed nothing
 * @param cacheHit        true if served from the result cache
 */
public record HybridSearchResult(List<FusedResult> results, Set<SourceType> degradedSources, boolean cacheHit) {

    public HybridSearchResult {
        results = List.copyOf(results);
        final EnumSet<SourceType> degraded = EnumSet.noneOf(SourceType.class);
        degraded.addAll(degradedSources);
        degradedSources = Collections.unmodifiableSet(degraded);
    }
}
