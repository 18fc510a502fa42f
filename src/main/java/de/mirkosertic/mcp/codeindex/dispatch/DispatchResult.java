package de.mirkosertic.mcp.codeindex.dispatch;

import de.mirkosertic.mcp.codeindex.hybrid.FusedResult;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.index.SymbolDefinition;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link FallbackDispatcher#resolve}.
 *
 * @param handler         the path that answered
 * @param results         ranked results; for {@link DispatchHandler#SYMBOL_EXACT} one entry per
 *                        definition with score 1.0 and no contributing source
 * @param symbols         matching symbol definitions, empty unless the symbol path answered
 * @param degradedSources sources that failed or timed out
 * @param cacheHit        true if the hybrid result came from the cache
 */
public record DispatchResult(
        DispatchHandler handler,
        List<FusedResult> results,
        List<SymbolDefinition> symbols,
        Set<SourceType> degradedSources,
        boolean cacheHit
) {

    public DispatchResult {
        results = List.copyOf(results);
        symbols = List.copyOf(symbols);
        final EnumSet<SourceType> degraded = EnumSet.noneOf(SourceType.class);
        degraded.addAll(degradedSources);
        degradedSources = Collections.unmodifiableSet(degraded);
    }
}
