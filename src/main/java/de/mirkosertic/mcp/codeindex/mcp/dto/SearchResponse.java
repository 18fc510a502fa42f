package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.List;

/**
 * Response DTO for the search tool.
 *
 * <p>{@code handler} tells which path answered: {@code symbol_exact} for the exact symbol
 * short-circuit, {@code fulltext} for BM25 only, {@code hybrid} for the fused fan-out.
 * {@code degradedSources} lists sources that failed or timed out and therefore contributed
 * nothing to this answer.</p>
 */
public record SearchResponse(
        boolean success,
        String handler,
        List<SearchHit> results,
        List<SymbolHit> symbols,
        List<String> degradedSources,
        boolean cacheHit,
        long searchTimeMs,
        String error
) {

    /**
     * One ranked document.
     *
     * @param score   fused score, 1.0 for exact symbol matches
     * @param sources sources whose lists contained the document
     * @param snippet excerpt with matches wrapped in {@code <em>}, null if not requested or not stored
     */
    public record SearchHit(
            String docId,
            double score,
            List<String> sources,
            String path,
            String language,
            String symbol,
            String snippet,
            List<Highlight> highlights
    ) {
    }

    /**
     * Highlight offsets relative to the plain snippet text.
     */
    public record Highlight(int start, int end) {
    }

    public static SearchResponse success(final String handler, final List<SearchHit> results,
                                         final List<SymbolHit> symbols, final List<String> degradedSources,
                                         final boolean cacheHit, final long searchTimeMs) {
        return new SearchResponse(true, handler, results, symbols, degradedSources, cacheHit, searchTimeMs, null);
    }

    public static SearchResponse error(final String errorMessage) {
        return new SearchResponse(false, null, null, null, null, false, 0, errorMessage);
    }
}
