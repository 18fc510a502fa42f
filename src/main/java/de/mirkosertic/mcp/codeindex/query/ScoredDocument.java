package de.mirkosertic.mcp.codeindex.query;

import java.util.Comparator;

public record ScoredDocument(String docId, double score) {

    /**
     * Score descending, doc id ascending.
     */
    public static final Comparator<ScoredDocument> RANKING_ORDER = Comparator
            .comparingDouble(ScoredDocument::score).reversed()
            .thenComparing(ScoredDocument::docId);
}
