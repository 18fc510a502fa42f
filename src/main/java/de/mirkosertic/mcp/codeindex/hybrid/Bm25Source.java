package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.index.InvertedIndex;
import de.mirkosertic.mcp.codeindex.query.Bm25Ranker;
import de.mirkosertic.mcp.codeindex.query.ScoredDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * The local full-text source. Never does I/O, so it runs without a timeout by default.
 * Documents rejected by the query's filter are skipped before the list is cut.
 */
public class Bm25Source implements RankedSource {

    private final InvertedIndex index;
    private final Bm25Ranker ranker;

    public Bm25Source(final InvertedIndex index, final Bm25Ranker ranker) {
        this.index = index;
        this.ranker = ranker;
    }

    @Override
    public SourceType type() {
        return SourceType.BM25;
    }

    @Override
    public List<ScoredDocument> search(final SourceQuery query, final int limit) {
        final List<ScoredDocument> scored = ranker.score(query.parsed(), index);
        final List<ScoredDocument> result = new ArrayList<>(Math.min(limit, scored.size()));
        for (final ScoredDocument document : scored) {
            if (result.size() >= limit) {
                break;
            }
            if (query.accepts(document.docId())) {
                result.add(document);
            }
        }
        return result;
    }
}
