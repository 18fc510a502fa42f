package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.query.ScoredDocument;

import java.util.List;

/**
 * A source the {@link HybridSearchOrchestrator} fans out to.
 * <p>
 * Implementations are called from worker threads, possibly concurrently, and may be interrupted
 * when their deadline passes or the search is cancelled.
 */
public interface RankedSource {

    SourceType type();

    /**
     * @param query the query
     * @param limit maximum number of results wanted
     * @return scored documents, in any order; ranks are assigned by the orchestrator
     * @throws SearchSourceException if the source fails
     */
    List<ScoredDocument> search(SourceQuery query, int limit);
}
