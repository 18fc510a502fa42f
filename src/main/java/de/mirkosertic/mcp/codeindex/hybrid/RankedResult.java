package de.mirkosertic.mcp.codeindex.hybrid;

/**
 * One entry of a single source's result list.
 *
 * @param rank 1-based position in the source's own ordering
 */
public record RankedResult(String docId, double score, SourceType source, int rank) {
}
