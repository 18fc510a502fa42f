package de.mirkosertic.mcp.codeindex.analysis;

/**
 * A single term produced by {@link CodeAnalyzer} with its token position and character offsets.
 */
public record AnalyzedToken(String term, int position, int startOffset, int endOffset) {
}
