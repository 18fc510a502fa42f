package de.mirkosertic.mcp.codeindex.snippet;

import de.mirkosertic.mcp.codeindex.analysis.AnalyzedToken;
import de.mirkosertic.mcp.codeindex.analysis.CodeAnalyzer;
import de.mirkosertic.mcp.codeindex.query.QueryNode;
import de.mirkosertic.mcp.codeindex.query.QueryTerms;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the character spans in a document that a query matched.
 * <p>
 * Re-analyzes the document text with the index analyzer and reports the offsets of every token
 * that equals a positive query term or starts with a prefix stem.
 */
public class MatchLocator {

    private final CodeAnalyzer analyzer;

    public MatchLocator(final CodeAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public List<TextSpan> locate(final QueryNode query, final String text) {
        final QueryTerms queryTerms = QueryTerms.of(query);
        if (queryTerms.isEmpty() || text == null || text.isEmpty()) {
            return List.of();
        }

        final List<TextSpan> spans = new ArrayList<>();
        for (final AnalyzedToken token : analyzer.analyze(text)) {
            if (queryTerms.matches(token.term())) {
                spans.add(new TextSpan(token.startOffset(), token.endOffset()));
            }
        }
        return spans;
    }
}
