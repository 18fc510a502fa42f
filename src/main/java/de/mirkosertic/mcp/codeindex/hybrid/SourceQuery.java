package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.query.QueryNode;

import java.util.function.Predicate;

/**
 * What a {@link RankedSource} receives: the raw query text for backends with their own query
 * understanding, and the parsed tree for local sources.
 *
 * @param documentFilter accepts the ids of documents that pass the search filters; sources that
 *                       can check it must do so before cutting their list to the requested limit
 */
public record SourceQuery(String text, QueryNode parsed, Predicate<String> documentFilter) {

    public SourceQuery(final String text, final QueryNode parsed) {
        this(text, parsed, docId -> true);
    }

    public boolean accepts(final String docId) {
        return documentFilter.test(docId);
    }
}
