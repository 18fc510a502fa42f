package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.dispatch.SearchMode;
import de.mirkosertic.mcp.codeindex.hybrid.SearchFilters;
import de.mirkosertic.mcp.codeindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Description("The query. Bare terms are combined with AND; supports \"phrases\", AND, OR, NOT, "
                + "parentheses, prefix* and NEAR(a b, k).")
        String query,

        @Nullable
        @Description("How to answer the query: auto (default), symbol, fulltext, hybrid, bm25, semantic, fuzzy.")
        String mode,

        @Nullable
        @Description("Only return documents with this language, e.g. 'java'. Case-insensitive.")
        String language,

        @Nullable
        @Description("Only return documents whose path matches this glob, e.g. '*.java' or 'src/**/*.py'.")
        String pathGlob,

        @Nullable
        @Description("Maximum number of results. Default is 10, maximum is 100.")
        Integer limit,

        @Nullable
        @Description("Attach a highlighted snippet to every result. Default is true.")
        Boolean includeSnippets
) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public static SearchRequest fromMap(final Map<String, Object> args) {
        return new SearchRequest(
                (String) args.get("query"),
                (String) args.get("mode"),
                (String) args.get("language"),
                (String) args.get("pathGlob"),
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null,
                (Boolean) args.get("includeSnippets")
        );
    }

    /**
     * @throws IllegalArgumentException for an unknown mode
     */
    public SearchMode effectiveMode() {
        return SearchMode.fromString(mode);
    }

    public int effectiveLimit() {
        return (limit != null && limit > 0) ? Math.min(limit, MAX_LIMIT) : DEFAULT_LIMIT;
    }

    public boolean effectiveIncludeSnippets() {
        return includeSnippets == null || includeSnippets;
    }

    public SearchFilters filters() {
        return new SearchFilters(language, pathGlob);
    }
}
