package de.mirkosertic.mcp.codeindex.dispatch;

import java.util.Locale;

/**
 * How a caller wants a query to be answered.
 */
public enum SearchMode {
    /** Exact symbol short-circuit, otherwise hybrid. */
    AUTO,
    SYMBOL,
    FULLTEXT,
    HYBRID,
    BM25,
    SEMANTIC,
    FUZZY;

    /**
     * Parses a mode name case-insensitively, {@code null} or blank means {@link #AUTO}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SearchMode fromString(final String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
