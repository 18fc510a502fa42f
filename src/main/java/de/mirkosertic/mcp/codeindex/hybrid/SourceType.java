package de.mirkosertic.mcp.codeindex.hybrid;

import java.util.Locale;

/**
 * The ranked sources a hybrid search can fan out to.
 */
public enum SourceType {
    BM25,
    SEMANTIC,
    FUZZY;

    /**
     * Lower-case name as used in configuration keys and tool arguments.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceType fromKey(final String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
