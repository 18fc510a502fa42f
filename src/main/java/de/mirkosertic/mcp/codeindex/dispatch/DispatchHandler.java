package de.mirkosertic.mcp.codeindex.dispatch;

/**
 * The path that actually answered a query.
 */
public enum DispatchHandler {
    SYMBOL_EXACT,
    FULLTEXT,
    HYBRID
}
