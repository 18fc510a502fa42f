package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.index.SymbolDefinition;

/**
 * A symbol definition as returned by the search and lookupSymbol tools.
 */
public record SymbolHit(String name, String kind, String docId, String path, String language, Integer line) {

    public static SymbolHit of(final SymbolDefinition definition) {
        return new SymbolHit(definition.name(), definition.kind(), definition.docId(), definition.path(),
                definition.language(), definition.line());
    }
}
