package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.List;

/**
 * Response DTO for the lookupSymbol tool.
 */
public record LookupSymbolResponse(
        boolean success,
        String name,
        List<SymbolHit> symbols,
        String error
) {

    public static LookupSymbolResponse success(final String name, final List<SymbolHit> symbols) {
        return new LookupSymbolResponse(true, name, symbols, null);
    }

    public static LookupSymbolResponse error(final String errorMessage) {
        return new LookupSymbolResponse(false, null, null, errorMessage);
    }
}
