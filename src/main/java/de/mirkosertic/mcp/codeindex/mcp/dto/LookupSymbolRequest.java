package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the lookupSymbol tool.
 */
public record LookupSymbolRequest(
        @Description("The symbol name, e.g. 'parseQuery' or 'QueryParser.parse'. Exact matches win, "
                + "otherwise the lookup ignores case.")
        String name
) {

    public static LookupSymbolRequest fromMap(final Map<String, Object> args) {
        return new LookupSymbolRequest((String) args.get("name"));
    }
}
