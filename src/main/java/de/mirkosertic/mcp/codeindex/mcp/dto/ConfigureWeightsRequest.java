package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the configureWeights tool.
 */
public record ConfigureWeightsRequest(
        @Description("Weight of the BM25 full-text source. Must not be negative.")
        Double bm25,

        @Description("Weight of the semantic source. Must not be negative.")
        Double semantic,

        @Description("Weight of the fuzzy source. Must not be negative.")
        Double fuzzy
) {

    public static ConfigureWeightsRequest fromMap(final Map<String, Object> args) {
        return new ConfigureWeightsRequest(number(args.get("bm25")), number(args.get("semantic")),
                number(args.get("fuzzy")));
    }

    private static Double number(final Object value) {
        return value != null ? ((Number) value).doubleValue() : null;
    }

    public boolean isComplete() {
        return bm25 != null && semantic != null && fuzzy != null;
    }
}
