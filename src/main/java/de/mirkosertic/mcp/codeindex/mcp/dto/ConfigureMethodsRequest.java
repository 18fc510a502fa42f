package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the configureMethods tool. Omitted flags keep their current value.
 */
public record ConfigureMethodsRequest(
        @Nullable
        @Description("BM25 full-text search. Cannot be switched off for hybrid search.")
        Boolean enableBm25,

        @Nullable
        @Description("Semantic (vector) search, if a backend is configured.")
        Boolean enableSemantic,

        @Nullable
        @Description("Fuzzy identifier search.")
        Boolean enableFuzzy
) {

    public static ConfigureMethodsRequest fromMap(final Map<String, Object> args) {
        return new ConfigureMethodsRequest(
                (Boolean) args.get("enableBm25"),
                (Boolean) args.get("enableSemantic"),
                (Boolean) args.get("enableFuzzy")
        );
    }

    public boolean effectiveBm25(final HybridConfig current) {
        return enableBm25 != null ? enableBm25 : current.isEnabled(SourceType.BM25);
    }

    public boolean effectiveSemantic(final HybridConfig current) {
        return enableSemantic != null ? enableSemantic : current.isEnabled(SourceType.SEMANTIC);
    }

    public boolean effectiveFuzzy(final HybridConfig current) {
        return enableFuzzy != null ? enableFuzzy : current.isEnabled(SourceType.FUZZY);
    }
}
