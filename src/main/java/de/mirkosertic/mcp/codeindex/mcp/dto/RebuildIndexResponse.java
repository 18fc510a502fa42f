package de.mirkosertic.mcp.codeindex.mcp.dto;

/**
 * Response DTO for the rebuildIndex tool.
 */
public record RebuildIndexResponse(
        boolean success,
        int documentCount,
        long indexVersion,
        long durationMs,
        String error
) {

    public static RebuildIndexResponse success(final int documentCount, final long indexVersion,
                                               final long durationMs) {
        return new RebuildIndexResponse(true, documentCount, indexVersion, durationMs, null);
    }

    public static RebuildIndexResponse error(final String errorMessage) {
        return new RebuildIndexResponse(false, 0, 0, 0, errorMessage);
    }
}
