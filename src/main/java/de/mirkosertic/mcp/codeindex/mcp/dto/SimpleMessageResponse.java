package de.mirkosertic.mcp.codeindex.mcp.dto;

/**
 * Response DTO for tools that only report success and a message, such as indexDocument
 * and removeDocument.
 */
public record SimpleMessageResponse(
        boolean success,
        String message,
        String error
) {

    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
