package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the removeDocument tool.
 */
public record RemoveDocumentRequest(
        @Description("Id of the document to remove.")
        String id
) {

    public static RemoveDocumentRequest fromMap(final Map<String, Object> args) {
        return new RemoveDocumentRequest((String) args.get("id"));
    }
}
