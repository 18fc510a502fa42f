package de.mirkosertic.mcp.codeindex.index;

import java.util.Map;

/**
 * Per-document length statistics owned by the {@link InvertedIndex}.
 *
 * @param id           the document id
 * @param length       number of token positions in the text
 * @param fieldLengths number of token positions per metadata field
 */
public record DocumentStats(String id, int length, Map<String, Integer> fieldLengths) {

    public DocumentStats {
        fieldLengths = fieldLengths != null ? Map.copyOf(fieldLengths) : Map.of();
    }
}
