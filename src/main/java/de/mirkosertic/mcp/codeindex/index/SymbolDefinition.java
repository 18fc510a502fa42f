package de.mirkosertic.mcp.codeindex.index;

import org.jspecify.annotations.Nullable;

/**
 * A symbol declared by an indexed document.
 */
public record SymbolDefinition(
        String name,
        @Nullable String kind,
        String docId,
        @Nullable String path,
        @Nullable String language,
        @Nullable Integer line
) {

    /**
     * @return the definition carried by the document's {@code symbol} field, or null if it has none
     */
    public static @Nullable SymbolDefinition fromDocument(final IndexedDocument document) {
        final String symbol = document.field(IndexedDocument.FIELD_SYMBOL);
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        return new SymbolDefinition(
                symbol.trim(),
                document.field(IndexedDocument.FIELD_KIND),
                document.id(),
                document.field(IndexedDocument.FIELD_PATH),
                document.field(IndexedDocument.FIELD_LANGUAGE),
                parseLine(document.field(IndexedDocument.FIELD_LINE)));
    }

    private static @Nullable Integer parseLine(final @Nullable String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(line.trim());
        } catch (final NumberFormatException e) {
            return null;
        }
    }
}
