package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import de.mirkosertic.mcp.codeindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for the indexDocument tool. Parser output for one document.
 */
public record IndexDocumentRequest(
        @Description("Stable document id, typically path plus symbol, e.g. 'src/Foo.java#parse'. "
                + "An existing document with this id is replaced.")
        String id,

        @Description("The text to index.")
        String text,

        @Nullable
        @Description("Path of the source file.")
        String path,

        @Nullable
        @Description("Language of the source file, e.g. 'java'.")
        String language,

        @Nullable
        @Description("Name of the symbol this document declares, enables exact symbol lookup.")
        String symbol,

        @Nullable
        @Description("Kind of the symbol, e.g. 'class', 'method', 'function'.")
        String kind,

        @Nullable
        @Description("1-based line of the declaration.")
        Integer line,

        @Nullable
        @Description("Additional metadata fields.")
        Map<String, String> fields
) {

    @SuppressWarnings("unchecked")
    public static IndexDocumentRequest fromMap(final Map<String, Object> args) {
        final Map<String, String> fields;
        if (args.get("fields") instanceof Map<?, ?> rawFields) {
            fields = new HashMap<>();
            for (final Map.Entry<?, ?> entry : ((Map<Object, Object>) rawFields).entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    fields.put(entry.getKey().toString(), entry.getValue().toString());
                }
            }
        } else {
            fields = null;
        }

        return new IndexDocumentRequest(
                (String) args.get("id"),
                (String) args.get("text"),
                (String) args.get("path"),
                (String) args.get("language"),
                (String) args.get("symbol"),
                (String) args.get("kind"),
                args.get("line") != null ? ((Number) args.get("line")).intValue() : null,
                fields
        );
    }

    /**
     * Merges the dedicated parameters over {@link #fields()}.
     *
     * @throws IllegalArgumentException if the id is missing
     */
    public IndexedDocument toDocument() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        final Map<String, String> merged = new HashMap<>();
        if (fields != null) {
            merged.putAll(fields);
        }
        putIfPresent(merged, IndexedDocument.FIELD_PATH, path);
        putIfPresent(merged, IndexedDocument.FIELD_LANGUAGE, language);
        putIfPresent(merged, IndexedDocument.FIELD_SYMBOL, symbol);
        putIfPresent(merged, IndexedDocument.FIELD_KIND, kind);
        if (line != null) {
            merged.put(IndexedDocument.FIELD_LINE, line.toString());
        }
        return new IndexedDocument(id, text, merged);
    }

    private static void putIfPresent(final Map<String, String> fields, final String key, final @Nullable String value) {
        if (value != null && !value.isBlank()) {
            fields.put(key, value);
        }
    }
}
