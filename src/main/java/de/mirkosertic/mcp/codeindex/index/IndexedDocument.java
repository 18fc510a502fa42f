package de.mirkosertic.mcp.codeindex.index;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * A document as produced by a language parser: a stable id, the searchable text and
 * metadata fields.
 *
 * @param id     caller assigned identity, typically a path plus symbol key
 * @param text   the text to index
 * @param fields metadata, see the {@code FIELD_*} constants for the recognized keys
 */
public record IndexedDocument(String id, String text, Map<String, String> fields) {

    public static final String FIELD_PATH = "path";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_SYMBOL = "symbol";
    public static final String FIELD_KIND = "kind";
    public static final String FIELD_LINE = "line";

    public IndexedDocument {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        text = text != null ? text : "";
        fields = fields != null ? Map.copyOf(fields) : Map.of();
    }

    public @Nullable String field(final String name) {
        return fields.get(name);
    }
}
