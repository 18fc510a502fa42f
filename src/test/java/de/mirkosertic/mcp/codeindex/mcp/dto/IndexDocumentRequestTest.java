package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexDocumentRequestTest {

    @Test
    void testDedicatedParametersOverrideFields() {
        final Map<String, Object> fieldMap = new HashMap<>();
        fieldMap.put("path", "old/Path.java");
        fieldMap.put("owner", "team-a");
        fieldMap.put("ignored", null);

        final IndexedDocument document = IndexDocumentRequest.fromMap(Map.of(
                "id", "Foo.java#bar",
                "text", "void bar()",
                "path", "src/Foo.java",
                "symbol", "bar",
                "line", 7,
                "fields", fieldMap)).toDocument();

        assertThat(document.id()).isEqualTo("Foo.java#bar");
        assertThat(document.fields())
                .containsEntry(IndexedDocument.FIELD_PATH, "src/Foo.java")
                .containsEntry(IndexedDocument.FIELD_SYMBOL, "bar")
                .containsEntry(IndexedDocument.FIELD_LINE, "7")
                .containsEntry("owner", "team-a")
                .doesNotContainKey("ignored")
                .doesNotContainKey(IndexedDocument.FIELD_LANGUAGE);
    }

    @Test
    void testBlankIdIsRejected() {
        final IndexDocumentRequest request = IndexDocumentRequest.fromMap(Map.of("id", " ", "text", "x"));

        assertThatThrownBy(request::toDocument).isInstanceOf(IllegalArgumentException.class);
    }
}
