package de.mirkosertic.mcp.codeindex.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableTest {

    private SymbolTable symbolTable;

    @BeforeEach
    void setUp() {
        symbolTable = new SymbolTable();
    }

    private static IndexedDocument symbolDocument(final String id, final String symbol, final String path) {
        return new IndexedDocument(id, "body of " + symbol, Map.of(
                IndexedDocument.FIELD_SYMBOL, symbol,
                IndexedDocument.FIELD_KIND, "method",
                IndexedDocument.FIELD_PATH, path,
                IndexedDocument.FIELD_LANGUAGE, "java",
                IndexedDocument.FIELD_LINE, "42"));
    }

    @Test
    void testExactLookup() {
        symbolTable.add(symbolDocument("Foo.java#parse", "parse", "src/Foo.java"));

        final List<SymbolDefinition> definitions = symbolTable.lookup("parse");

        assertThat(definitions).hasSize(1);
        assertThat(definitions.get(0).docId()).isEqualTo("Foo.java#parse");
        assertThat(definitions.get(0).kind()).isEqualTo("method");
        assertThat(definitions.get(0).path()).isEqualTo("src/Foo.java");
        assertThat(definitions.get(0).line()).isEqualTo(42);
        assertThat(symbolTable.lookup("Parse")).isEmpty();
        assertThat(symbolTable.contains("parse")).isTrue();
    }

    @Test
    void testIgnoreCaseLookup() {
        symbolTable.add(symbolDocument("a", "QueryParser", "A.java"));

        assertThat(symbolTable.lookupIgnoreCase("queryparser")).extracting(SymbolDefinition::name)
                .containsExactly("QueryParser");
    }

    @Test
    void testSameNameInSeveralDocumentsIsOrderedByDocId() {
        symbolTable.add(symbolDocument("b", "run", "B.java"));
        symbolTable.add(symbolDocument("a", "run", "A.java"));

        assertThat(symbolTable.lookup("run")).extracting(SymbolDefinition::docId).containsExactly("a", "b");
        assertThat(symbolTable.size()).isEqualTo(2);
    }

    @Test
    void testReAddReplacesPreviousSymbolOfDocument() {
        symbolTable.add(symbolDocument("a", "oldName", "A.java"));
        symbolTable.add(symbolDocument("a", "newName", "A.java"));

        assertThat(symbolTable.contains("oldName")).isFalse();
        assertThat(symbolTable.contains("newName")).isTrue();
        assertThat(symbolTable.size()).isEqualTo(1);
    }

    @Test
    void testDocumentWithoutSymbolIsIgnored() {
        symbolTable.add(new IndexedDocument("a", "text", Map.of()));

        assertThat(symbolTable.size()).isZero();
        assertThat(symbolTable.names()).isEmpty();
    }

    @Test
    void testRemove() {
        symbolTable.add(symbolDocument("a", "run", "A.java"));
        symbolTable.add(symbolDocument("b", "run", "B.java"));

        assertThat(symbolTable.remove("a")).isTrue();
        assertThat(symbolTable.remove("a")).isFalse();
        assertThat(symbolTable.lookup("run")).extracting(SymbolDefinition::docId).containsExactly("b");
        assertThat(symbolTable.lookupIgnoreCase("RUN")).hasSize(1);
    }

    @Test
    void testRebuild() {
        symbolTable.add(symbolDocument("stale", "stale", "S.java"));

        symbolTable.rebuild(List.of(symbolDocument("a", "alpha", "A.java"), symbolDocument("b", "beta", "B.java")));

        assertThat(symbolTable.names()).containsExactlyInAnyOrder("alpha", "beta");
    }

    @Test
    void testUnparseableLineBecomesNull() {
        final SymbolDefinition definition = SymbolDefinition.fromDocument(new IndexedDocument("a", "",
                Map.of(IndexedDocument.FIELD_SYMBOL, " run ", IndexedDocument.FIELD_LINE, "n/a")));

        assertThat(definition).isNotNull();
        assertThat(definition.name()).isEqualTo("run");
        assertThat(definition.line()).isNull();
    }
}
