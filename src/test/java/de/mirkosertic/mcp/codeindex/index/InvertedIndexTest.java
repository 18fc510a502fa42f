package de.mirkosertic.mcp.codeindex.index;

import de.mirkosertic.mcp.codeindex.analysis.CodeAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InvertedIndexTest {

    private InvertedIndex index;

    @BeforeEach
    void setUp() {
        index = new InvertedIndex(new CodeAnalyzer());
    }

    @Test
    void testAddDocumentBuildsPositionalPostings() {
        assertThat(index.addDocument("a", "foo bar foo", Map.of())).isTrue();

        assertThat(index.getPostings("foo")).containsExactly(new Posting("a", new int[]{0, 2}));
        assertThat(index.getPostings("bar")).containsExactly(new Posting("a", new int[]{1}));
        assertThat(index.documentFrequency("foo")).isEqualTo(1);
        assertThat(index.documentLength("a")).isEqualTo(3);
        assertThat(index.totalDocuments()).isEqualTo(1);
        assertThat(index.averageDocumentLength()).isEqualTo(3.0);
    }

    @Test
    void testDocumentLengthCountsDistinctPositions() {
        // foo.bar and foo share position 0, bar is at 1, baz at 2
        index.addDocument("a", "foo.bar baz", Map.of());

        assertThat(index.documentLength("a")).isEqualTo(3);
        assertThat(index.getPostings("foo.bar")).containsExactly(new Posting("a", new int[]{0}));
        assertThat(index.getPostings("foo")).containsExactly(new Posting("a", new int[]{0}));
        assertThat(index.getPostings("bar")).containsExactly(new Posting("a", new int[]{1}));
    }

    @Test
    void testReindexReplacesPreviousPostings() {
        index.addDocument("a", "alpha beta", Map.of());
        index.addDocument("a", "alpha gamma gamma", Map.of());

        assertThat(index.totalDocuments()).isEqualTo(1);
        assertThat(index.getPostings("beta")).isEmpty();
        assertThat(index.getPostings("alpha")).hasSize(1);
        assertThat(index.getPostings("gamma").get(0).termFrequency()).isEqualTo(2);
        assertThat(index.averageDocumentLength()).isEqualTo(3.0);
    }

    @Test
    void testReindexingSameContentIsIdempotent() {
        index.addDocument("a", "alpha beta", Map.of());
        index.addDocument("b", "beta gamma delta", Map.of());
        final List<Posting> before = index.getPostings("beta");
        final double averageBefore = index.averageDocumentLength();

        index.addDocument("a", "alpha beta", Map.of());

        assertThat(index.getPostings("beta")).isEqualTo(before);
        assertThat(index.totalDocuments()).isEqualTo(2);
        assertThat(index.averageDocumentLength()).isEqualTo(averageBefore);
    }

    @Test
    void testPostingsAreSortedByDocumentId() {
        index.addDocument("c", "shared", Map.of());
        index.addDocument("a", "shared", Map.of());
        index.addDocument("b", "shared", Map.of());

        assertThat(index.getPostings("shared")).extracting(Posting::docId).containsExactly("a", "b", "c");
    }

    @Test
    void testRemoveDocument() {
        index.addDocument("a", "alpha beta", Map.of());
        index.addDocument("b", "beta", Map.of());

        assertThat(index.removeDocument("a")).isTrue();
        assertThat(index.removeDocument("a")).isFalse();

        assertThat(index.getPostings("alpha")).isEmpty();
        assertThat(index.termCount()).isEqualTo(1);
        assertThat(index.totalDocuments()).isEqualTo(1);
        assertThat(index.averageDocumentLength()).isEqualTo(1.0);
        assertThat(index.containsDocument("a")).isFalse();
    }

    @Test
    void testVersionIncrementsOnEveryMutation() {
        final long initial = index.version();

        index.addDocument("a", "alpha", Map.of());
        final long afterAdd = index.version();
        index.removeDocument("missing");
        final long afterNoop = index.version();
        index.removeDocument("a");

        assertThat(afterAdd).isGreaterThan(initial);
        assertThat(afterNoop).isEqualTo(afterAdd);
        assertThat(index.version()).isGreaterThan(afterNoop);
    }

    @Test
    void testCorruptDocumentIsDroppedWithoutTouchingOthers() {
        index.addDocument("good", "alpha", Map.of());
        final Posting broken = new Posting("bad", 3, new int[]{0});

        final boolean indexed = index.addAnalyzed(new DocumentStats("bad", 1, Map.of()),
                Map.of("alpha", broken), Map.of());

        assertThat(indexed).isFalse();
        assertThat(index.containsDocument("bad")).isFalse();
        assertThat(index.getPostings("alpha")).extracting(Posting::docId).containsExactly("good");
        assertThat(index.totalDocuments()).isEqualTo(1);
    }

    @Test
    void testNegativeLengthIsRejected() {
        final boolean indexed = index.addAnalyzed(new DocumentStats("bad", -1, Map.of()), Map.of(), Map.of());

        assertThat(indexed).isFalse();
        assertThat(index.totalDocuments()).isZero();
    }

    @Test
    void testReplaceAllSwapsState() {
        index.addDocument("old", "legacy", Map.of());

        final int indexed = index.replaceAll(List.of(
                new IndexedDocument("a", "alpha", Map.of()),
                new IndexedDocument("b", "beta", Map.of()),
                new IndexedDocument("a", "alpha again", Map.of())));

        assertThat(indexed).isEqualTo(2);
        assertThat(index.containsDocument("old")).isFalse();
        assertThat(index.getPostings("legacy")).isEmpty();
        assertThat(index.getPostings("again")).hasSize(1);
        assertThat(index.documentIds()).containsExactly("a", "b");
    }

    @Test
    void testTermsWithPrefix() {
        index.addDocument("a", "parse parser parsing other", Map.of());

        assertThat(index.termsWithPrefix("pars")).containsExactly("parse", "parser", "parsing");
        assertThat(index.termsWithPrefix("zzz")).isEmpty();
    }

    @Test
    void testFieldsAreKeptAndUnknownDocumentsAreEmpty() {
        index.addDocument("a", "alpha", Map.of(IndexedDocument.FIELD_LANGUAGE, "java"));

        assertThat(index.documentFields("a")).containsEntry(IndexedDocument.FIELD_LANGUAGE, "java");
        assertThat(index.documentFields("missing")).isEmpty();
        assertThat(index.documentStats("a").fieldLengths()).containsEntry(IndexedDocument.FIELD_LANGUAGE, 1);
        assertThat(index.documentLength("missing")).isZero();
    }

    @Test
    void testEmptyDocumentHasZeroLength() {
        index.addDocument("empty", "", Map.of());

        assertThat(index.containsDocument("empty")).isTrue();
        assertThat(index.documentLength("empty")).isZero();
        assertThat(index.averageDocumentLength()).isEqualTo(0.0);
    }
}
