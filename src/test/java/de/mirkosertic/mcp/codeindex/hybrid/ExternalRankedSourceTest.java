package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.query.ScoredDocument;
import de.mirkosertic.mcp.codeindex.query.QueryNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalRankedSourceTest {

    private static final SourceQuery QUERY = new SourceQuery("vector", new QueryNode.Term("vector"));

    @Test
    void testScoresFollowBackendOrder() {
        final ExternalRankedSource source = new ExternalRankedSource(SourceType.SEMANTIC,
                (query, limit) -> Arrays.asList("b", "a", "b", null, "c"));

        final List<ScoredDocument> results = source.search(QUERY, 10);

        assertThat(results).containsExactly(
                new ScoredDocument("b", 1.0),
                new ScoredDocument("a", 0.5),
                new ScoredDocument("c", 1.0 / 3));
    }

    @Test
    void testLimitCountsDistinctIds() {
        final ExternalRankedSource source = new ExternalRankedSource(SourceType.SEMANTIC,
                (query, limit) -> List.of("x", "x", "y", "z"));

        assertThat(source.search(QUERY, 2)).extracting(ScoredDocument::docId).containsExactly("x", "y");
    }

    @Test
    void testNullResultIsEmpty() {
        final ExternalRankedSource source = new ExternalRankedSource(SourceType.FUZZY, (query, limit) -> null);

        assertThat(source.search(QUERY, 5)).isEmpty();
        assertThat(source.type()).isEqualTo(SourceType.FUZZY);
    }

    @Test
    void testIoErrorBecomesSourceException() {
        final ExternalRankedSource source = new ExternalRankedSource(SourceType.SEMANTIC, (query, limit) -> {
            throw new IOException("connection refused");
        });

        assertThatThrownBy(() -> source.search(QUERY, 5))
                .isInstanceOf(SearchSourceException.class)
                .hasMessageContaining("connection refused")
                .hasCauseInstanceOf(IOException.class)
                .satisfies(e -> assertThat(((SearchSourceException) e).getSource()).isEqualTo(SourceType.SEMANTIC));
    }
}
