package de.mirkosertic.mcp.codeindex.dispatch;

import de.mirkosertic.mcp.codeindex.hybrid.FusedResult;
import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.HybridSearchOrchestrator;
import de.mirkosertic.mcp.codeindex.hybrid.HybridSearchResult;
import de.mirkosertic.mcp.codeindex.hybrid.SearchFilters;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import de.mirkosertic.mcp.codeindex.index.SymbolTable;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FallbackDispatcherTest {

    @Mock
    private HybridSearchOrchestrator orchestrator;

    private SymbolTable symbolTable;
    private FallbackDispatcher dispatcher;

    private static final HybridSearchResult HYBRID_RESULT = new HybridSearchResult(
            List.of(new FusedResult("doc9", 0.02, EnumSet.of(SourceType.BM25))), Set.of(), false);

    @BeforeEach
    void setUp() throws QuerySyntaxException {
        symbolTable = new SymbolTable();
        symbolTable.add(new IndexedDocument("doc1", "class HttpClient", Map.of(
                IndexedDocument.FIELD_SYMBOL, "HttpClient",
                IndexedDocument.FIELD_PATH, "src/HttpClient.java",
                IndexedDocument.FIELD_LANGUAGE, "java")));
        symbolTable.add(new IndexedDocument("doc2", "class HttpClient:", Map.of(
                IndexedDocument.FIELD_SYMBOL, "HttpClient",
                IndexedDocument.FIELD_PATH, "lib/http_client.py",
                IndexedDocument.FIELD_LANGUAGE, "python")));

        when(orchestrator.registeredSources()).thenReturn(EnumSet.of(SourceType.BM25, SourceType.FUZZY));
        when(orchestrator.search(anyString(), any(), anyInt(), any())).thenReturn(HYBRID_RESULT);

        dispatcher = new FallbackDispatcher(symbolTable, orchestrator);
    }

    @Test
    void testAutoModeShortCircuitsExactSymbol() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve(" HttpClient ", SearchMode.AUTO, SearchFilters.none(), 10,
                HybridConfig.defaults());

        assertThat(result.handler()).isEqualTo(DispatchHandler.SYMBOL_EXACT);
        assertThat(result.results()).extracting(FusedResult::docId).containsExactly("doc1", "doc2");
        assertThat(result.results()).allSatisfy(hit -> {
            assertThat(hit.fusedScore()).isEqualTo(1.0);
            assertThat(hit.contributingSources()).isEmpty();
        });
        assertThat(result.symbols()).hasSize(2);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testAutoModeIsCaseSensitiveForShortCircuit() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("httpclient", SearchMode.AUTO, SearchFilters.none(), 10,
                HybridConfig.defaults());

        assertThat(result.handler()).isEqualTo(DispatchHandler.HYBRID);
    }

    @Test
    void testAutoModeFallsThroughWhenFiltersExcludeAllSymbols() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("HttpClient", SearchMode.AUTO,
                new SearchFilters("rust", null), 10, HybridConfig.defaults());

        assertThat(result.handler()).isEqualTo(DispatchHandler.HYBRID);
        assertThat(result.results()).extracting(FusedResult::docId).containsExactly("doc9");
    }

    @Test
    void testSymbolModeFallsBackToIgnoreCase() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("httpclient", SearchMode.SYMBOL, SearchFilters.none(), 10,
                HybridConfig.defaults());

        assertThat(result.handler()).isEqualTo(DispatchHandler.SYMBOL_EXACT);
        assertThat(result.symbols()).hasSize(2);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testSymbolModeAppliesFiltersAndLimit() throws QuerySyntaxException {
        final DispatchResult filtered = dispatcher.resolve("HttpClient", SearchMode.SYMBOL,
                new SearchFilters("python", null), 10, HybridConfig.defaults());
        final DispatchResult limited = dispatcher.resolve("HttpClient", SearchMode.SYMBOL, SearchFilters.none(), 1,
                HybridConfig.defaults());

        assertThat(filtered.results()).extracting(FusedResult::docId).containsExactly("doc2");
        assertThat(limited.results()).extracting(FusedResult::docId).containsExactly("doc1");
    }

    @Test
    void testUnknownSymbolYieldsEmptySymbolResult() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("Nope", SearchMode.SYMBOL, SearchFilters.none(), 10,
                HybridConfig.defaults());

        assertThat(result.handler()).isEqualTo(DispatchHandler.SYMBOL_EXACT);
        assertThat(result.results()).isEmpty();
    }

    @Test
    void testFulltextUsesOnlyBm25() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("foo", SearchMode.FULLTEXT, SearchFilters.none(), 5,
                HybridConfig.defaults());

        final ArgumentCaptor<HybridConfig> config = ArgumentCaptor.forClass(HybridConfig.class);
        verify(orchestrator).search(eq("foo"), eq(SearchFilters.none()), eq(5), config.capture());
        assertThat(config.getValue().enabledSources()).containsExactly(SourceType.BM25);
        assertThat(result.handler()).isEqualTo(DispatchHandler.FULLTEXT);
    }

    @Test
    void testUnregisteredSemanticFallsBackToFulltext() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("foo", SearchMode.SEMANTIC, SearchFilters.none(), 5,
                HybridConfig.defaults());

        final ArgumentCaptor<HybridConfig> config = ArgumentCaptor.forClass(HybridConfig.class);
        verify(orchestrator).search(eq("foo"), any(), eq(5), config.capture());
        assertThat(config.getValue().enabledSources()).containsExactly(SourceType.BM25);
        assertThat(result.handler()).isEqualTo(DispatchHandler.FULLTEXT);
    }

    @Test
    void testRegisteredFuzzyRunsAlone() throws QuerySyntaxException {
        final DispatchResult result = dispatcher.resolve("foo", SearchMode.FUZZY, SearchFilters.none(), 5,
                HybridConfig.defaults());

        final ArgumentCaptor<HybridConfig> config = ArgumentCaptor.forClass(HybridConfig.class);
        verify(orchestrator).search(eq("foo"), any(), eq(5), config.capture());
        assertThat(config.getValue().enabledSources()).containsExactly(SourceType.FUZZY);
        assertThat(result.handler()).isEqualTo(DispatchHandler.HYBRID);
    }

    @Test
    void testHybridNarrowsToRegisteredSources() throws QuerySyntaxException {
        final HybridConfig stored = HybridConfig.defaults();

        dispatcher.resolve("foo", SearchMode.HYBRID, SearchFilters.none(), 5, stored);

        final ArgumentCaptor<HybridConfig> config = ArgumentCaptor.forClass(HybridConfig.class);
        verify(orchestrator).search(eq("foo"), any(), eq(5), config.capture());
        assertThat(config.getValue().enabledSources()).containsExactlyInAnyOrder(SourceType.BM25, SourceType.FUZZY);
        assertThat(stored.enabledSources()).hasSize(3);
    }

    @Test
    void testHybridWithNothingServableDegradesToFulltext() throws QuerySyntaxException {
        final HybridConfig semanticOnly = HybridConfig.defaults().withOnlySource(SourceType.SEMANTIC);

        final DispatchResult result = dispatcher.resolve("foo", SearchMode.HYBRID, SearchFilters.none(), 5,
                semanticOnly);

        assertThat(result.handler()).isEqualTo(DispatchHandler.FULLTEXT);
    }

    @Test
    void testBlankQueryIsRejected() {
        assertThatThrownBy(() -> dispatcher.resolve("  ", SearchMode.AUTO, SearchFilters.none(), 5,
                HybridConfig.defaults())).isInstanceOf(QuerySyntaxException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testSearchModeFromString() {
        assertThat(SearchMode.fromString(null)).isEqualTo(SearchMode.AUTO);
        assertThat(SearchMode.fromString(" ")).isEqualTo(SearchMode.AUTO);
        assertThat(SearchMode.fromString("Hybrid")).isEqualTo(SearchMode.HYBRID);
        assertThatThrownBy(() -> SearchMode.fromString("vector")).isInstanceOf(IllegalArgumentException.class);
    }
}
