package de.mirkosertic.mcp.codeindex;

import de.mirkosertic.mcp.codeindex.config.ApplicationConfig;
import de.mirkosertic.mcp.codeindex.dispatch.DispatchHandler;
import de.mirkosertic.mcp.codeindex.dispatch.DispatchResult;
import de.mirkosertic.mcp.codeindex.dispatch.SearchMode;
import de.mirkosertic.mcp.codeindex.hybrid.FusedResult;
import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SearchBackend;
import de.mirkosertic.mcp.codeindex.hybrid.SearchFilters;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import de.mirkosertic.mcp.codeindex.snippet.Snippet;
import de.mirkosertic.mcp.codeindex.store.DocumentStore;
import de.mirkosertic.mcp.codeindex.store.InMemoryDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of {@link CodeIndexService} against an in-memory store.
 */
@DisplayName("CodeIndexService")
class CodeIndexServiceTest {

    @TempDir
    Path tempDir;

    private InMemoryDocumentStore store;
    private CodeIndexService service;

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryDocumentStore();
        service = new CodeIndexService(ApplicationConfig.defaults(tempDir), store, Map.of());
        service.init();

        service.indexDocument(new IndexedDocument("client", "public class HttpClient opens a connection",
                Map.of(IndexedDocument.FIELD_SYMBOL, "HttpClient",
                        IndexedDocument.FIELD_KIND, "class",
                        IndexedDocument.FIELD_PATH, "src/net/HttpClient.java",
                        IndexedDocument.FIELD_LANGUAGE, "java",
                        IndexedDocument.FIELD_LINE, "3")));
        service.indexDocument(new IndexedDocument("pool", "the connection pool reuses sockets",
                Map.of(IndexedDocument.FIELD_PATH, "src/net/pool.py",
                        IndexedDocument.FIELD_LANGUAGE, "python")));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static List<String> ids(final DispatchResult result) {
        return result.results().stream().map(FusedResult::docId).toList();
    }

    @Test
    @DisplayName("Exact symbol names should be answered by the symbol table")
    void exactSymbolShortCircuits() throws QuerySyntaxException {
        final DispatchResult result = service.search("HttpClient", SearchMode.AUTO, SearchFilters.none(), 10);

        assertThat(result.handler()).isEqualTo(DispatchHandler.SYMBOL_EXACT);
        assertThat(result.symbols()).singleElement().satisfies(symbol -> {
            assertThat(symbol.kind()).isEqualTo("class");
            assertThat(symbol.line()).isEqualTo(3);
        });
        assertThat(service.getQueryRuntimeStats().getQueries(DispatchHandler.SYMBOL_EXACT)).isEqualTo(1);
    }

    @Test
    @DisplayName("Free text should run the hybrid search")
    void freeTextRunsHybrid() throws QuerySyntaxException {
        final DispatchResult result = service.search("connection", SearchMode.AUTO, SearchFilters.none(), 10);

        assertThat(result.handler()).isEqualTo(DispatchHandler.HYBRID);
        assertThat(ids(result)).containsExactlyInAnyOrder("client", "pool");
        assertThat(result.degradedSources()).isEmpty();
    }

    @Test
    @DisplayName("Filters should restrict the results")
    void filtersRestrictResults() throws QuerySyntaxException {
        final DispatchResult result = service.search("connection", SearchMode.FULLTEXT,
                new SearchFilters("python", null), 10);

        assertThat(ids(result)).containsExactly("pool");
    }

    @Test
    @DisplayName("Snippets should highlight the matched terms")
    void snippetHighlightsMatches() throws QuerySyntaxException {
        final Optional<Snippet> snippet = service.snippet("pool", service.parse("sockets"));

        assertThat(snippet).isPresent();
        assertThat(snippet.get().toMarkup()).contains("<em>sockets</em>");
        assertThat(service.snippet("missing", service.parse("sockets"))).isEmpty();
    }

    @Test
    @DisplayName("Removed documents should disappear from search and symbols")
    void removeDocument() throws IOException, QuerySyntaxException {
        assertThat(service.removeDocument("client")).isTrue();
        assertThat(service.removeDocument("client")).isFalse();

        assertThat(service.lookupSymbol("HttpClient")).isEmpty();
        assertThat(ids(service.search("connection", SearchMode.FULLTEXT, SearchFilters.none(), 10)))
                .containsExactly("pool");
    }

    @Test
    @DisplayName("Symbol lookup should fall back to case-insensitive matching")
    void lookupSymbolIgnoresCaseAsFallback() {
        assertThat(service.lookupSymbol("httpclient")).extracting(symbol -> symbol.docId())
                .containsExactly("client");
    }

    @Test
    @DisplayName("Weights should be normalized and rejected when invalid")
    void configureWeights() {
        final HybridConfig config = service.configureWeights(2, 1, 1);

        assertThat(config.weights().get(SourceType.BM25)).isCloseTo(0.5, within(1e-12));
        assertThat(service.currentConfig()).isEqualTo(config);
        assertThatThrownBy(() -> service.configureWeights(0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(service.currentConfig()).isEqualTo(config);
    }

    @Test
    @DisplayName("BM25 should stay enabled")
    void bm25CannotBeDisabled() {
        final HybridConfig config = service.configureMethods(false, false, true);

        assertThat(config.enabledSources()).containsExactlyInAnyOrder(SourceType.BM25, SourceType.FUZZY);
    }

    @Test
    @DisplayName("Statistics should reflect index and cache state")
    void statistics() throws QuerySyntaxException {
        service.search("connection", SearchMode.HYBRID, SearchFilters.none(), 10);
        service.search("connection", SearchMode.HYBRID, SearchFilters.none(), 10);

        final IndexStatistics stats = service.stats();

        assertThat(stats.documentCount()).isEqualTo(2);
        assertThat(stats.symbolCount()).isEqualTo(1);
        assertThat(stats.cacheLookups()).isEqualTo(2);
        assertThat(stats.cacheHitRate()).isEqualTo(0.5);
        assertThat(stats.totalQueries()).isEqualTo(2);
        assertThat(stats.queryPercentiles()).isNotNull();
        assertThat(stats.sourceLatencies()).containsOnlyKeys(SourceType.values());
        assertThat(stats.sourceLatencies().get(SourceType.BM25).calls()).isEqualTo(1);
        assertThat(service.registeredSources()).containsExactlyInAnyOrder(SourceType.BM25, SourceType.FUZZY);
    }

    @Test
    @DisplayName("Rebuild should restore the index from the store")
    void rebuildFromStore() throws IOException, QuerySyntaxException {
        store.put(new IndexedDocument("late", "connection added behind the index", Map.of()));

        assertThat(service.rebuild()).isEqualTo(3);
        assertThat(ids(service.search("connection", SearchMode.FULLTEXT, SearchFilters.none(), 10)))
                .contains("late");
    }

    @Test
    @DisplayName("A configured semantic backend should take part in hybrid search")
    void semanticBackendParticipates() throws IOException, QuerySyntaxException {
        final SearchBackend semantic = (query, limit) -> List.of("pool");
        final CodeIndexService withSemantic = new CodeIndexService(ApplicationConfig.defaults(tempDir), store,
                Map.of(SourceType.SEMANTIC, semantic));
        try {
            withSemantic.init();

            final DispatchResult result = withSemantic.search("sockets", SearchMode.HYBRID, SearchFilters.none(),
                    10);

            assertThat(withSemantic.registeredSources()).contains(SourceType.SEMANTIC);
            assertThat(result.results().get(0).contributingSources()).contains(SourceType.SEMANTIC);
        } finally {
            withSemantic.shutdown();
        }
    }

    @Test
    @DisplayName("A failing store should leave the index untouched")
    void storeFailureKeepsIndexConsistent() throws IOException {
        final DocumentStore failing = mock(DocumentStore.class);
        when(failing.all()).thenReturn(List.of());
        doThrow(new IOException("disk full")).when(failing).put(any());
        final CodeIndexService failingService = new CodeIndexService(ApplicationConfig.defaults(tempDir), failing,
                Map.of());
        try {
            failingService.init();

            assertThatThrownBy(() -> failingService.indexDocument(new IndexedDocument("x", "text", Map.of())))
                    .isInstanceOf(IOException.class);
            assertThat(failingService.stats().documentCount()).isZero();
        } finally {
            failingService.shutdown();
        }
    }
}
