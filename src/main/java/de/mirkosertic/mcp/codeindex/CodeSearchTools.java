package de.mirkosertic.mcp.codeindex;

import de.mirkosertic.mcp.codeindex.config.BuildInfo;
import de.mirkosertic.mcp.codeindex.dispatch.DispatchResult;
import de.mirkosertic.mcp.codeindex.dispatch.SearchMode;
import de.mirkosertic.mcp.codeindex.hybrid.FusedResult;
import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.SourceLatencyStats;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import de.mirkosertic.mcp.codeindex.index.SymbolDefinition;
import de.mirkosertic.mcp.codeindex.mcp.SchemaGenerator;
import de.mirkosertic.mcp.codeindex.mcp.ToolResultHelper;
import de.mirkosertic.mcp.codeindex.mcp.dto.ConfigurationResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.ConfigureMethodsRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.ConfigureWeightsRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.IndexDocumentRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.IndexStatsResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.LookupSymbolRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.LookupSymbolResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.RebuildIndexResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.RemoveDocumentRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.SymbolHit;
import de.mirkosertic.mcp.codeindex.query.QueryNode;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import de.mirkosertic.mcp.codeindex.snippet.Snippet;
import de.mirkosertic.mcp.codeindex.snippet.TextSpan;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * MCP tools for the code index: search, symbol lookup, document maintenance and the hybrid
 * search configuration.
 */
public class CodeSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(CodeSearchTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search the code index. Matching is literal and case-insensitive without stemming. Qualified \
            identifiers are split at dots, so 'parser.parse_query' also matches 'parser' and 'parse_query'. \
            Query syntax: \
            - Terms: 'query parser' (implicit AND) \
            - Phrases: '"return result"' \
            - Boolean: 'a AND b', 'a OR b', 'NOT a', grouping with parentheses \
            - Prefix: 'pars*' \
            - Proximity: 'NEAR(token stream, 5)' matches both terms within 5 positions \
            Modes: 'auto' answers an exact symbol name directly and otherwise runs the hybrid search; \
            'symbol' only looks up symbols; 'fulltext' only uses BM25; 'hybrid' fuses BM25 with the \
            semantic and fuzzy sources by Reciprocal Rank Fusion. \
            Returns: ranked results with the contributing sources, highlighted snippets, the handler that \
            answered, degraded sources and whether the result came from the cache.""";

    private final CodeIndexService indexService;

    public CodeSearchTools(final CodeIndexService indexService) {
        this.indexService = indexService;
    }

    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("search")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchRequest.class))
                        .build())
                .callHandler((exchange, request) -> search(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("lookupSymbol")
                        .description("Find the definitions of a symbol (class, method, function) by name. "
                                + "Exact matches are returned first; if there are none, the lookup ignores case.")
                        .inputSchema(SchemaGenerator.generateSchema(LookupSymbolRequest.class))
                        .build())
                .callHandler((exchange, request) -> lookupSymbol(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("indexDocument")
                        .description("Add a document to the index or replace the document with the same id. "
                                + "A document is typically one symbol or one file as produced by a source parser.")
                        .inputSchema(SchemaGenerator.generateSchema(IndexDocumentRequest.class))
                        .build())
                .callHandler((exchange, request) -> indexDocument(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("removeDocument")
                        .description("Remove a document and its symbol from the index.")
                        .inputSchema(SchemaGenerator.generateSchema(RemoveDocumentRequest.class))
                        .build())
                .callHandler((exchange, request) -> removeDocument(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("configureWeights")
                        .description("Set the fusion weights of the BM25, semantic and fuzzy sources. "
                                + "Weights are normalized to sum 1. Affects all following hybrid searches.")
                        .inputSchema(SchemaGenerator.generateSchema(ConfigureWeightsRequest.class))
                        .build())
                .callHandler((exchange, request) -> configureWeights(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("configureMethods")
                        .description("Enable or disable the semantic and fuzzy sources of the hybrid search. "
                                + "Omitted flags keep their current value.")
                        .inputSchema(SchemaGenerator.generateSchema(ConfigureMethodsRequest.class))
                        .build())
                .callHandler((exchange, request) -> configureMethods(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStats")
                        .description("Get index statistics: document, term and symbol counts, the index version, "
                                + "result cache metrics, per-source latencies and query runtime percentiles.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getIndexStats())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("rebuildIndex")
                        .description("Drop the in-memory index and rebuild it from the document store. "
                                + "Invalidates all cached search results.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> rebuildIndex())
                .build());

        return tools;
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchRequest request = SearchRequest.fromMap(args);

        logger.info("Search request: query='{}', mode='{}', language='{}', pathGlob='{}', limit={}",
                request.query(), request.mode(), request.language(), request.pathGlob(), request.limit());

        try {
            final SearchMode mode = request.effectiveMode();
            final long startTime = System.nanoTime();
            final DispatchResult result = indexService.search(request.query(), mode, request.filters(),
                    request.effectiveLimit());

            final QueryNode parsed = request.effectiveIncludeSnippets() && !result.results().isEmpty()
                    ? parseForSnippets(request.query())
                    : null;
            final List<SearchResponse.SearchHit> hits = new ArrayList<>();
            for (final FusedResult fused : result.results()) {
                hits.add(toHit(fused, parsed));
            }
            final List<SymbolHit> symbols = new ArrayList<>();
            for (final SymbolDefinition definition : result.symbols()) {
                symbols.add(SymbolHit.of(definition));
            }
            final List<String> degraded = new ArrayList<>();
            for (final SourceType source : result.degradedSources()) {
                degraded.add(source.key());
            }
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            logger.info("Search completed in {}ms: handler={}, {} results, {} degraded sources, cacheHit={}",
                    durationMs, result.handler(), hits.size(), degraded.size(), result.cacheHit());

            return ToolResultHelper.createResult(SearchResponse.success(
                    result.handler().name().toLowerCase(), hits, symbols, degraded, result.cacheHit(), durationMs));

        } catch (final QuerySyntaxException e) {
            logger.warn("Invalid query syntax: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error("Invalid query syntax: " + e.getMessage()));
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error("Invalid search request: " + e.getMessage()));
        } catch (final CancellationException e) {
            logger.info("Search cancelled: query='{}'", request.query());
            return ToolResultHelper.createResult(SearchResponse.error("Search cancelled"));
        }
    }

    /**
     * Symbol lookups accept names the query grammar rejects; those results go without snippets.
     */
    private @Nullable QueryNode parseForSnippets(final String query) {
        try {
            return indexService.parse(query);
        } catch (final QuerySyntaxException e) {
            logger.debug("No snippets for '{}': {}", query, e.getMessage());
            return null;
        }
    }

    private SearchResponse.SearchHit toHit(final FusedResult fused, final @Nullable QueryNode parsed) {
        final List<String> sources = new ArrayList<>();
        for (final SourceType source : SourceType.values()) {
            if (fused.contributingSources().contains(source)) {
                sources.add(source.key());
            }
        }

        final Optional<IndexedDocument> document = indexService.getDocument(fused.docId());
        String snippetMarkup = null;
        List<SearchResponse.Highlight> highlights = null;
        if (parsed != null) {
            final Optional<Snippet> snippet = indexService.snippet(fused.docId(), parsed);
            if (snippet.isPresent()) {
                snippetMarkup = snippet.get().toMarkup();
                highlights = new ArrayList<>();
                for (final TextSpan span : snippet.get().highlights()) {
                    highlights.add(new SearchResponse.Highlight(span.start(), span.end()));
                }
            }
        }

        return new SearchResponse.SearchHit(
                fused.docId(),
                fused.fusedScore(),
                sources,
                document.map(d -> d.field(IndexedDocument.FIELD_PATH)).orElse(null),
                document.map(d -> d.field(IndexedDocument.FIELD_LANGUAGE)).orElse(null),
                document.map(d -> d.field(IndexedDocument.FIELD_SYMBOL)).orElse(null),
                snippetMarkup,
                highlights);
    }

    McpSchema.CallToolResult lookupSymbol(final Map<String, Object> args) {
        final LookupSymbolRequest request = LookupSymbolRequest.fromMap(args);

        logger.info("Lookup symbol request: name='{}'", request.name());

        if (request.name() == null || request.name().isBlank()) {
            return ToolResultHelper.createResult(LookupSymbolResponse.error("Symbol name must not be empty"));
        }

        final List<SymbolHit> symbols = new ArrayList<>();
        for (final SymbolDefinition definition : indexService.lookupSymbol(request.name())) {
            symbols.add(SymbolHit.of(definition));
        }
        logger.info("Lookup symbol '{}' found {} definitions", request.name(), symbols.size());
        return ToolResultHelper.createResult(LookupSymbolResponse.success(request.name(), symbols));
    }

    McpSchema.CallToolResult indexDocument(final Map<String, Object> args) {
        final IndexDocumentRequest request = IndexDocumentRequest.fromMap(args);

        logger.info("Index document request: id='{}', path='{}', symbol='{}'", request.id(), request.path(),
                request.symbol());

        try {
            final IndexedDocument document = request.toDocument();
            indexService.indexDocument(document);
            return ToolResultHelper.createResult(SimpleMessageResponse.success("Indexed document " + document.id()));

        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid document: {}", e.getMessage());
            return ToolResultHelper.createResult(SimpleMessageResponse.error("Invalid document: " + e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error indexing document {}", request.id(), e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error(
                    "Error indexing document: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult removeDocument(final Map<String, Object> args) {
        final RemoveDocumentRequest request = RemoveDocumentRequest.fromMap(args);

        logger.info("Remove document request: id='{}'", request.id());

        if (request.id() == null || request.id().isBlank()) {
            return ToolResultHelper.createResult(SimpleMessageResponse.error("id must not be blank"));
        }

        try {
            final boolean removed = indexService.removeDocument(request.id());
            if (!removed) {
                return ToolResultHelper.createResult(SimpleMessageResponse.error(
                        "Document not found: " + request.id()));
            }
            return ToolResultHelper.createResult(SimpleMessageResponse.success("Removed document " + request.id()));

        } catch (final IOException e) {
            logger.error("Error removing document {}", request.id(), e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error(
                    "Error removing document: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult configureWeights(final Map<String, Object> args) {
        final ConfigureWeightsRequest request = ConfigureWeightsRequest.fromMap(args);

        logger.info("Configure weights request: bm25={}, semantic={}, fuzzy={}", request.bm25(), request.semantic(),
                request.fuzzy());

        if (!request.isComplete()) {
            return ToolResultHelper.createResult(ConfigurationResponse.error(
                    "All three weights (bm25, semantic, fuzzy) are required"));
        }

        try {
            final HybridConfig updated = indexService.configureWeights(request.bm25(), request.semantic(),
                    request.fuzzy());
            return ToolResultHelper.createResult(ConfigurationResponse.success(updated,
                    indexService.registeredSources(), "Weights updated"));

        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid weights: {}", e.getMessage());
            return ToolResultHelper.createResult(ConfigurationResponse.error("Invalid weights: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult configureMethods(final Map<String, Object> args) {
        final ConfigureMethodsRequest request = ConfigureMethodsRequest.fromMap(args);

        logger.info("Configure methods request: bm25={}, semantic={}, fuzzy={}", request.enableBm25(),
                request.enableSemantic(), request.enableFuzzy());

        final HybridConfig current = indexService.currentConfig();
        final HybridConfig updated = indexService.configureMethods(
                request.effectiveBm25(current),
                request.effectiveSemantic(current),
                request.effectiveFuzzy(current));

        final String message = Boolean.FALSE.equals(request.enableBm25())
                ? "Methods updated, BM25 stays enabled"
                : "Methods updated";
        return ToolResultHelper.createResult(ConfigurationResponse.success(updated,
                indexService.registeredSources(), message));
    }

    McpSchema.CallToolResult getIndexStats() {
        logger.info("Index stats request");

        try {
            final IndexStatistics stats = indexService.stats();

            final IndexStatsResponse.CacheMetrics cacheMetrics = new IndexStatsResponse.CacheMetrics(
                    String.format("%.1f%%", stats.cacheHitRate() * 100.0),
                    stats.cacheLookups(),
                    stats.cacheStaleEntries(),
                    stats.cacheEvictions(),
                    stats.cacheSize());

            final Map<String, IndexStatsResponse.SourceMetrics> sourceMetrics = new LinkedHashMap<>();
            for (final SourceType source : SourceType.values()) {
                final SourceLatencyStats.SourceSnapshot snapshot = stats.sourceLatencies().get(source);
                if (snapshot == null) {
                    continue;
                }
                sourceMetrics.put(source.key(), new IndexStatsResponse.SourceMetrics(
                        indexService.registeredSources().contains(source),
                        stats.config().isEnabled(source),
                        snapshot.calls(),
                        String.format("%.2f", snapshot.averageLatencyMs()),
                        String.format("%.2f", snapshot.maxLatencyMs()),
                        snapshot.timeouts(),
                        snapshot.failures()));
            }

            final QueryRuntimeStats.Percentiles percentiles = stats.queryPercentiles();
            final IndexStatsResponse.QueryRuntimeMetrics runtimeMetrics = new IndexStatsResponse.QueryRuntimeMetrics(
                    stats.totalQueries(),
                    String.format("%.2f", stats.averageQueryDurationMs()),
                    percentiles != null ? percentiles.p50() : null,
                    percentiles != null ? percentiles.p75() : null,
                    percentiles != null ? percentiles.p90() : null,
                    percentiles != null ? percentiles.p95() : null,
                    percentiles != null ? percentiles.p99() : null);

            logger.info("Index stats: {} documents, {} terms, {} symbols, version {}", stats.documentCount(),
                    stats.termCount(), stats.symbolCount(), stats.indexVersion());

            return ToolResultHelper.createResult(IndexStatsResponse.success(
                    stats.documentCount(),
                    stats.termCount(),
                    stats.symbolCount(),
                    stats.indexVersion(),
                    String.format("%.1f", stats.averageDocumentLength()),
                    BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp(),
                    cacheMetrics,
                    sourceMetrics,
                    runtimeMetrics));

        } catch (final RuntimeException e) {
            logger.error("Error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error(
                    "Error getting index stats: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult rebuildIndex() {
        logger.info("Rebuild index request");

        try {
            final long startTime = System.nanoTime();
            final int documentCount = indexService.rebuild();
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            return ToolResultHelper.createResult(RebuildIndexResponse.success(documentCount,
                    indexService.stats().indexVersion(), durationMs));

        } catch (final IOException e) {
            logger.error("Error rebuilding index", e);
            return ToolResultHelper.createResult(RebuildIndexResponse.error(
                    "Error rebuilding index: " + e.getMessage()));
        }
    }
}
