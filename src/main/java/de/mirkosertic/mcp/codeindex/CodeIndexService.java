package de.mirkosertic.mcp.codeindex;

import de.mirkosertic.mcp.codeindex.analysis.CodeAnalyzer;
import de.mirkosertic.mcp.codeindex.config.ApplicationConfig;
import de.mirkosertic.mcp.codeindex.dispatch.DispatchResult;
import de.mirkosertic.mcp.codeindex.dispatch.FallbackDispatcher;
import de.mirkosertic.mcp.codeindex.dispatch.SearchMode;
import de.mirkosertic.mcp.codeindex.hybrid.Bm25Source;
import de.mirkosertic.mcp.codeindex.hybrid.ExternalRankedSource;
import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.HybridSearchOrchestrator;
import de.mirkosertic.mcp.codeindex.hybrid.RankedSource;
import de.mirkosertic.mcp.codeindex.hybrid.SearchBackend;
import de.mirkosertic.mcp.codeindex.hybrid.SearchCacheStats;
import de.mirkosertic.mcp.codeindex.hybrid.SearchFilters;
import de.mirkosertic.mcp.codeindex.hybrid.SearchResultCache;
import de.mirkosertic.mcp.codeindex.hybrid.SourceLatencyStats;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.hybrid.TrigramFuzzySource;
import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import de.mirkosertic.mcp.codeindex.index.InvertedIndex;
import de.mirkosertic.mcp.codeindex.index.SymbolDefinition;
import de.mirkosertic.mcp.codeindex.index.SymbolTable;
import de.mirkosertic.mcp.codeindex.query.Bm25Ranker;
import de.mirkosertic.mcp.codeindex.query.CodeQueryParser;
import de.mirkosertic.mcp.codeindex.query.QueryNode;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import de.mirkosertic.mcp.codeindex.snippet.MatchLocator;
import de.mirkosertic.mcp.codeindex.snippet.Snippet;
import de.mirkosertic.mcp.codeindex.snippet.SnippetExtractor;
import de.mirkosertic.mcp.codeindex.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Facade of the code index: owns the inverted index, the symbol table, the document store and
 * the current {@link HybridConfig}, and answers searches through the {@link FallbackDispatcher}.
 *
 * <p>The hybrid configuration is immutable and replaced atomically by the {@code configure*}
 * methods; a search always runs against the configuration it read when it started. Writes to
 * the store and the index are serialized by one lock, reads never take it.</p>
 */
public class CodeIndexService {

    private static final Logger logger = LoggerFactory.getLogger(CodeIndexService.class);

    private final DocumentStore store;
    private final InvertedIndex index;
    private final SymbolTable symbolTable;
    private final CodeQueryParser parser;
    private final HybridSearchOrchestrator orchestrator;
    private final FallbackDispatcher dispatcher;
    private final MatchLocator matchLocator;
    private final SnippetExtractor snippetExtractor;
    private final QueryRuntimeStats queryRuntimeStats = new QueryRuntimeStats();
    private final AtomicReference<HybridConfig> currentConfig;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * @param externalBackends backends for {@link SourceType#SEMANTIC} and optionally
     *                         {@link SourceType#FUZZY}; without a fuzzy backend the built-in
     *                         trigram source is used
     */
    public CodeIndexService(final ApplicationConfig config,
                            final DocumentStore store,
                            final Map<SourceType, SearchBackend> externalBackends) {
        this.store = store;

        final CodeAnalyzer analyzer = new CodeAnalyzer();
        this.index = new InvertedIndex(analyzer);
        this.symbolTable = new SymbolTable();
        this.parser = new CodeQueryParser(analyzer);
        this.matchLocator = new MatchLocator(analyzer);
        this.snippetExtractor = new SnippetExtractor(config.getSnippetWindow());

        final List<RankedSource> sources = new ArrayList<>();
        sources.add(new Bm25Source(index, new Bm25Ranker(config.getBm25Parameters())));
        final SearchBackend semantic = externalBackends.get(SourceType.SEMANTIC);
        if (semantic != null) {
            sources.add(new ExternalRankedSource(SourceType.SEMANTIC, semantic));
        }
        final SearchBackend fuzzy = externalBackends.get(SourceType.FUZZY);
        sources.add(fuzzy != null
                ? new ExternalRankedSource(SourceType.FUZZY, fuzzy)
                : new TrigramFuzzySource(index, symbolTable));

        final SearchResultCache cache = new SearchResultCache(config.getCacheMaxEntries(), new SearchCacheStats());
        this.orchestrator = new HybridSearchOrchestrator(parser, index, sources, cache, new SourceLatencyStats(),
                config.getThreadPoolSize());
        this.dispatcher = new FallbackDispatcher(symbolTable, orchestrator);
        this.currentConfig = new AtomicReference<>(config.toHybridConfig());
    }

    /**
     * Builds the index and the symbol table from the document store.
     */
    public void init() {
        final Collection<IndexedDocument> documents = store.all();
        writeLock.lock();
        try {
            index.replaceAll(documents);
            symbolTable.rebuild(documents);
        } finally {
            writeLock.unlock();
        }
        logger.info("Code index initialized with {} documents, {} terms, {} symbols",
                index.totalDocuments(), index.termCount(), symbolTable.size());
    }

    public DispatchResult search(final String query, final SearchMode mode, final SearchFilters filters,
                                 final int limit) throws QuerySyntaxException {
        final long started = System.nanoTime();
        final DispatchResult result = dispatcher.resolve(query, mode, filters, limit, currentConfig.get());
        final long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        queryRuntimeStats.recordQuery(durationMs, result.results().size(), result.handler(),
                !result.degradedSources().isEmpty());
        logger.info("Search '{}' mode={} handler={} hits={} cacheHit={} in {}ms", query, mode, result.handler(),
                result.results().size(), result.cacheHit(), durationMs);
        return result;
    }

    public QueryNode parse(final String query) throws QuerySyntaxException {
        return parser.parse(query);
    }

    /**
     * Excerpt of a stored document around the matches of the query.
     *
     * @return empty if the document is not in the store
     */
    public Optional<Snippet> snippet(final String docId, final QueryNode query) {
        return store.get(docId).map(document ->
                snippetExtractor.extract(document.text(), matchLocator.locate(query, document.text())));
    }

    public Optional<IndexedDocument> getDocument(final String docId) {
        return store.get(docId);
    }

    /**
     * Exact symbol lookup; falls back to a case-insensitive match if nothing matches exactly.
     */
    public List<SymbolDefinition> lookupSymbol(final String name) {
        final List<SymbolDefinition> exact = symbolTable.lookup(name.trim());
        return exact.isEmpty() ? symbolTable.lookupIgnoreCase(name.trim()) : exact;
    }

    /**
     * Stores and indexes the document, replacing an existing one with the same id.
     *
     * @throws IOException if the store cannot persist it; the index is not touched then
     */
    public void indexDocument(final IndexedDocument document) throws IOException {
        writeLock.lock();
        try {
            store.put(document);
            if (index.addDocument(document)) {
                symbolTable.add(document);
            } else {
                symbolTable.remove(document.id());
            }
        } finally {
            writeLock.unlock();
        }
        logger.debug("Indexed document {}", document.id());
    }

    /**
     * @return true if the document existed
     */
    public boolean removeDocument(final String docId) throws IOException {
        writeLock.lock();
        try {
            final boolean stored = store.remove(docId);
            final boolean indexed = index.removeDocument(docId);
            symbolTable.remove(docId);
            logger.debug("Removed document {} (stored={}, indexed={})", docId, stored, indexed);
            return stored || indexed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @throws IllegalArgumentException if a weight is negative or all are zero
     */
    public HybridConfig configureWeights(final double bm25, final double semantic, final double fuzzy) {
        final HybridConfig updated = currentConfig.updateAndGet(config -> config.withWeights(bm25, semantic, fuzzy));
        logger.info("Hybrid weights changed to {}", updated.weights());
        return updated;
    }

    /**
     * BM25 stays enabled for hybrid searches; a request to disable it is ignored.
     */
    public HybridConfig configureMethods(final boolean enableBm25, final boolean enableSemantic,
                                         final boolean enableFuzzy) {
        if (!enableBm25) {
            logger.warn("BM25 cannot be disabled for hybrid search, keeping it enabled");
        }
        final Set<SourceType> enabled = EnumSet.of(SourceType.BM25);
        if (enableSemantic) {
            enabled.add(SourceType.SEMANTIC);
        }
        if (enableFuzzy) {
            enabled.add(SourceType.FUZZY);
        }
        final HybridConfig updated = currentConfig.updateAndGet(config -> config.withEnabledSources(enabled));
        logger.info("Hybrid sources changed to {}", updated.enabledSources());
        return updated;
    }

    public HybridConfig currentConfig() {
        return currentConfig.get();
    }

    public Set<SourceType> registeredSources() {
        return orchestrator.registeredSources();
    }

    public IndexStatistics stats() {
        final SearchResultCache cache = orchestrator.getCache();
        final SearchCacheStats cacheStats = cache.getStats();
        return new IndexStatistics(
                index.totalDocuments(),
                index.termCount(),
                symbolTable.size(),
                index.version(),
                index.averageDocumentLength(),
                cacheStats.getHitRate(),
                cacheStats.getLookups(),
                cacheStats.getStaleEntries(),
                cacheStats.getEvictions(),
                cache.size(),
                orchestrator.getLatencyStats().snapshot(),
                queryRuntimeStats.getTotalQueries(),
                queryRuntimeStats.getAverageDurationMs(),
                queryRuntimeStats.getPercentiles(),
                currentConfig.get());
    }

    public QueryRuntimeStats getQueryRuntimeStats() {
        return queryRuntimeStats;
    }

    /**
     * Drops the index and rebuilds it from the document store. Writes wait for the rebuild,
     * searches keep running against the previous index until the new one is swapped in.
     *
     * @return number of indexed documents
     */
    public int rebuild() throws IOException {
        writeLock.lock();
        try {
            final long started = System.currentTimeMillis();
            store.reload();
            final Collection<IndexedDocument> documents = store.all();
            final int indexed = index.replaceAll(documents);
            symbolTable.rebuild(documents);
            logger.info("Rebuilt index from {} stored documents ({} indexed) in {}ms", documents.size(), indexed,
                    System.currentTimeMillis() - started);
            return indexed;
        } finally {
            writeLock.unlock();
        }
    }

    public void shutdown() {
        orchestrator.shutdown();
    }
}
