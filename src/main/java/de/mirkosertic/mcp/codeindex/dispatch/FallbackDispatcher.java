package de.mirkosertic.mcp.codeindex.dispatch;

import de.mirkosertic.mcp.codeindex.hybrid.FusedResult;
import de.mirkosertic.mcp.codeindex.hybrid.HybridConfig;
import de.mirkosertic.mcp.codeindex.hybrid.HybridSearchOrchestrator;
import de.mirkosertic.mcp.codeindex.hybrid.HybridSearchResult;
import de.mirkosertic.mcp.codeindex.hybrid.SearchFilters;
import de.mirkosertic.mcp.codeindex.hybrid.SourceType;
import de.mirkosertic.mcp.codeindex.hybrid.SourceUnavailableException;
import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import de.mirkosertic.mcp.codeindex.index.SymbolDefinition;
import de.mirkosertic.mcp.codeindex.index.SymbolTable;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Chooses, per query, between the exact symbol path, BM25 only and the hybrid fan-out.
 *
 * <p>In {@link SearchMode#AUTO} an exact symbol name is answered by a single map lookup and
 * never reaches the orchestrator. Sources that are enabled but not registered are dropped from
 * the configuration used for this call; if nothing servable remains the query degrades to
 * BM25 only. The stored configuration is never changed here.</p>
 */
public class FallbackDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(FallbackDispatcher.class);

    private static final double SYMBOL_SCORE = 1.0;

    private final SymbolTable symbolTable;
    private final HybridSearchOrchestrator orchestrator;

    public FallbackDispatcher(final SymbolTable symbolTable, final HybridSearchOrchestrator orchestrator) {
        this.symbolTable = symbolTable;
        this.orchestrator = orchestrator;
    }

    public DispatchResult resolve(final String query, final SearchMode mode, final SearchFilters filters,
                                  final int limit, final HybridConfig config) throws QuerySyntaxException {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException("Query must not be empty", -1);
        }
        final String trimmed = query.trim();

        switch (mode) {
            case AUTO: {
                if (symbolTable.contains(trimmed)) {
                    final DispatchResult symbolResult = symbols(symbolTable.lookup(trimmed), filters, limit);
                    if (!symbolResult.symbols().isEmpty()) {
                        logger.debug("Exact symbol match for '{}'", trimmed);
                        return symbolResult;
                    }
                }
                return hybrid(trimmed, filters, limit, config);
            }
            case SYMBOL: {
                List<SymbolDefinition> definitions = symbolTable.lookup(trimmed);
                if (definitions.isEmpty()) {
                    definitions = symbolTable.lookupIgnoreCase(trimmed);
                }
                return symbols(definitions, filters, limit);
            }
            case FULLTEXT:
            case BM25:
                return fulltext(trimmed, filters, limit, config);
            case SEMANTIC:
                return single(SourceType.SEMANTIC, trimmed, filters, limit, config);
            case FUZZY:
                return single(SourceType.FUZZY, trimmed, filters, limit, config);
            case HYBRID:
            default:
                return hybrid(trimmed, filters, limit, config);
        }
    }

    private DispatchResult hybrid(final String query, final SearchFilters filters, final int limit,
                                  final HybridConfig config) throws QuerySyntaxException {
        final HybridConfig narrowed = narrow(config);
        if (narrowed.enabledSources().isEmpty()) {
            return fulltext(query, filters, limit, config);
        }
        final HybridSearchResult result = orchestrator.search(query, filters, limit, narrowed);
        return new DispatchResult(DispatchHandler.HYBRID, result.results(), List.of(), result.degradedSources(),
                result.cacheHit());
    }

    private DispatchResult single(final SourceType source, final String query, final SearchFilters filters,
                                  final int limit, final HybridConfig config) throws QuerySyntaxException {
        if (!orchestrator.registeredSources().contains(source)) {
            logger.debug("Falling back to full-text search: {}", new SourceUnavailableException(source).getMessage());
            return fulltext(query, filters, limit, config);
        }
        final HybridSearchResult result = orchestrator.search(query, filters, limit, config.withOnlySource(source));
        return new DispatchResult(DispatchHandler.HYBRID, result.results(), List.of(), result.degradedSources(),
                result.cacheHit());
    }

    private DispatchResult fulltext(final String query, final SearchFilters filters, final int limit,
                                    final HybridConfig config) throws QuerySyntaxException {
        final HybridSearchResult result = orchestrator.search(query, filters, limit,
                config.withOnlySource(SourceType.BM25));
        return new DispatchResult(DispatchHandler.FULLTEXT, result.results(), List.of(), result.degradedSources(),
                result.cacheHit());
    }

    private HybridConfig narrow(final HybridConfig config) {
        final Set<SourceType> unavailable = EnumSet.noneOf(SourceType.class);
        for (final SourceType source : config.enabledSources()) {
            if (!orchestrator.registeredSources().contains(source)) {
                logger.debug("Narrowing enabled sources: {}", new SourceUnavailableException(source).getMessage());
                unavailable.add(source);
            }
        }
        return unavailable.isEmpty() ? config : config.withoutSources(unavailable);
    }

    private static DispatchResult symbols(final List<SymbolDefinition> definitions, final SearchFilters filters,
                                          final int limit) {
        final Predicate<Map<String, String>> predicate = filters.toPredicate();
        final List<SymbolDefinition> matching = new ArrayList<>();
        final List<FusedResult> results = new ArrayList<>();
        for (final SymbolDefinition definition : definitions) {
            if (matching.size() >= limit) {
                break;
            }
            if (predicate.test(fieldsOf(definition))) {
                matching.add(definition);
                results.add(new FusedResult(definition.docId(), SYMBOL_SCORE, Set.of()));
            }
        }
        return new DispatchResult(DispatchHandler.SYMBOL_EXACT, results, matching, Set.of(), false);
    }

    private static Map<String, String> fieldsOf(final SymbolDefinition definition) {
        final Map<String, String> fields = new HashMap<>();
        if (definition.path() != null) {
            fields.put(IndexedDocument.FIELD_PATH, definition.path());
        }
        if (definition.language() != null) {
            fields.put(IndexedDocument.FIELD_LANGUAGE, definition.language());
        }
        return fields;
    }
}
