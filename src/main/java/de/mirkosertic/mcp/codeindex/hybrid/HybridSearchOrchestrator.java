package de.mirkosertic.mcp.codeindex.hybrid;

import com.google.common.hash.Hashing;
import de.mirkosertic.mcp.codeindex.index.InvertedIndex;
import de.mirkosertic.mcp.codeindex.query.CodeQueryParser;
import de.mirkosertic.mcp.codeindex.query.QueryNode;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import de.mirkosertic.mcp.codeindex.query.ScoredDocument;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Fans a query out to all enabled {@link RankedSource}s, fuses their lists with
 * {@link ReciprocalRankFusion}, filters, truncates and caches the result.
 *
 * <p>Every source runs as its own task on a pool of its own and is joined with its own deadline,
 * measured from the start of the fan-out. A source that fails or misses its deadline is
 * cancelled, contributes nothing and is reported as degraded. Only a syntax error in the query
 * fails a search, and it does so before any source is called. A backend that ignores interrupts
 * can only tie up threads of its own pool, never those of the other sources.</p>
 *
 * <p>Search filters are handed to the sources, local sources drop non-matching documents before
 * they cut their candidate lists. The fused list is filtered once more for external sources.</p>
 *
 * <p>If the thread running a search is interrupted, or the future returned by
 * {@link #searchAsync} is cancelled, all in-flight source calls are cancelled, partial results
 * are dropped and nothing is cached.</p>
 */
public class HybridSearchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(HybridSearchOrchestrator.class);

    public static final int DEFAULT_THREAD_POOL_SIZE = 4;

    private static final int CANDIDATE_FACTOR = 3;
    private static final int FILTERED_CANDIDATE_FACTOR = 10;

    private final CodeQueryParser parser;
    private final InvertedIndex index;
    private final Map<SourceType, RankedSource> sources;
    private final SearchResultCache cache;
    private final SourceLatencyStats latencyStats;
    private final Map<SourceType, ExecutorService> sourceExecutors;
    private final ExecutorService coordinatorExecutor;

    public HybridSearchOrchestrator(final CodeQueryParser parser,
                                    final InvertedIndex index,
                                    final List<RankedSource> sources,
                                    final SearchResultCache cache,
                                    final SourceLatencyStats latencyStats,
                                    final int threadPoolSize) {
        this.parser = parser;
        this.index = index;
        this.cache = cache;
        this.latencyStats = latencyStats;

        final Map<SourceType, RankedSource> registered = new EnumMap<>(SourceType.class);
        for (final RankedSource source : sources) {
            if (registered.put(source.type(), source) != null) {
                throw new IllegalArgumentException("More than one source registered for " + source.type().key());
            }
        }
        this.sources = Collections.unmodifiableMap(registered);

        final int poolSize = Math.max(threadPoolSize, 1);
        final Map<SourceType, ExecutorService> executors = new EnumMap<>(SourceType.class);
        for (final SourceType type : this.sources.keySet()) {
            executors.put(type, Executors.newFixedThreadPool(poolSize,
                    namedDaemonThreads("search-" + type.key() + "-")));
        }
        this.sourceExecutors = Collections.unmodifiableMap(executors);
        this.coordinatorExecutor = Executors.newCachedThreadPool(namedDaemonThreads("search-coordinator-"));

        logger.info("HybridSearchOrchestrator initialized with sources {} and {} threads per source",
                this.sources.keySet(), poolSize);
    }

    private static ThreadFactory namedDaemonThreads(final String prefix) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            final Thread thread = new Thread(r, prefix + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    public Set<SourceType> registeredSources() {
        return sources.keySet();
    }

    public SearchResultCache getCache() {
        return cache;
    }

    public SourceLatencyStats getLatencyStats() {
        return latencyStats;
    }

    /**
     * Runs a hybrid search on the calling thread.
     *
     * @throws QuerySyntaxException  if the query cannot be parsed; no source is called then
     * @throws CancellationException if the calling thread was interrupted while waiting
     */
    public HybridSearchResult search(final String query, final SearchFilters filters, final int limit,
                                     final HybridConfig config) throws QuerySyntaxException {
        final QueryNode parsed = parser.parse(query);
        return execute(sourceQuery(query, parsed, filters), filters, limit, config);
    }

    /**
     * Runs a hybrid search on the coordinator pool. The query is parsed before this method
     * returns. Cancelling the returned future interrupts the search and all of its source calls.
     */
    public CompletableFuture<HybridSearchResult> searchAsync(final String query, final SearchFilters filters,
                                                             final int limit, final HybridConfig config)
            throws QuerySyntaxException {
        final SourceQuery sourceQuery = sourceQuery(query, parser.parse(query), filters);

        final CompletableFuture<HybridSearchResult> result = new CompletableFuture<>();
        final Future<?> task = coordinatorExecutor.submit(() -> {
            try {
                result.complete(execute(sourceQuery, filters, limit, config));
            } catch (final RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    private SourceQuery sourceQuery(final String text, final QueryNode parsed, final SearchFilters filters) {
        if (filters.isEmpty()) {
            return new SourceQuery(text, parsed);
        }
        final Predicate<Map<String, String>> predicate = filters.toPredicate();
        return new SourceQuery(text, parsed, docId -> predicate.test(index.documentFields(docId)));
    }

    private HybridSearchResult execute(final SourceQuery query, final SearchFilters filters, final int limit,
                                       final HybridConfig config) {
        if (limit <= 0) {
            return new HybridSearchResult(List.of(), Set.of(), false);
        }

        final HybridConfig active = narrowToRegistered(config);
        final long indexVersion = index.version();
        final String fingerprint = fingerprint(query.parsed(), filters, limit, active);

        final SearchResultCache.Entry cached = cache.get(fingerprint, indexVersion);
        if (cached != null) {
            logger.debug("Cache hit for query '{}'", query.text());
            return new HybridSearchResult(cached.results(), cached.degradedSources(), true);
        }

        final int depth = candidateDepth(limit, filters);
        final Map<SourceType, List<RankedResult>> rankedLists = new EnumMap<>(SourceType.class);
        final Set<SourceType> degraded = EnumSet.noneOf(SourceType.class);
        fanOut(query, depth, active, rankedLists, degraded);

        final List<FusedResult> fused = ReciprocalRankFusion.fuse(rankedLists, active.normalizedWeights(),
                active.rrfK());
        final List<FusedResult> results = filterAndTruncate(fused, filters, limit);

        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Search for '" + query.text() + "' was cancelled");
        }

        cache.put(new SearchResultCache.Entry(fingerprint, results, degraded, System.currentTimeMillis(),
                active.effectiveCacheTtlSeconds(), indexVersion));

        if (!degraded.isEmpty()) {
            logger.warn("Query '{}' served with degraded sources {}", query.text(), degraded);
        }
        logger.debug("Query '{}' fused {} candidates into {} results", query.text(), fused.size(), results.size());
        return new HybridSearchResult(results, degraded, false);
    }

    private HybridConfig narrowToRegistered(final HybridConfig config) {
        final EnumSet<SourceType> missing = EnumSet.noneOf(SourceType.class);
        for (final SourceType source : config.enabledSources()) {
            if (!sources.containsKey(source)) {
                missing.add(source);
            }
        }
        if (missing.isEmpty()) {
            return config;
        }
        for (final SourceType source : missing) {
            logger.debug("Narrowing enabled sources for this call: {}",
                    new SourceUnavailableException(source).getMessage());
        }
        return config.withoutSources(missing);
    }

    private void fanOut(final SourceQuery query, final int depth, final HybridConfig config,
                        final Map<SourceType, List<RankedResult>> rankedLists, final Set<SourceType> degraded) {
        final long started = System.nanoTime();
        final Map<SourceType, Future<List<ScoredDocument>>> futures = new EnumMap<>(SourceType.class);
        for (final SourceType type : config.enabledSources()) {
            final RankedSource source = sources.get(type);
            futures.put(type, sourceExecutors.get(type).submit(() -> {
                final long callStarted = System.nanoTime();
                final List<ScoredDocument> documents = source.search(query, depth);
                latencyStats.recordCall(type, System.nanoTime() - callStarted);
                return documents;
            }));
        }

        try {
            for (final Map.Entry<SourceType, Future<List<ScoredDocument>>> entry : futures.entrySet()) {
                final SourceType type = entry.getKey();
                final List<ScoredDocument> documents = await(type, entry.getValue(), started,
                        config.timeoutMs(type));
                if (documents == null) {
                    degraded.add(type);
                } else {
                    rankedLists.put(type, ReciprocalRankFusion.assignRanks(type, documents));
                }
            }
        } catch (final InterruptedException e) {
            for (final Future<List<ScoredDocument>> future : futures.values()) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new CancellationException("Search for '" + query.text() + "' was cancelled");
        }
    }

    /**
     * @return the source's documents, or {@code null} if it failed or timed out
     */
    private @Nullable List<ScoredDocument> await(final SourceType type, final Future<List<ScoredDocument>> future,
                                       final long fanOutStarted, final long timeoutMs) throws InterruptedException {
        try {
            if (timeoutMs > 0) {
                final long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMs) - (System.nanoTime() - fanOutStarted);
                return future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            }
            return future.get();
        } catch (final TimeoutException e) {
            future.cancel(true);
            latencyStats.recordTimeout(type);
            final SourceTimeoutException timeout = new SourceTimeoutException(type, timeoutMs);
            logger.warn("Source degraded: {}", timeout.getMessage());
            return null;
        } catch (final ExecutionException e) {
            latencyStats.recordFailure(type);
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Source {} failed: {}", type.key(), cause.getMessage(), cause);
            return null;
        }
    }

    private List<FusedResult> filterAndTruncate(final List<FusedResult> fused, final SearchFilters filters,
                                                final int limit) {
        final Predicate<Map<String, String>> predicate = filters.toPredicate();
        final boolean filtering = !filters.isEmpty();
        final List<FusedResult> results = new ArrayList<>(Math.min(limit, fused.size()));
        for (final FusedResult result : fused) {
            if (results.size() >= limit) {
                break;
            }
            if (!filtering || predicate.test(index.documentFields(result.docId()))) {
                results.add(result);
            }
        }
        return results;
    }

    private static int candidateDepth(final int limit, final SearchFilters filters) {
        final long factor = filters.isEmpty() ? CANDIDATE_FACTOR : FILTERED_CANDIDATE_FACTOR;
        return (int) Math.min(Integer.MAX_VALUE, limit * factor);
    }

    static String fingerprint(final QueryNode query, final SearchFilters filters, final int limit,
                              final HybridConfig config) {
        final StringBuilder key = new StringBuilder();
        key.append(query.render()).append('|').append(filters.render()).append('|').append(limit).append('|');
        for (final Map.Entry<SourceType, Double> weight : config.normalizedWeights().entrySet()) {
            key.append(weight.getKey().key()).append('=').append(weight.getValue()).append(',');
        }
        key.append('|').append(config.rrfK());
        return Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString();
    }

    /**
     * Shutdown the worker pools. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down HybridSearchOrchestrator");
        coordinatorExecutor.shutdownNow();
        sourceExecutors.values().forEach(ExecutorService::shutdown);
        for (final Map.Entry<SourceType, ExecutorService> entry : sourceExecutors.entrySet()) {
            final ExecutorService executor = entry.getValue();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Executor of source {} did not terminate in time, forcing shutdown",
                            entry.getKey().key());
                    executor.shutdownNow();
                }
            } catch (final InterruptedException e) {
                logger.error("Interrupted while waiting for source executors to terminate", e);
                sourceExecutors.values().forEach(ExecutorService::shutdownNow);
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
