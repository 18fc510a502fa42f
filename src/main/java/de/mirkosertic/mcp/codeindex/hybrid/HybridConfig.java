package de.mirkosertic.mcp.codeindex.hybrid;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration of a hybrid search.
 * <p>
 * One instance is the process wide current configuration, held in an atomic reference and
 * replaced (never mutated) by the {@code with*} methods.
 *
 * @param weights          raw per-source weights, normalized over the enabled sources on use
 * @param enabledSources   sources to fan out to
 * @param rrfK             rank constant of the fusion
 * @param timeoutsMs       per-source timeout, 0 means unbounded
 * @param cacheTtlSeconds  per-source cache TTL, mixed by weight over the enabled sources
 */
public record HybridConfig(
        Map<SourceType, Double> weights,
        Set<SourceType> enabledSources,
        int rrfK,
        Map<SourceType, Long> timeoutsMs,
        Map<SourceType, Long> cacheTtlSeconds
) {

    public static final double DEFAULT_BM25_WEIGHT = 0.5;
    public static final double DEFAULT_SEMANTIC_WEIGHT = 0.3;
    public static final double DEFAULT_FUZZY_WEIGHT = 0.2;
    public static final long DEFAULT_SOURCE_TIMEOUT_MS = 2000;
    public static final long DEFAULT_BM25_TTL_SECONDS = 300;
    public static final long DEFAULT_FUZZY_TTL_SECONDS = 300;
    public static final long DEFAULT_SEMANTIC_TTL_SECONDS = 900;

    public HybridConfig {
        weights = immutableEnumMap(weights);
        timeoutsMs = immutableEnumMap(timeoutsMs);
        cacheTtlSeconds = immutableEnumMap(cacheTtlSeconds);
        enabledSources = immutableEnumSet(enabledSources);
        if (rrfK < 0) {
            throw new IllegalArgumentException("rrfK must not be negative: " + rrfK);
        }
        for (final Map.Entry<SourceType, Double> entry : weights.entrySet()) {
            if (entry.getValue() < 0 || entry.getValue().isNaN()) {
                throw new IllegalArgumentException("Weight for " + entry.getKey().key() + " must not be negative");
            }
        }
    }

    public static HybridConfig defaults() {
        final Map<SourceType, Double> weights = new EnumMap<>(SourceType.class);
        weights.put(SourceType.BM25, DEFAULT_BM25_WEIGHT);
        weights.put(SourceType.SEMANTIC, DEFAULT_SEMANTIC_WEIGHT);
        weights.put(SourceType.FUZZY, DEFAULT_FUZZY_WEIGHT);

        final Map<SourceType, Long> timeouts = new EnumMap<>(SourceType.class);
        timeouts.put(SourceType.BM25, 0L);
        timeouts.put(SourceType.SEMANTIC, DEFAULT_SOURCE_TIMEOUT_MS);
        timeouts.put(SourceType.FUZZY, DEFAULT_SOURCE_TIMEOUT_MS);

        final Map<SourceType, Long> ttls = new EnumMap<>(SourceType.class);
        ttls.put(SourceType.BM25, DEFAULT_BM25_TTL_SECONDS);
        ttls.put(SourceType.SEMANTIC, DEFAULT_SEMANTIC_TTL_SECONDS);
        ttls.put(SourceType.FUZZY, DEFAULT_FUZZY_TTL_SECONDS);

        return new HybridConfig(weights, EnumSet.allOf(SourceType.class), ReciprocalRankFusion.DEFAULT_K,
                timeouts, ttls);
    }

    /**
     * Replaces the weights. They are sum-normalized before they are stored.
     *
     * @throws IllegalArgumentException if a weight is negative or all weights are zero
     */
    public HybridConfig withWeights(final double bm25, final double semantic, final double fuzzy) {
        if (bm25 < 0 || semantic < 0 || fuzzy < 0 || Double.isNaN(bm25 + semantic + fuzzy)) {
            throw new IllegalArgumentException("Weights must not be negative");
        }
        final double sum = bm25 + semantic + fuzzy;
        if (sum <= 0) {
            throw new IllegalArgumentException("At least one weight must be greater than zero");
        }
        final Map<SourceType, Double> normalized = new EnumMap<>(SourceType.class);
        normalized.put(SourceType.BM25, bm25 / sum);
        normalized.put(SourceType.SEMANTIC, semantic / sum);
        normalized.put(SourceType.FUZZY, fuzzy / sum);
        return new HybridConfig(normalized, enabledSources, rrfK, timeoutsMs, cacheTtlSeconds);
    }

    public HybridConfig withEnabledSources(final Collection<SourceType> sources) {
        final EnumSet<SourceType> enabled = EnumSet.noneOf(SourceType.class);
        enabled.addAll(sources);
        return new HybridConfig(weights, enabled, rrfK, timeoutsMs, cacheTtlSeconds);
    }

    public HybridConfig withOnlySource(final SourceType source) {
        return withEnabledSources(EnumSet.of(source));
    }

    public HybridConfig withoutSources(final Collection<SourceType> sources) {
        final EnumSet<SourceType> remaining = EnumSet.noneOf(SourceType.class);
        remaining.addAll(enabledSources);
        remaining.removeAll(sources);
        return withEnabledSources(remaining);
    }

    public HybridConfig withRrfK(final int k) {
        return new HybridConfig(weights, enabledSources, k, timeoutsMs, cacheTtlSeconds);
    }

    public HybridConfig withTimeoutMs(final SourceType source, final long timeoutMs) {
        final Map<SourceType, Long> timeouts = new EnumMap<>(SourceType.class);
        timeouts.putAll(timeoutsMs);
        timeouts.put(source, Math.max(0, timeoutMs));
        return new HybridConfig(weights, enabledSources, rrfK, timeouts, cacheTtlSeconds);
    }

    public boolean isEnabled(final SourceType source) {
        return enabledSources.contains(source);
    }

    /**
     * Weights of the enabled sources scaled to sum 1. If all enabled weights are zero, every
     * enabled source gets the same share.
     */
    public Map<SourceType, Double> normalizedWeights() {
        final Map<SourceType, Double> result = new EnumMap<>(SourceType.class);
        if (enabledSources.isEmpty()) {
            return Collections.unmodifiableMap(result);
        }
        double sum = 0.0;
        for (final SourceType source : enabledSources) {
            sum += weights.getOrDefault(source, 0.0);
        }
        for (final SourceType source : enabledSources) {
            result.put(source, sum > 0
                    ? weights.getOrDefault(source, 0.0) / sum
                    : 1.0 / enabledSources.size());
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * @return the timeout for the source in milliseconds, 0 if unbounded
     */
    public long timeoutMs(final SourceType source) {
        return timeoutsMs.getOrDefault(source, source == SourceType.BM25 ? 0L : DEFAULT_SOURCE_TIMEOUT_MS);
    }

    /**
     * Cache TTL as the weight-mix of the per-source TTLs over the enabled sources.
     */
    public long effectiveCacheTtlSeconds() {
        double ttl = 0.0;
        for (final Map.Entry<SourceType, Double> entry : normalizedWeights().entrySet()) {
            ttl += entry.getValue() * cacheTtlSeconds.getOrDefault(entry.getKey(), DEFAULT_BM25_TTL_SECONDS);
        }
        return Math.round(ttl);
    }

    private static <V> Map<SourceType, V> immutableEnumMap(final Map<SourceType, V> source) {
        final Map<SourceType, V> copy = new EnumMap<>(SourceType.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Set<SourceType> immutableEnumSet(final Collection<SourceType> source) {
        final EnumSet<SourceType> copy = EnumSet.noneOf(SourceType.class);
        if (source != null) {
            copy.addAll(source);
        }
        return Collections.unmodifiableSet(copy);
    }
}
