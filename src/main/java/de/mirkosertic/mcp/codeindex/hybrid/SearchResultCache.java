package de.mirkosertic.mcp.codeindex.hybrid;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Fingerprint keyed cache of fused hybrid results.
 *
 * <p>Every entry carries its own TTL and the index version it was computed against. An entry
 * whose version differs from the current index version is treated as a miss and removed on
 * that read; there is no sweep on index mutation.</p>
 *
 * <p>One instance belongs to one orchestrator, so two orchestrators never share entries.</p>
 */
public class SearchResultCache {

    private static final Logger logger = LoggerFactory.getLogger(SearchResultCache.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    /**
     * A cached fusion.
     *
     * @param ttlSeconds   time to live, 0 disables caching of the entry
     * @param indexVersion index version the results were computed against
     */
    public record Entry(String fingerprint,
                        List<FusedResult> results,
                        Set<SourceType> degradedSources,
                        long createdAtMillis,
                        long ttlSeconds,
                        long indexVersion) {

        public Entry {
            results = List.copyOf(results);
            degradedSources = Set.copyOf(degradedSources);
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(final String key, final Entry value, final long currentTime) {
            return TimeUnit.SECONDS.toNanos(value.ttlSeconds());
        }

        @Override
        public long expireAfterUpdate(final String key, final Entry value, final long currentTime,
                                      final long currentDuration) {
            return TimeUnit.SECONDS.toNanos(value.ttlSeconds());
        }

        @Override
        public long expireAfterRead(final String key, final Entry value, final long currentTime,
                                    final long currentDuration) {
            return currentDuration;
        }
    }

    private final Cache<String, Entry> cache;
    private final SearchCacheStats stats;

    public SearchResultCache() {
        this(DEFAULT_MAX_ENTRIES, Ticker.systemTicker(), new SearchCacheStats());
    }

    public SearchResultCache(final long maxEntries, final SearchCacheStats stats) {
        this(maxEntries, Ticker.systemTicker(), stats);
    }

    /**
     * @param ticker time source, replaceable in tests
     */
    public SearchResultCache(final long maxEntries, final Ticker ticker, final SearchCacheStats stats) {
        this.stats = stats;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .evictionListener((String key, Entry value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    /**
     * @param fingerprint    the query fingerprint
     * @param currentVersion the current index version
     * @return the entry, or {@code null} on a miss, an expired entry, or a stale version
     */
    public @Nullable Entry get(final String fingerprint, final long currentVersion) {
        final Entry entry = cache.getIfPresent(fingerprint);
        if (entry == null) {
            stats.recordMiss();
            return null;
        }
        if (entry.indexVersion() != currentVersion) {
            logger.debug("Discarding stale cache entry {} (version {} != {})", fingerprint, entry.indexVersion(),
                    currentVersion);
            cache.asMap().remove(fingerprint, entry);
            stats.recordStaleMiss();
            return null;
        }
        stats.recordHit();
        return entry;
    }

    public void put(final Entry entry) {
        if (entry.ttlSeconds() <= 0) {
            return;
        }
        cache.put(entry.fingerprint(), entry);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public SearchCacheStats getStats() {
        return stats;
    }
}
