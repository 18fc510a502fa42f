package de.mirkosertic.mcp.codeindex.hybrid;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for the hybrid result cache.
 *
 * <p>A lookup is either a hit or a miss. Misses caused by an entry computed against an older
 * index version are additionally counted as stale.</p>
 */
public class SearchCacheStats {

    private final AtomicLong lookups = new AtomicLong(0);
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong staleEntries = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);

    public void recordHit() {
        lookups.incrementAndGet();
        hits.incrementAndGet();
    }

    public void recordMiss() {
        lookups.incrementAndGet();
        misses.incrementAndGet();
    }

    /**
     * Records a miss caused by an entry whose index version is outdated.
     */
    public void recordStaleMiss() {
        recordMiss();
        staleEntries.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public long getLookups() {
        return lookups.get();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getStaleEntries() {
        return staleEntries.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    /**
     * Hit rate between 0 and 1.
     *
     * @return hit rate, or 0.0 if no lookup happened yet
     */
    public double getHitRate() {
        final long total = lookups.get();
        if (total == 0) {
            return 0.0;
        }
        return (double) hits.get() / total;
    }

    @Override
    public String toString() {
        return String.format(
                "SearchCacheStats[lookups=%d, hits=%d, misses=%d, stale=%d, hitRate=%.1f%%, evictions=%d]",
                getLookups(),
                getHits(),
                getMisses(),
                getStaleEntries(),
                getHitRate() * 100.0,
                getEvictions()
        );
    }
}
