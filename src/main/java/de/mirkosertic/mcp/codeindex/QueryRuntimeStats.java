package de.mirkosertic.mcp.codeindex;

import de.mirkosertic.mcp.codeindex.dispatch.DispatchHandler;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe aggregate statistics of answered searches.
 *
 * <p>Counters are atomic. The durations of the last 1000 searches are kept in a circular buffer
 * guarded by its own lock and used for percentiles.</p>
 */
public class QueryRuntimeStats {

    private static final int BUFFER_SIZE = 1000;

    private final AtomicLong totalQueries = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);
    private final AtomicLong totalHitCount = new AtomicLong(0);
    private final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMs = new AtomicLong(0);
    private final AtomicLong degradedQueries = new AtomicLong(0);
    private final Map<DispatchHandler, AtomicLong> queriesByHandler = new EnumMap<>(DispatchHandler.class);

    private final long[] buffer = new long[BUFFER_SIZE];
    private int bufferIndex = 0;
    private boolean bufferFilled = false;
    private final Object lock = new Object();

    /**
     * Percentiles over the last 1000 search durations in milliseconds.
     */
    public record Percentiles(long p50, long p75, long p90, long p95, long p99) {
    }

    public QueryRuntimeStats() {
        for (final DispatchHandler handler : DispatchHandler.values()) {
            queriesByHandler.put(handler, new AtomicLong(0));
        }
    }

    /**
     * @param durationMs wall clock time of the search
     * @param hits       number of returned results
     * @param handler    the path that answered
     * @param degraded   true if at least one source was degraded
     */
    public void recordQuery(final long durationMs, final long hits, final DispatchHandler handler,
                            final boolean degraded) {
        totalQueries.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        totalHitCount.addAndGet(hits);
        queriesByHandler.get(handler).incrementAndGet();
        if (degraded) {
            degradedQueries.incrementAndGet();
        }

        long current;
        do {
            current = minDurationMs.get();
            if (durationMs >= current) break;
        } while (!minDurationMs.compareAndSet(current, durationMs));

        do {
            current = maxDurationMs.get();
            if (durationMs <= current) break;
        } while (!maxDurationMs.compareAndSet(current, durationMs));

        synchronized (lock) {
            buffer[bufferIndex] = durationMs;
            bufferIndex = (bufferIndex + 1) % BUFFER_SIZE;
            if (bufferIndex == 0) {
                bufferFilled = true;
            }
        }
    }

    /**
     * @return percentiles, or null before the first search
     */
    public Percentiles getPercentiles() {
        final long[] snapshot;
        synchronized (lock) {
            snapshot = Arrays.copyOf(buffer, bufferFilled ? BUFFER_SIZE : bufferIndex);
        }
        if (snapshot.length == 0) {
            return null;
        }
        Arrays.sort(snapshot);
        return new Percentiles(
                percentileValue(snapshot, 50),
                percentileValue(snapshot, 75),
                percentileValue(snapshot, 90),
                percentileValue(snapshot, 95),
                percentileValue(snapshot, 99));
    }

    private static long percentileValue(final long[] sorted, final int percentile) {
        final int index = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    public void reset() {
        totalQueries.set(0);
        totalDurationMs.set(0);
        totalHitCount.set(0);
        minDurationMs.set(Long.MAX_VALUE);
        maxDurationMs.set(0);
        degradedQueries.set(0);
        for (final AtomicLong counter : queriesByHandler.values()) {
            counter.set(0);
        }
        synchronized (lock) {
            bufferIndex = 0;
            bufferFilled = false;
            Arrays.fill(buffer, 0L);
        }
    }

    public long getTotalQueries() {
        return totalQueries.get();
    }

    public long getTotalHitCount() {
        return totalHitCount.get();
    }

    /**
     * {@link Long#MAX_VALUE} before the first search.
     */
    public long getMinDurationMs() {
        return minDurationMs.get();
    }

    public long getMaxDurationMs() {
        return maxDurationMs.get();
    }

    public long getDegradedQueries() {
        return degradedQueries.get();
    }

    public long getQueries(final DispatchHandler handler) {
        return queriesByHandler.get(handler).get();
    }

    public double getAverageDurationMs() {
        final long queries = totalQueries.get();
        return queries == 0 ? 0.0 : (double) totalDurationMs.get() / queries;
    }

    public double getAverageHitCount() {
        final long queries = totalQueries.get();
        return queries == 0 ? 0.0 : (double) totalHitCount.get() / queries;
    }
}
