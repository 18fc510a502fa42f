package de.mirkosertic.mcp.codeindex.hybrid;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-source call statistics of the fan-out: completed calls with their latency, timeouts and
 * failures. Lock-free, updated from the worker threads.
 */
public class SourceLatencyStats {

    private static final class Counters {
        private final AtomicLong calls = new AtomicLong(0);
        private final AtomicLong totalMicros = new AtomicLong(0);
        private final AtomicLong maxMicros = new AtomicLong(0);
        private final AtomicLong timeouts = new AtomicLong(0);
        private final AtomicLong failures = new AtomicLong(0);
    }

    /**
     * Snapshot of one source's counters.
     */
    public record SourceSnapshot(long calls, double averageLatencyMs, double maxLatencyMs, long timeouts,
                                 long failures) {
    }

    private final Map<SourceType, Counters> counters = new EnumMap<>(SourceType.class);

    public SourceLatencyStats() {
        for (final SourceType type : SourceType.values()) {
            counters.put(type, new Counters());
        }
    }

    public void recordCall(final SourceType source, final long durationNanos) {
        final Counters c = counters.get(source);
        final long micros = durationNanos / 1_000;
        c.calls.incrementAndGet();
        c.totalMicros.addAndGet(micros);

        long current;
        do {
            current = c.maxMicros.get();
            if (micros <= current) break;
        } while (!c.maxMicros.compareAndSet(current, micros));
    }

    public void recordTimeout(final SourceType source) {
        counters.get(source).timeouts.incrementAndGet();
    }

    public void recordFailure(final SourceType source) {
        counters.get(source).failures.incrementAndGet();
    }

    /**
     * @return average latency of completed calls in milliseconds, 0.0 if there were none
     */
    public double getAverageLatencyMs(final SourceType source) {
        final Counters c = counters.get(source);
        final long calls = c.calls.get();
        if (calls == 0) {
            return 0.0;
        }
        return c.totalMicros.get() / 1000.0 / calls;
    }

    public SourceSnapshot snapshot(final SourceType source) {
        final Counters c = counters.get(source);
        return new SourceSnapshot(c.calls.get(), getAverageLatencyMs(source), c.maxMicros.get() / 1000.0,
                c.timeouts.get(), c.failures.get());
    }

    public Map<SourceType, SourceSnapshot> snapshot() {
        final Map<SourceType, SourceSnapshot> result = new EnumMap<>(SourceType.class);
        for (final SourceType type : SourceType.values()) {
            result.put(type, snapshot(type));
        }
        return result;
    }
}
