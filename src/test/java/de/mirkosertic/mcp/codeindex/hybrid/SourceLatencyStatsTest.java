package de.mirkosertic.mcp.codeindex.hybrid;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SourceLatencyStatsTest {

    @Test
    void testAverageAndMaximum() {
        final SourceLatencyStats stats = new SourceLatencyStats();

        stats.recordCall(SourceType.SEMANTIC, TimeUnit.MILLISECONDS.toNanos(10));
        stats.recordCall(SourceType.SEMANTIC, TimeUnit.MILLISECONDS.toNanos(30));

        final SourceLatencyStats.SourceSnapshot snapshot = stats.snapshot(SourceType.SEMANTIC);
        assertThat(snapshot.calls()).isEqualTo(2);
        assertThat(snapshot.averageLatencyMs()).isCloseTo(20.0, within(0.001));
        assertThat(snapshot.maxLatencyMs()).isCloseTo(30.0, within(0.001));
    }

    @Test
    void testTimeoutsAndFailuresAreSeparate() {
        final SourceLatencyStats stats = new SourceLatencyStats();

        stats.recordTimeout(SourceType.FUZZY);
        stats.recordTimeout(SourceType.FUZZY);
        stats.recordFailure(SourceType.FUZZY);

        final SourceLatencyStats.SourceSnapshot snapshot = stats.snapshot(SourceType.FUZZY);
        assertThat(snapshot.timeouts()).isEqualTo(2);
        assertThat(snapshot.failures()).isEqualTo(1);
        assertThat(snapshot.calls()).isZero();
        assertThat(snapshot.averageLatencyMs()).isZero();
    }

    @Test
    void testSnapshotCoversAllSources() {
        final Map<SourceType, SourceLatencyStats.SourceSnapshot> snapshot = new SourceLatencyStats().snapshot();

        assertThat(snapshot).containsOnlyKeys(SourceType.values());
    }
}
