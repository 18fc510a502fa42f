package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.query.ScoredDocument;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReciprocalRankFusionTest {

    private static Map<SourceType, List<RankedResult>> lists() {
        final Map<SourceType, List<RankedResult>> lists = new EnumMap<>(SourceType.class);
        lists.put(SourceType.BM25, ReciprocalRankFusion.assignRanks(SourceType.BM25, List.of(
                new ScoredDocument("a", 9.0), new ScoredDocument("b", 4.0))));
        lists.put(SourceType.FUZZY, ReciprocalRankFusion.assignRanks(SourceType.FUZZY, List.of(
                new ScoredDocument("c", 0.4), new ScoredDocument("b", 0.9))));
        return lists;
    }

    private static Map<SourceType, Double> equalWeights() {
        final Map<SourceType, Double> weights = new EnumMap<>(SourceType.class);
        weights.put(SourceType.BM25, 0.5);
        weights.put(SourceType.FUZZY, 0.5);
        return weights;
    }

    @Test
    void testAssignRanksOrdersByScore() {
        final List<RankedResult> ranked = ReciprocalRankFusion.assignRanks(SourceType.BM25, List.of(
                new ScoredDocument("low", 1.0), new ScoredDocument("high", 3.0), new ScoredDocument("low", 0.5)));

        assertThat(ranked).extracting(RankedResult::docId).containsExactly("high", "low");
        assertThat(ranked).extracting(RankedResult::rank).containsExactly(1, 2);
        assertThat(ranked.get(1).score()).isEqualTo(1.0);
    }

    @Test
    void testFusedScoresFollowFormula() {
        final List<FusedResult> fused = ReciprocalRankFusion.fuse(lists(), equalWeights(), 60);

        assertThat(fused).extracting(FusedResult::docId).containsExactly("b", "a", "c");
        assertThat(fused.get(0).fusedScore()).isCloseTo(0.5 / 62 + 0.5 / 61, within(1e-12));
        assertThat(fused.get(1).fusedScore()).isCloseTo(0.5 / 61, within(1e-12));
        assertThat(fused.get(0).contributingSources()).containsExactlyInAnyOrder(SourceType.BM25, SourceType.FUZZY);
        assertThat(fused.get(2).contributingSources()).containsExactly(SourceType.FUZZY);
    }

    @Test
    void testFusionIsDeterministic() {
        final List<FusedResult> first = ReciprocalRankFusion.fuse(lists(), equalWeights(), 60);

        for (int i = 0; i < 20; i++) {
            assertThat(ReciprocalRankFusion.fuse(lists(), equalWeights(), 60)).isEqualTo(first);
        }
    }

    @Test
    void testEqualScoresAreOrderedByDocId() {
        final Map<SourceType, List<RankedResult>> lists = new EnumMap<>(SourceType.class);
        lists.put(SourceType.BM25, List.of(new RankedResult("zeta", 1.0, SourceType.BM25, 1)));
        lists.put(SourceType.FUZZY, List.of(new RankedResult("alpha", 1.0, SourceType.FUZZY, 1)));

        final List<FusedResult> fused = ReciprocalRankFusion.fuse(lists, equalWeights(), 60);

        assertThat(fused).extracting(FusedResult::docId).containsExactly("alpha", "zeta");
    }

    @Test
    void testSourceWithoutWeightContributesNothing() {
        final Map<SourceType, Double> weights = new EnumMap<>(SourceType.class);
        weights.put(SourceType.BM25, 1.0);

        final List<FusedResult> fused = ReciprocalRankFusion.fuse(lists(), weights, 60);

        assertThat(fused).filteredOn(result -> result.docId().equals("c"))
                .singleElement()
                .satisfies(result -> assertThat(result.fusedScore()).isZero());
    }

    @Test
    void testNegativeKIsRejected() {
        assertThatThrownBy(() -> ReciprocalRankFusion.fuse(lists(), equalWeights(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEmptyInputYieldsEmptyResult() {
        assertThat(ReciprocalRankFusion.fuse(Map.of(), equalWeights(), 60)).isEmpty();
    }
}
