package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.query.ScoredDocument;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Weighted reciprocal rank fusion.
 * <p>
 * {@code fusedScore(d) = sum over sources s containing d of weight[s] / (k + rank_s(d))}.
 * A source that does not contain d contributes nothing. The result is ordered by fused score
 * descending, doc id ascending, which makes the fusion a pure function of its inputs.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private ReciprocalRankFusion() {
    }

    /**
     * Orders a source's scored documents (score descending, doc id ascending) and assigns
     * 1-based ranks. Duplicate ids keep their best entry.
     */
    public static List<RankedResult> assignRanks(final SourceType source, final List<ScoredDocument> scored) {
        final List<ScoredDocument> ordered = new ArrayList<>(scored);
        ordered.sort(ScoredDocument.RANKING_ORDER);

        final Set<String> seen = new HashSet<>();
        final List<RankedResult> ranked = new ArrayList<>(ordered.size());
        for (final ScoredDocument document : ordered) {
            if (seen.add(document.docId())) {
                ranked.add(new RankedResult(document.docId(), document.score(), source, ranked.size() + 1));
            }
        }
        return ranked;
    }

    /**
     * @param rankedLists per-source ranked lists
     * @param weights     per-source weights, sources without a weight contribute nothing
     * @param k           the rank constant
     * @return fused results, fused score descending, doc id ascending
     */
    public static List<FusedResult> fuse(final Map<SourceType, List<RankedResult>> rankedLists,
                                         final Map<SourceType, Double> weights,
                                         final int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }

        // TreeMap keeps the summation order independent of hash iteration order
        final Map<String, double[]> scores = new TreeMap<>();
        final Map<String, EnumSet<SourceType>> sources = new TreeMap<>();

        for (final SourceType source : SourceType.values()) {
            final List<RankedResult> ranked = rankedLists.get(source);
            if (ranked == null || ranked.isEmpty()) {
                continue;
            }
            final double weight = weights.getOrDefault(source, 0.0);
            for (final RankedResult result : ranked) {
                scores.computeIfAbsent(result.docId(), id -> new double[1])[0] += weight / (k + result.rank());
                sources.computeIfAbsent(result.docId(), id -> EnumSet.noneOf(SourceType.class)).add(source);
            }
        }

        final List<FusedResult> fused = new ArrayList<>(scores.size());
        for (final Map.Entry<String, double[]> entry : scores.entrySet()) {
            fused.add(new FusedResult(entry.getKey(), entry.getValue()[0], sources.get(entry.getKey())));
        }
        fused.sort(FusedResult.RANKING_ORDER);
        return fused;
    }
}
