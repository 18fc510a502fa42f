package de.mirkosertic.mcp.codeindex.hybrid;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Set;

/**
 * A document after reciprocal rank fusion.
 *
 * @param contributingSources the sources whose lists contained the document
 */
public record FusedResult(String docId, double fusedScore, Set<SourceType> contributingSources) {

    /**
     * Fused score descending, doc id ascending.
     */
    public static final Comparator<FusedResult> RANKING_ORDER = Comparator
            .comparingDouble(FusedResult::fusedScore).reversed()
            .thenComparing(FusedResult::docId);

    public FusedResult {
        final EnumSet<SourceType> copy = EnumSet.noneOf(SourceType.class);
        copy.addAll(contributingSources);
        contributingSources = Collections.unmodifiableSet(copy);
    }
}
