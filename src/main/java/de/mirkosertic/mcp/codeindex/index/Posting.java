package de.mirkosertic.mcp.codeindex.index;

import java.util.Arrays;

/**
 * Occurrences of one term in one document.
 *
 * @param docId         the document id
 * @param termFrequency number of occurrences, equals {@code positions.length} for a valid posting
 * @param positions     ascending token positions
 */
public record Posting(String docId, int termFrequency, int[] positions) {

    public Posting(final String docId, final int[] positions) {
        this(docId, positions.length, positions);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Posting other)) {
            return false;
        }
        return termFrequency == other.termFrequency
                && docId.equals(other.docId)
                && Arrays.equals(positions, other.positions);
    }

    @Override
    public int hashCode() {
        int result = docId.hashCode();
        result = 31 * result + termFrequency;
        result = 31 * result + Arrays.hashCode(positions);
        return result;
    }

    @Override
    public String toString() {
        return "Posting[docId=" + docId + ", termFrequency=" + termFrequency
                + ", positions=" + Arrays.toString(positions) + "]";
    }
}
