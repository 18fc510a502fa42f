package de.mirkosertic.mcp.codeindex.query;

/**
 * BM25 tuning constants.
 *
 * @param k1 term frequency saturation
 * @param b  document length normalization, between 0 and 1
 */
public record Bm25Parameters(double k1, double b) {

    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    public Bm25Parameters {
        if (k1 < 0 || Double.isNaN(k1)) {
            throw new IllegalArgumentException("k1 must not be negative: " + k1);
        }
        if (b < 0 || b > 1 || Double.isNaN(b)) {
            throw new IllegalArgumentException("b must be between 0 and 1: " + b);
        }
    }

    public static Bm25Parameters defaults() {
        return new Bm25Parameters(DEFAULT_K1, DEFAULT_B);
    }
}
