package de.mirkosertic.mcp.codeindex.snippet;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a bounded excerpt around the tightest group of matches.
 * <p>
 * Matches are grouped into clusters: two neighbouring matches belong to the same cluster if the
 * gap between them is at most {@code window} characters. The cluster with the smallest span wins,
 * the earliest one on a tie. The excerpt reaches {@code window}
 * characters to each side of the cluster, truncated sides are marked with {@code ...}.
 */
public class SnippetExtractor {

    public static final int DEFAULT_WINDOW = 80;

    private record Cluster(int start, int end) {
        int span() {
            return end - start;
        }
    }

    private final int defaultWindow;

    public SnippetExtractor(final int defaultWindow) {
        if (defaultWindow <= 0) {
            throw new IllegalArgumentException("window must be positive: " + defaultWindow);
        }
        this.defaultWindow = defaultWindow;
    }

    public SnippetExtractor() {
        this(DEFAULT_WINDOW);
    }

    public Snippet extract(final String text, final List<TextSpan> matches) {
        return extract(text, matches, defaultWindow);
    }

    /**
     * @param text    the full document text
     * @param matches match spans in document coordinates, in any order, may overlap
     * @param window  characters of context per side
     * @return the excerpt, highlights are relative to the excerpt text
     */
    public Snippet extract(final String text, final List<TextSpan> matches, final int window) {
        final String safeText = text != null ? text : "";
        final List<TextSpan> spans = normalize(matches, safeText.length());

        if (spans.isEmpty()) {
            return head(safeText, window);
        }

        final Cluster best = bestCluster(spans, window);
        final int from = Math.max(0, best.start() - window);
        final int to = Math.min(safeText.length(), best.end() + window);

        final String prefix = from > 0 ? Snippet.ELLIPSIS : "";
        final String suffix = to < safeText.length() ? Snippet.ELLIPSIS : "";
        final int shift = prefix.length() - from;

        final List<TextSpan> highlights = new ArrayList<>();
        for (final TextSpan span : spans) {
            final int start = Math.max(span.start(), from);
            final int end = Math.min(span.end(), to);
            if (start < end) {
                highlights.add(new TextSpan(start + shift, end + shift));
            }
        }

        return new Snippet(prefix + safeText.substring(from, to) + suffix, highlights);
    }

    private static Snippet head(final String text, final int window) {
        final int length = Math.min(text.length(), 2 * window);
        final String suffix = length < text.length() ? Snippet.ELLIPSIS : "";
        return new Snippet(text.substring(0, length) + suffix, List.of());
    }

    /**
     * Sorts, clips to the text and merges overlapping spans.
     */
    private static List<TextSpan> normalize(final List<TextSpan> matches, final int textLength) {
        final List<TextSpan> sorted = new ArrayList<>();
        if (matches != null) {
            for (final TextSpan match : matches) {
                final int start = Math.min(match.start(), textLength);
                final int end = Math.min(match.end(), textLength);
                if (start < end) {
                    sorted.add(new TextSpan(start, end));
                }
            }
        }
        sorted.sort(null);

        final List<TextSpan> merged = new ArrayList<>(sorted.size());
        for (final TextSpan span : sorted) {
            if (!merged.isEmpty() && span.start() < merged.get(merged.size() - 1).end()) {
                final TextSpan last = merged.remove(merged.size() - 1);
                merged.add(new TextSpan(last.start(), Math.max(last.end(), span.end())));
            } else {
                merged.add(span);
            }
        }
        return merged;
    }

    private static Cluster bestCluster(final List<TextSpan> spans, final int window) {
        Cluster best = null;
        int start = spans.get(0).start();
        int end = spans.get(0).end();

        for (int i = 1; i <= spans.size(); i++) {
            if (i < spans.size() && spans.get(i).start() - end <= window) {
                end = Math.max(end, spans.get(i).end());
                continue;
            }
            final Cluster candidate = new Cluster(start, end);
            if (best == null || candidate.span() < best.span()) {
                best = candidate;
            }
            if (i < spans.size()) {
                start = spans.get(i).start();
                end = spans.get(i).end();
            }
        }
        return best;
    }
}
