package de.mirkosertic.mcp.codeindex.snippet;

import java.util.List;

/**
 * An excerpt of a document with highlight offsets relative to {@link #text()}.
 */
public record Snippet(String text, List<TextSpan> highlights) {

    static final String ELLIPSIS = "...";

    public Snippet {
        highlights = List.copyOf(highlights);
    }

    /**
     * Renders the excerpt with every highlight wrapped in {@code <em>} tags.
     */
    public String toMarkup() {
        final StringBuilder builder = new StringBuilder(text.length() + highlights.size() * 9);
        int cursor = 0;
        for (final TextSpan highlight : highlights) {
            builder.append(text, cursor, highlight.start());
            builder.append("<em>").append(text, highlight.start(), highlight.end()).append("</em>");
            cursor = highlight.end();
        }
        builder.append(text, cursor, text.length());
        return builder.toString();
    }
}
