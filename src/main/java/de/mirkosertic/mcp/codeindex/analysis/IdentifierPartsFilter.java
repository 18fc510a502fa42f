package de.mirkosertic.mcp.codeindex.analysis;

import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Token filter that emits the dot-separated parts of a qualified identifier in addition
 * to the identifier itself.
 * <p>
 * For {@code foo.bar_baz} the stream becomes:
 * <ul>
 *   <li>{@code foo.bar_baz} at position p (kept for prefix and exact matching)</li>
 *   <li>{@code foo} at position p (position increment 0)</li>
 *   <li>{@code bar_baz} at position p + 1</li>
 * </ul>
 * Underscores are not split, {@code bar_baz} stays a single term.
 */
public final class IdentifierPartsFilter extends TokenFilter {

    private record Part(String term, int startOffset, int endOffset, int positionIncrement) {
    }

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);
    private final PositionIncrementAttribute posIncAtt = addAttribute(PositionIncrementAttribute.class);

    private final Deque<Part> pending = new ArrayDeque<>();

    public IdentifierPartsFilter(final TokenStream input) {
        super(input);
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!pending.isEmpty()) {
            final Part part = pending.poll();
            clearAttributes();
            termAtt.setEmpty().append(part.term());
            offsetAtt.setOffset(part.startOffset(), part.endOffset());
            posIncAtt.setPositionIncrement(part.positionIncrement());
            return true;
        }

        if (!input.incrementToken()) {
            return false;
        }

        final String term = termAtt.toString();
        if (term.indexOf('.') >= 0) {
            queueParts(term, offsetAtt.startOffset());
        }
        return true;
    }

    private void queueParts(final String term, final int baseOffset) {
        int partStart = 0;
        boolean first = true;
        for (int i = 0; i <= term.length(); i++) {
            if (i == term.length() || term.charAt(i) == '.') {
                if (i > partStart) {
                    pending.add(new Part(term.substring(partStart, i),
                            baseOffset + partStart,
                            baseOffset + i,
                            first ? 0 : 1));
                    first = false;
                }
                partStart = i + 1;
            }
        }
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        pending.clear();
    }
}
