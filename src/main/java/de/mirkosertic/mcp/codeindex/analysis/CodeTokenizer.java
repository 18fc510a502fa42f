package de.mirkosertic.mcp.codeindex.analysis;

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;

/**
 * Tokenizer for source code.
 * <p>
 * A token is a maximal run of letters, digits, underscores and dots. Dots at the
 * start or the end of a run are stripped, so {@code foo.bar_baz.} yields
 * {@code foo.bar_baz} while {@code ...} yields nothing. Everything else separates
 * tokens.
 * <p>
 * Splitting compound identifiers into their parts is left to {@link IdentifierPartsFilter}.
 */
public final class CodeTokenizer extends Tokenizer {

    private static final int READ_BUFFER_SIZE = 1024;

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);

    private String text;
    private int cursor;
    private int finalOffset;

    @Override
    public boolean incrementToken() throws IOException {
        clearAttributes();
        if (text == null) {
            text = readFully();
            cursor = 0;
            finalOffset = correctOffset(text.length());
        }

        final int length = text.length();
        while (cursor < length) {
            while (cursor < length && !isTokenChar(text.charAt(cursor))) {
                cursor++;
            }
            if (cursor >= length) {
                break;
            }

            int start = cursor;
            while (cursor < length && isTokenChar(text.charAt(cursor))) {
                cursor++;
            }
            int end = cursor;

            while (start < end && text.charAt(start) == '.') {
                start++;
            }
            while (end > start && text.charAt(end - 1) == '.') {
                end--;
            }

            if (start < end) {
                termAtt.setEmpty().append(text, start, end);
                offsetAtt.setOffset(correctOffset(start), correctOffset(end));
                return true;
            }
        }
        return false;
    }

    @Override
    public void end() throws IOException {
        super.end();
        offsetAtt.setOffset(finalOffset, finalOffset);
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        text = null;
        cursor = 0;
        finalOffset = 0;
    }

    static boolean isTokenChar(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private String readFully() throws IOException {
        final StringBuilder builder = new StringBuilder();
        final char[] buffer = new char[READ_BUFFER_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            builder.append(buffer, 0, read);
        }
        return builder.toString();
    }
}
