package de.mirkosertic.mcp.codeindex.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzer used for indexing and querying source code.
 * <p>
 * Chain: {@link CodeTokenizer} -> {@link LowerCaseFilter} -> {@link IdentifierPartsFilter}.
 * No stemming is applied, identifiers must match literally.
 * <p>
 * The same instance is shared by the index, the query parser and the snippet locator so that
 * all three agree on terms and positions.
 */
public class CodeAnalyzer extends Analyzer {

    public static final String DEFAULT_FIELD = "content";

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new CodeTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new IdentifierPartsFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }

    /**
     * Runs the analysis chain over the given text.
     *
     * @param text the raw text, may be empty
     * @return the tokens in stream order, positions are 0-based
     */
    public List<AnalyzedToken> analyze(final String text) {
        final List<AnalyzedToken> tokens = new ArrayList<>();
        try (final TokenStream stream = tokenStream(DEFAULT_FIELD, text)) {
            final CharTermAttribute termAtt = stream.addAttribute(CharTermAttribute.class);
            final PositionIncrementAttribute posIncAtt = stream.addAttribute(PositionIncrementAttribute.class);
            final OffsetAttribute offsetAtt = stream.addAttribute(OffsetAttribute.class);

            stream.reset();
            int position = -1;
            while (stream.incrementToken()) {
                position += posIncAtt.getPositionIncrement();
                tokens.add(new AnalyzedToken(termAtt.toString(), Math.max(position, 0),
                        offsetAtt.startOffset(), offsetAtt.endOffset()));
            }
            stream.end();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }
}
