package de.mirkosertic.mcp.codeindex.snippet;

import de.mirkosertic.mcp.codeindex.analysis.CodeAnalyzer;
import de.mirkosertic.mcp.codeindex.query.CodeQueryParser;
import de.mirkosertic.mcp.codeindex.query.QuerySyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchLocatorTest {

    private final CodeAnalyzer analyzer = new CodeAnalyzer();
    private final CodeQueryParser parser = new CodeQueryParser(analyzer);
    private final MatchLocator locator = new MatchLocator(analyzer);

    @Test
    void testLocatesTermInsideQualifiedIdentifier() throws QuerySyntaxException {
        final List<TextSpan> spans = locator.locate(parser.parse("parse"), "parser.parse(input)");

        assertThat(spans).containsExactly(new TextSpan(7, 12));
    }

    @Test
    void testPrefixMatchesCompoundAndParts() throws QuerySyntaxException {
        final List<TextSpan> spans = locator.locate(parser.parse("pars*"), "parser.parse(input)");

        assertThat(spans).containsExactly(new TextSpan(0, 12), new TextSpan(0, 6), new TextSpan(7, 12));
    }

    @Test
    void testMatchingIsCaseInsensitive() throws QuerySyntaxException {
        assertThat(locator.locate(parser.parse("foo"), "Foo FOO bar")).hasSize(2);
    }

    @Test
    void testNegatedTermsAreNotHighlighted() throws QuerySyntaxException {
        assertThat(locator.locate(parser.parse("foo NOT bar"), "foo bar")).containsExactly(new TextSpan(0, 3));
    }

    @Test
    void testSnippetForDocument() throws QuerySyntaxException {
        final String text = "function foo() returns bar";
        final Snippet snippet = new SnippetExtractor().extract(text,
                locator.locate(parser.parse("\"returns bar\""), text));

        assertThat(snippet.toMarkup()).isEqualTo("function foo() <em>returns</em> <em>bar</em>");
    }

    @Test
    void testEmptyTextHasNoMatches() throws QuerySyntaxException {
        assertThat(locator.locate(parser.parse("foo"), "")).isEmpty();
    }
}
