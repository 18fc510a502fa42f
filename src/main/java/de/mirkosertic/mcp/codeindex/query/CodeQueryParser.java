package de.mirkosertic.mcp.codeindex.query;

import de.mirkosertic.mcp.codeindex.analysis.AnalyzedToken;
import de.mirkosertic.mcp.codeindex.analysis.CodeAnalyzer;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Parses query strings into {@link QueryNode} trees.
 * <p>
 * Supported syntax:
 * <ul>
 *   <li>{@code foo bar} - implicit AND</li>
 *   <li>{@code "returns bar"} - phrase</li>
 *   <li>{@code a AND b}, {@code a OR b}, {@code NOT a} - case-sensitive operators</li>
 *   <li>{@code (a OR b) c} - grouping</li>
 *   <li>{@code fo*} - prefix</li>
 *   <li>{@code NEAR(a b, 5)} - all terms within 5 positions, any order</li>
 * </ul>
 * Precedence from tightest to loosest: NOT, AND, OR, implicit AND. Binary operators are
 * left-associative. The parser is a single left-to-right pass over the lexed tokens using an
 * operator stack (shunting-yard).
 * <p>
 * Bare words and phrase contents go through the same {@link CodeAnalyzer} as the indexed
 * text. A word that the analyzer splits into several tokens ({@code foo-bar}) becomes a phrase.
 */
public class CodeQueryParser {

    private static final String NEAR_PREFIX = "NEAR(";

    private enum TokenType {
        OPERAND, AND, OR, NOT, IMPLICIT_AND, LPAREN, RPAREN
    }

    private record Token(TokenType type, @Nullable QueryNode node, int position) {
    }

    private final CodeAnalyzer analyzer;

    public CodeQueryParser(final CodeAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Parse a query string.
     *
     * @param query the query string
     * @return the query tree
     * @throws QuerySyntaxException on an empty query, unbalanced quotes or parentheses,
     *                              a malformed NEAR expression or a dangling operator
     */
    public QueryNode parse(final String query) throws QuerySyntaxException {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException("Empty query", -1);
        }

        final List<Token> tokens = insertImplicitAnd(lex(query));
        if (tokens.isEmpty()) {
            throw new QuerySyntaxException("Query contains no searchable terms", -1);
        }

        final Deque<QueryNode> operands = new ArrayDeque<>();
        final Deque<Token> operators = new ArrayDeque<>();
        boolean expectOperand = true;

        for (final Token token : tokens) {
            switch (token.type()) {
                case OPERAND -> {
                    operands.push(token.node());
                    expectOperand = false;
                }
                case LPAREN -> {
                    operators.push(token);
                    expectOperand = true;
                }
                case RPAREN -> {
                    if (expectOperand) {
                        throw new QuerySyntaxException("Missing operand before ')'", token.position());
                    }
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.LPAREN) {
                        apply(operators.pop(), operands);
                    }
                    if (operators.isEmpty()) {
                        throw new QuerySyntaxException("Unbalanced parenthesis ')'", token.position());
                    }
                    operators.pop();
                    expectOperand = false;
                }
                case NOT -> {
                    operators.push(token);
                    expectOperand = true;
                }
                case AND, OR, IMPLICIT_AND -> {
                    if (expectOperand) {
                        throw new QuerySyntaxException("Operator " + token.type() + " is missing its left operand",
                                token.position());
                    }
                    while (!operators.isEmpty()
                            && operators.peek().type() != TokenType.LPAREN
                            && precedence(operators.peek().type()) >= precedence(token.type())) {
                        apply(operators.pop(), operands);
                    }
                    operators.push(token);
                    expectOperand = true;
                }
                default -> throw new IllegalStateException("Unexpected token " + token.type());
            }
        }

        if (expectOperand) {
            final Token last = tokens.get(tokens.size() - 1);
            throw new QuerySyntaxException("Dangling operator " + last.type(), last.position());
        }

        while (!operators.isEmpty()) {
            final Token operator = operators.pop();
            if (operator.type() == TokenType.LPAREN) {
                throw new QuerySyntaxException("Unbalanced parenthesis '('", operator.position());
            }
            apply(operator, operands);
        }

        if (operands.size() != 1) {
            throw new QuerySyntaxException("Malformed query", -1);
        }
        return operands.pop();
    }

    private static int precedence(final TokenType type) {
        return switch (type) {
            case NOT -> 4;
            case AND -> 3;
            case OR -> 2;
            case IMPLICIT_AND -> 1;
            default -> 0;
        };
    }

    private static void apply(final Token operator, final Deque<QueryNode> operands) throws QuerySyntaxException {
        if (operator.type() == TokenType.NOT) {
            if (operands.isEmpty()) {
                throw new QuerySyntaxException("NOT is missing its operand", operator.position());
            }
            operands.push(new QueryNode.Not(operands.pop()));
            return;
        }

        if (operands.size() < 2) {
            throw new QuerySyntaxException("Operator " + operator.type() + " is missing an operand",
                    operator.position());
        }
        final QueryNode right = operands.pop();
        final QueryNode left = operands.pop();

        if (operator.type() == TokenType.OR) {
            final List<QueryNode> children = new ArrayList<>();
            addFlattened(children, left, QueryNode.Or.class);
            addFlattened(children, right, QueryNode.Or.class);
            operands.push(new QueryNode.Or(children));
        } else {
            final List<QueryNode> children = new ArrayList<>();
            addFlattened(children, left, QueryNode.And.class);
            addFlattened(children, right, QueryNode.And.class);
            operands.push(new QueryNode.And(children));
        }
    }

    private static void addFlattened(final List<QueryNode> target, final QueryNode node,
                                     final Class<? extends QueryNode> type) {
        if (type.isInstance(node)) {
            if (node instanceof QueryNode.And and) {
                target.addAll(and.children());
                return;
            }
            if (node instanceof QueryNode.Or or) {
                target.addAll(or.children());
                return;
            }
        }
        target.add(node);
    }

    private static List<Token> insertImplicitAnd(final List<Token> tokens) {
        final List<Token> result = new ArrayList<>(tokens.size() * 2);
        Token previous = null;
        for (final Token token : tokens) {
            if (previous != null && endsOperand(previous.type()) && startsOperand(token.type())) {
                result.add(new Token(TokenType.IMPLICIT_AND, null, token.position()));
            }
            result.add(token);
            previous = token;
        }
        return result;
    }

    private static boolean endsOperand(final TokenType type) {
        return type == TokenType.OPERAND || type == TokenType.RPAREN;
    }

    private static boolean startsOperand(final TokenType type) {
        return type == TokenType.OPERAND || type == TokenType.LPAREN || type == TokenType.NOT;
    }

    private List<Token> lex(final String query) throws QuerySyntaxException {
        final List<Token> tokens = new ArrayList<>();
        final int length = query.length();
        int cursor = 0;

        while (cursor < length) {
            final char c = query.charAt(cursor);
            if (Character.isWhitespace(c)) {
                cursor++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, null, cursor));
                cursor++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, null, cursor));
                cursor++;
            } else if (c == '"') {
                final int end = query.indexOf('"', cursor + 1);
                if (end < 0) {
                    throw new QuerySyntaxException("Unbalanced quote", cursor);
                }
                final QueryNode phrase = analyzeText(query.substring(cursor + 1, end));
                if (phrase == null) {
                    throw new QuerySyntaxException("Phrase contains no searchable terms", cursor);
                }
                tokens.add(new Token(TokenType.OPERAND, phrase, cursor));
                cursor = end + 1;
            } else if (query.startsWith(NEAR_PREFIX, cursor)) {
                final int end = query.indexOf(')', cursor);
                if (end < 0) {
                    throw new QuerySyntaxException("Malformed NEAR expression, missing ')'", cursor);
                }
                tokens.add(new Token(TokenType.OPERAND,
                        parseNear(query.substring(cursor + NEAR_PREFIX.length(), end), cursor), cursor));
                cursor = end + 1;
            } else {
                final int start = cursor;
                while (cursor < length && !isWordBoundary(query.charAt(cursor))) {
                    cursor++;
                }
                final String word = query.substring(start, cursor);
                final Token token = wordToken(word, start);
                if (token != null) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }

    private static boolean isWordBoundary(final char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"';
    }

    private @Nullable Token wordToken(final String word, final int position) throws QuerySyntaxException {
        switch (word) {
            case "AND":
                return new Token(TokenType.AND, null, position);
            case "OR":
                return new Token(TokenType.OR, null, position);
            case "NOT":
                return new Token(TokenType.NOT, null, position);
            default:
                break;
        }

        if (word.endsWith("*")) {
            int stemEnd = word.length();
            while (stemEnd > 0 && word.charAt(stemEnd - 1) == '*') {
                stemEnd--;
            }
            final String stem = word.substring(0, stemEnd).toLowerCase(Locale.ROOT);
            if (stem.isEmpty()) {
                throw new QuerySyntaxException("Prefix query requires a stem", position);
            }
            return new Token(TokenType.OPERAND, new QueryNode.Prefix(stem), position);
        }

        final QueryNode node = analyzeText(word);
        return node != null ? new Token(TokenType.OPERAND, node, position) : null;
    }

    private QueryNode parseNear(final String body, final int position) throws QuerySyntaxException {
        final int comma = body.lastIndexOf(',');
        if (comma < 0) {
            throw new QuerySyntaxException("Malformed NEAR expression, expected NEAR(a b, k)", position);
        }

        final int distance;
        try {
            distance = Integer.parseInt(body.substring(comma + 1).trim());
        } catch (final NumberFormatException e) {
            throw new QuerySyntaxException("Malformed NEAR expression, distance must be an integer", position);
        }
        if (distance < 0) {
            throw new QuerySyntaxException("Malformed NEAR expression, distance must not be negative", position);
        }

        final List<String> terms = new ArrayList<>();
        for (final AnalyzedToken token : primaryTokens(body.substring(0, comma))) {
            terms.add(token.term());
        }
        if (terms.size() < 2) {
            throw new QuerySyntaxException("Malformed NEAR expression, at least two terms are required", position);
        }
        return new QueryNode.Near(terms, distance);
    }

    /**
     * Turns free text into a Term (one token) or a Phrase (several tokens), null if the
     * analyzer produced nothing.
     */
    private @Nullable QueryNode analyzeText(final String text) {
        final List<AnalyzedToken> tokens = primaryTokens(text);
        if (tokens.isEmpty()) {
            return null;
        }
        if (tokens.size() == 1) {
            return new QueryNode.Term(tokens.get(0).term());
        }

        final int base = tokens.get(0).position();
        final List<String> terms = new ArrayList<>(tokens.size());
        final List<Integer> offsets = new ArrayList<>(tokens.size());
        for (final AnalyzedToken token : tokens) {
            terms.add(token.term());
            offsets.add(token.position() - base);
        }
        return new QueryNode.Phrase(terms, offsets);
    }

    /**
     * The analyzer emits the parts of a qualified identifier after the identifier itself.
     * Only the outermost tokens are relevant for matching, the parts are covered by it.
     */
    private List<AnalyzedToken> primaryTokens(final String text) {
        final List<AnalyzedToken> result = new ArrayList<>();
        int coveredUntil = -1;
        for (final AnalyzedToken token : analyzer.analyze(text)) {
            if (token.startOffset() >= coveredUntil) {
                result.add(token);
                coveredUntil = token.endOffset();
            }
        }
        return result;
    }
}
