package de.mirkosertic.mcp.codeindex.query;

import java.util.List;
import java.util.Objects;

/**
 * Immutable query tree produced by {@link CodeQueryParser}.
 */
public sealed interface QueryNode {

    /**
     * Canonical text form. Equal trees render equal strings, which makes it usable as a cache key.
     */
    String render();

    record Term(String text) implements QueryNode {
        public Term {
            Objects.requireNonNull(text);
        }

        @Override
        public String render() {
            return text;
        }
    }

    /**
     * Terms that must occur at the given positions relative to the first term.
     */
    record Phrase(List<String> terms, List<Integer> offsets) implements QueryNode {
        public Phrase {
            terms = List.copyOf(terms);
            offsets = List.copyOf(offsets);
            if (terms.size() != offsets.size()) {
                throw new IllegalArgumentException("terms and offsets must have the same size");
            }
        }

        public static Phrase consecutive(final List<String> terms) {
            final Integer[] offsets = new Integer[terms.size()];
            for (int i = 0; i < offsets.length; i++) {
                offsets[i] = i;
            }
            return new Phrase(terms, List.of(offsets));
        }

        @Override
        public String render() {
            final StringBuilder builder = new StringBuilder("\"");
            for (int i = 0; i < terms.size(); i++) {
                if (i > 0) {
                    builder.append(' ');
                }
                builder.append(terms.get(i)).append('@').append(offsets.get(i));
            }
            return builder.append('"').toString();
        }
    }

    record And(List<QueryNode> children) implements QueryNode {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public String render() {
            return group("AND", children);
        }
    }

    record Or(List<QueryNode> children) implements QueryNode {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public String render() {
            return group("OR", children);
        }
    }

    record Not(QueryNode child) implements QueryNode {
        public Not {
            Objects.requireNonNull(child);
        }

        @Override
        public String render() {
            return "(NOT " + child.render() + ")";
        }
    }

    record Prefix(String stem) implements QueryNode {
        public Prefix {
            Objects.requireNonNull(stem);
        }

        @Override
        public String render() {
            return stem + "*";
        }
    }

    /**
     * All terms within {@code maxDistance} token positions of each other, in any order.
     */
    record Near(List<String> terms, int maxDistance) implements QueryNode {
        public Near {
            terms = List.copyOf(terms);
        }

        @Override
        public String render() {
            return "NEAR(" + String.join(" ", terms) + ", " + maxDistance + ")";
        }
    }

    private static String group(final String operator, final List<QueryNode> children) {
        final StringBuilder builder = new StringBuilder("(").append(operator);
        for (final QueryNode child : children) {
            builder.append(' ').append(child.render());
        }
        return builder.append(')').toString();
    }
}
