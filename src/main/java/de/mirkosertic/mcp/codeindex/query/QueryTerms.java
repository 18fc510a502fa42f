package de.mirkosertic.mcp.codeindex.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The positive leaf terms of a query tree. Everything below a NOT is ignored.
 *
 * @param terms    exact terms from term, phrase and near nodes
 * @param prefixes stems of prefix nodes
 */
public record QueryTerms(Set<String> terms, List<String> prefixes) {

    public QueryTerms {
        terms = Set.copyOf(terms);
        prefixes = List.copyOf(prefixes);
    }

    public boolean isEmpty() {
        return terms.isEmpty() && prefixes.isEmpty();
    }

    public boolean matches(final String term) {
        if (terms.contains(term)) {
            return true;
        }
        for (final String prefix : prefixes) {
            if (term.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public static QueryTerms of(final QueryNode query) {
        final Set<String> terms = new LinkedHashSet<>();
        final List<String> prefixes = new ArrayList<>();
        collect(query, terms, prefixes);
        return new QueryTerms(terms, prefixes);
    }

    private static void collect(final QueryNode node, final Set<String> terms, final List<String> prefixes) {
        if (node instanceof QueryNode.Term term) {
            terms.add(term.text());
        } else if (node instanceof QueryNode.Phrase phrase) {
            terms.addAll(phrase.terms());
        } else if (node instanceof QueryNode.Near near) {
            terms.addAll(near.terms());
        } else if (node instanceof QueryNode.Prefix prefix) {
            prefixes.add(prefix.stem());
        } else if (node instanceof QueryNode.And and) {
            for (final QueryNode child : and.children()) {
                collect(child, terms, prefixes);
            }
        } else if (node instanceof QueryNode.Or or) {
            for (final QueryNode child : or.children()) {
                collect(child, terms, prefixes);
            }
        }
    }
}
