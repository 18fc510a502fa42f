package de.mirkosertic.mcp.codeindex.hybrid;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.mcp.codeindex.index.InvertedIndex;
import de.mirkosertic.mcp.codeindex.index.Posting;
import de.mirkosertic.mcp.codeindex.index.SymbolDefinition;
import de.mirkosertic.mcp.codeindex.index.SymbolTable;
import de.mirkosertic.mcp.codeindex.query.QueryTerms;
import de.mirkosertic.mcp.codeindex.query.ScoredDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in fuzzy source based on character trigram similarity.
 * <p>
 * Every positive query term is compared against the index dictionary and against all declared
 * symbol names using the Jaccard coefficient of their padded trigram sets. A document scores the
 * best similarity of any of its terms or its symbol name, pairs below {@link #MIN_SIMILARITY}
 * are ignored.
 * <p>
 * Trigram sets of dictionary terms are cached, the dictionary is scanned linearly per query.
 */
public class TrigramFuzzySource implements RankedSource {

    public static final double MIN_SIMILARITY = 0.3;

    private static final int MAX_CACHED_TRIGRAM_SETS = 100_000;

    private final InvertedIndex index;
    private final SymbolTable symbolTable;
    private final Cache<String, Set<String>> trigramCache;

    public TrigramFuzzySource(final InvertedIndex index, final SymbolTable symbolTable) {
        this.index = index;
        this.symbolTable = symbolTable;
        this.trigramCache = Caffeine.newBuilder()
                .maximumSize(MAX_CACHED_TRIGRAM_SETS)
                .build();
    }

    @Override
    public SourceType type() {
        return SourceType.FUZZY;
    }

    @Override
    public List<ScoredDocument> search(final SourceQuery query, final int limit) {
        final QueryTerms queryTerms = QueryTerms.of(query.parsed());
        final List<Set<String>> queryTrigrams = new ArrayList<>();
        for (final String term : queryTerms.terms()) {
            queryTrigrams.add(trigrams(term));
        }
        for (final String prefix : queryTerms.prefixes()) {
            queryTrigrams.add(trigrams(prefix));
        }
        if (queryTrigrams.isEmpty()) {
            return List.of();
        }

        final Map<String, Double> best = new HashMap<>();
        for (final String term : index.terms()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SearchSourceException(type(), "Fuzzy search interrupted");
            }
            final double similarity = bestSimilarity(queryTrigrams, trigramCache.get(term, TrigramFuzzySource::trigrams));
            if (similarity >= MIN_SIMILARITY) {
                for (final Posting posting : index.getPostings(term)) {
                    best.merge(posting.docId(), similarity, Math::max);
                }
            }
        }

        for (final String name : symbolTable.names()) {
            final double similarity = bestSimilarity(queryTrigrams, trigrams(name.toLowerCase(Locale.ROOT)));
            if (similarity >= MIN_SIMILARITY) {
                for (final SymbolDefinition definition : symbolTable.lookup(name)) {
                    best.merge(definition.docId(), similarity, Math::max);
                }
            }
        }

        final List<ScoredDocument> result = new ArrayList<>(best.size());
        for (final Map.Entry<String, Double> entry : best.entrySet()) {
            if (query.accepts(entry.getKey())) {
                result.add(new ScoredDocument(entry.getKey(), entry.getValue()));
            }
        }
        result.sort(ScoredDocument.RANKING_ORDER);
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    private static double bestSimilarity(final List<Set<String>> queryTrigrams, final Set<String> candidate) {
        double best = 0.0;
        for (final Set<String> trigrams : queryTrigrams) {
            best = Math.max(best, jaccard(trigrams, candidate));
        }
        return best;
    }

    static double jaccard(final Set<String> a, final Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        final Set<String> smaller = a.size() <= b.size() ? a : b;
        final Set<String> larger = smaller == a ? b : a;
        for (final String trigram : smaller) {
            if (larger.contains(trigram)) {
                intersection++;
            }
        }
        return (double) intersection / (a.size() + b.size() - intersection);
    }

    /**
     * Trigrams of the term padded with one boundary marker on each side, so that even
     * one and two character terms produce trigrams.
     */
    static Set<String> trigrams(final String term) {
        final String padded = "$" + term + "$";
        final Set<String> result = new HashSet<>();
        for (int i = 0; i + 3 <= padded.length(); i++) {
            result.add(padded.substring(i, i + 3));
        }
        return result;
    }
}
