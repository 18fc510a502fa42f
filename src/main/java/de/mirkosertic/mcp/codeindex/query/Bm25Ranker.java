package de.mirkosertic.mcp.codeindex.query;

import de.mirkosertic.mcp.codeindex.index.InvertedIndex;
import de.mirkosertic.mcp.codeindex.index.Posting;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a {@link QueryNode} tree against an {@link InvertedIndex} with Okapi BM25.
 * <p>
 * Only documents that satisfy the query are ever scored. Structural nodes (phrase, near)
 * first intersect the postings of their terms and verify positions, then sum the BM25
 * contributions of their terms for the documents that pass.
 * <p>
 * Prefix queries are expanded to at most {@value #MAX_PREFIX_EXPANSIONS} dictionary terms,
 * the most frequent ones first, similar to how scored prefix terms are capped elsewhere.
 */
public class Bm25Ranker {

    public static final int MAX_PREFIX_EXPANSIONS = 50;

    private final Bm25Parameters parameters;

    public Bm25Ranker(final Bm25Parameters parameters) {
        this.parameters = parameters;
    }

    public Bm25Ranker() {
        this(Bm25Parameters.defaults());
    }

    /**
     * Scores all matching documents.
     *
     * @return matching documents, score descending, doc id ascending on ties
     */
    public List<ScoredDocument> score(final QueryNode query, final InvertedIndex index) {
        final Map<String, Double> scores = evaluate(query, index);
        final List<ScoredDocument> result = new ArrayList<>(scores.size());
        for (final Map.Entry<String, Double> entry : scores.entrySet()) {
            result.add(new ScoredDocument(entry.getKey(), entry.getValue()));
        }
        result.sort(ScoredDocument.RANKING_ORDER);
        return result;
    }

    /**
     * The dictionary terms a prefix expands to: highest document frequency first, then lexicographic.
     */
    public static List<String> expandPrefix(final String stem, final InvertedIndex index) {
        final List<String> candidates = index.termsWithPrefix(stem);
        final Map<String, Integer> frequencies = new HashMap<>();
        for (final String term : candidates) {
            frequencies.put(term, index.documentFrequency(term));
        }
        candidates.sort(Comparator.<String>comparingInt(frequencies::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
        return candidates.size() > MAX_PREFIX_EXPANSIONS
                ? new ArrayList<>(candidates.subList(0, MAX_PREFIX_EXPANSIONS))
                : candidates;
    }

    double idf(final int documentFrequency, final int totalDocuments) {
        return Math.log(1.0 + (totalDocuments - documentFrequency + 0.5) / (documentFrequency + 0.5));
    }

    double contribution(final double idf, final int termFrequency, final int documentLength,
                        final double averageDocumentLength) {
        final double k1 = parameters.k1();
        final double b = parameters.b();
        final double lengthRatio = averageDocumentLength > 0 ? documentLength / averageDocumentLength : 1.0;
        return idf * (termFrequency * (k1 + 1)) / (termFrequency + k1 * (1 - b + b * lengthRatio));
    }

    private Map<String, Double> evaluate(final QueryNode node, final InvertedIndex index) {
        if (node instanceof QueryNode.Term term) {
            return termScores(term.text(), index);
        }
        if (node instanceof QueryNode.Phrase phrase) {
            return phraseScores(phrase, index);
        }
        if (node instanceof QueryNode.Near near) {
            return nearScores(near, index);
        }
        if (node instanceof QueryNode.Prefix prefix) {
            final Map<String, Double> scores = new HashMap<>();
            for (final String term : expandPrefix(prefix.stem(), index)) {
                termScores(term, index).forEach((docId, score) -> scores.merge(docId, score, Double::sum));
            }
            return scores;
        }
        if (node instanceof QueryNode.And and) {
            return andScores(and, index);
        }
        if (node instanceof QueryNode.Or or) {
            final Map<String, Double> scores = new HashMap<>();
            for (final QueryNode child : or.children()) {
                evaluate(child, index).forEach((docId, score) -> scores.merge(docId, score, Double::sum));
            }
            return scores;
        }
        // A standalone NOT has nothing to subtract from
        return Map.of();
    }

    private Map<String, Double> andScores(final QueryNode.And and, final InvertedIndex index) {
        Map<String, Double> result = null;
        final List<QueryNode> excluded = new ArrayList<>();
        for (final QueryNode child : and.children()) {
            if (child instanceof QueryNode.Not not) {
                excluded.add(not.child());
                continue;
            }
            final Map<String, Double> childScores = evaluate(child, index);
            if (result == null) {
                result = new HashMap<>(childScores);
            } else {
                result.keySet().retainAll(childScores.keySet());
                for (final Map.Entry<String, Double> entry : result.entrySet()) {
                    entry.setValue(entry.getValue() + childScores.get(entry.getKey()));
                }
            }
            if (result.isEmpty()) {
                return Map.of();
            }
        }
        if (result == null) {
            return Map.of();
        }
        for (final QueryNode negative : excluded) {
            result.keySet().removeAll(evaluate(negative, index).keySet());
        }
        return result;
    }

    private Map<String, Double> termScores(final String term, final InvertedIndex index) {
        final List<Posting> postings = index.getPostings(term);
        if (postings.isEmpty()) {
            return Map.of();
        }
        final double idf = idf(postings.size(), index.totalDocuments());
        final double averageLength = index.averageDocumentLength();
        final Map<String, Double> scores = new HashMap<>();
        for (final Posting posting : postings) {
            scores.put(posting.docId(), contribution(idf, posting.termFrequency(),
                    index.documentLength(posting.docId()), averageLength));
        }
        return scores;
    }

    private Map<String, Double> phraseScores(final QueryNode.Phrase phrase, final InvertedIndex index) {
        final List<String> terms = phrase.terms();
        final Map<String, Map<String, Posting>> postingsByTerm = postingsByTerm(new LinkedHashSet<>(terms), index);
        final Set<String> candidates = candidates(postingsByTerm);

        final Map<String, Double> scores = new HashMap<>();
        for (final String docId : candidates) {
            final int[][] positions = new int[terms.size()][];
            for (int i = 0; i < terms.size(); i++) {
                positions[i] = postingsByTerm.get(terms.get(i)).get(docId).positions();
            }
            if (matchesPhrase(positions, phrase.offsets())) {
                scores.put(docId, sumContributions(new LinkedHashSet<>(terms), postingsByTerm, docId, index));
            }
        }
        return scores;
    }

    private Map<String, Double> nearScores(final QueryNode.Near near, final InvertedIndex index) {
        final Set<String> terms = new LinkedHashSet<>(near.terms());
        final Map<String, Map<String, Posting>> postingsByTerm = postingsByTerm(terms, index);
        final Set<String> candidates = candidates(postingsByTerm);

        final Map<String, Double> scores = new HashMap<>();
        for (final String docId : candidates) {
            final List<int[]> positions = new ArrayList<>(terms.size());
            for (final String term : terms) {
                positions.add(postingsByTerm.get(term).get(docId).positions());
            }
            if (withinDistance(positions, near.maxDistance())) {
                scores.put(docId, sumContributions(terms, postingsByTerm, docId, index));
            }
        }
        return scores;
    }

    private static Map<String, Map<String, Posting>> postingsByTerm(final Set<String> terms,
                                                                  final InvertedIndex index) {
        final Map<String, Map<String, Posting>> result = new HashMap<>();
        for (final String term : terms) {
            final Map<String, Posting> byDoc = new HashMap<>();
            for (final Posting posting : index.getPostings(term)) {
                byDoc.put(posting.docId(), posting);
            }
            result.put(term, byDoc);
        }
        return result;
    }

    private static Set<String> candidates(final Map<String, Map<String, Posting>> postingsByTerm) {
        Set<String> candidates = null;
        for (final Map<String, Posting> byDoc : postingsByTerm.values()) {
            if (candidates == null) {
                candidates = new HashSet<>(byDoc.keySet());
            } else {
                candidates.retainAll(byDoc.keySet());
            }
            if (candidates.isEmpty()) {
                return Set.of();
            }
        }
        return candidates != null ? candidates : Set.of();
    }

    private double sumContributions(final Set<String> terms, final Map<String, Map<String, Posting>> postingsByTerm,
                                    final String docId, final InvertedIndex index) {
        final int totalDocuments = index.totalDocuments();
        final double averageLength = index.averageDocumentLength();
        final int documentLength = index.documentLength(docId);
        double sum = 0.0;
        for (final String term : terms) {
            final Map<String, Posting> byDoc = postingsByTerm.get(term);
            final double idf = idf(byDoc.size(), totalDocuments);
            sum += contribution(idf, byDoc.get(docId).termFrequency(), documentLength, averageLength);
        }
        return sum;
    }

    /**
     * True if some start position p exists such that term i occurs at p + offsets[i] - offsets[0].
     */
    static boolean matchesPhrase(final int[][] positions, final List<Integer> offsets) {
        final int base = offsets.get(0);
        for (final int start : positions[0]) {
            boolean matched = true;
            for (int i = 1; i < positions.length && matched; i++) {
                matched = Arrays.binarySearch(positions[i], start + offsets.get(i) - base) >= 0;
            }
            if (matched) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if a window of at most {@code maxDistance} positions contains an occurrence of every term.
     * Sliding window over the merged, sorted occurrences.
     */
    static boolean withinDistance(final List<int[]> positions, final int maxDistance) {
        final int termCount = positions.size();
        int total = 0;
        for (final int[] termPositions : positions) {
            total += termPositions.length;
        }

        final long[] occurrences = new long[total];
        int n = 0;
        for (int term = 0; term < termCount; term++) {
            for (final int position : positions.get(term)) {
                occurrences[n++] = ((long) position << 32) | term;
            }
        }
        Arrays.sort(occurrences);

        final int[] counts = new int[termCount];
        int covered = 0;
        int left = 0;
        for (int right = 0; right < total; right++) {
            final int rightTerm = (int) (occurrences[right] & 0xFFFFFFFFL);
            if (counts[rightTerm]++ == 0) {
                covered++;
            }
            while (covered == termCount) {
                final int span = (int) (occurrences[right] >> 32) - (int) (occurrences[left] >> 32);
                if (span <= maxDistance) {
                    return true;
                }
                final int leftTerm = (int) (occurrences[left] & 0xFFFFFFFFL);
                if (--counts[leftTerm] == 0) {
                    covered--;
                }
                left++;
            }
        }
        return false;
    }
}
