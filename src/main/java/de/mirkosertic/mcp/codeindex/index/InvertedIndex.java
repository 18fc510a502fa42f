package de.mirkosertic.mcp.codeindex.index;

import com.google.common.annotations.VisibleForTesting;
import de.mirkosertic.mcp.codeindex.analysis.AnalyzedToken;
import de.mirkosertic.mcp.codeindex.analysis.CodeAnalyzer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory positional inverted index.
 * <p>
 * Writers are serialized by a single exclusive lock. Readers never lock: every postings list
 * is an immutable list that is replaced copy-on-write, so a reader holding a list reference
 * always sees a consistent list. Corpus statistics (document count, total length) are kept
 * in an immutable holder that is swapped on every mutation, which makes
 * {@link #totalDocuments()} and {@link #averageDocumentLength()} O(1).
 * <p>
 * Every successful mutation bumps {@link #version()}. Result caches compare against it to
 * detect stale entries.
 */
public class InvertedIndex {

    private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

    private record CorpusStats(int documentCount, long totalLength) {
    }

    private record DocumentEntry(DocumentStats stats, Map<String, String> fields, Set<String> terms) {
    }

    private static final class IndexState {
        private final ConcurrentSkipListMap<String, List<Posting>> postings = new ConcurrentSkipListMap<>();
        private final ConcurrentHashMap<String, DocumentEntry> documents = new ConcurrentHashMap<>();
        private volatile CorpusStats corpus = new CorpusStats(0, 0);
    }

    private final CodeAnalyzer analyzer;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong version = new AtomicLong(0);
    private volatile IndexState state = new IndexState();

    public InvertedIndex(final CodeAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Adds a document, replacing any document with the same id.
     *
     * @return true if the document is now indexed, false if it was dropped because its
     * statistics were invalid
     */
    public boolean addDocument(final String id, final String text, final Map<String, String> fields) {
        final AnalyzedDocument analyzed = analyze(id, text, fields);

        writeLock.lock();
        try {
            final IndexState current = state;
            removeInternal(current, id);
            final boolean indexed = applyOrDrop(current, analyzed);
            version.incrementAndGet();
            return indexed;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean addDocument(final IndexedDocument document) {
        return addDocument(document.id(), document.text(), document.fields());
    }

    /**
     * Removes a document and all of its postings.
     *
     * @return true if the document was present
     */
    public boolean removeDocument(final String id) {
        writeLock.lock();
        try {
            final boolean removed = removeInternal(state, id);
            if (removed) {
                version.incrementAndGet();
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Builds a fresh index state from the given documents and swaps it in atomically.
     * Writers are blocked for the duration, readers keep using the previous state until the swap.
     *
     * @return number of documents indexed, documents with invalid statistics are skipped
     */
    public int replaceAll(final Collection<IndexedDocument> documents) {
        writeLock.lock();
        try {
            final IndexState fresh = new IndexState();
            int indexed = 0;
            for (final IndexedDocument document : documents) {
                if (fresh.documents.containsKey(document.id())) {
                    removeInternal(fresh, document.id());
                    indexed--;
                }
                if (applyOrDrop(fresh, analyze(document.id(), document.text(), document.fields()))) {
                    indexed++;
                }
            }
            state = fresh;
            version.incrementAndGet();
            logger.info("Index state replaced: {} documents, {} terms", indexed, fresh.postings.size());
            return indexed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Indexes pre-computed statistics and postings. Used by tests to feed invalid data.
     */
    @VisibleForTesting
    boolean addAnalyzed(final DocumentStats stats, final Map<String, Posting> postingsByTerm,
                        final Map<String, String> fields) {
        writeLock.lock();
        try {
            final IndexState current = state;
            removeInternal(current, stats.id());
            final boolean indexed = applyOrDrop(current, new AnalyzedDocument(stats, postingsByTerm, fields));
            version.incrementAndGet();
            return indexed;
        } finally {
            writeLock.unlock();
        }
    }

    public List<Posting> getPostings(final String term) {
        final List<Posting> postings = state.postings.get(term);
        return postings != null ? postings : List.of();
    }

    public int documentFrequency(final String term) {
        return getPostings(term).size();
    }

    /**
     * @return the token length of the document, 0 for an unknown id
     */
    public int documentLength(final String id) {
        final DocumentEntry entry = state.documents.get(id);
        return entry != null ? entry.stats().length() : 0;
    }

    public @Nullable DocumentStats documentStats(final String id) {
        final DocumentEntry entry = state.documents.get(id);
        return entry != null ? entry.stats() : null;
    }

    public Map<String, String> documentFields(final String id) {
        final DocumentEntry entry = state.documents.get(id);
        return entry != null ? entry.fields() : Map.of();
    }

    public boolean containsDocument(final String id) {
        return state.documents.containsKey(id);
    }

    public int totalDocuments() {
        return state.corpus.documentCount();
    }

    public double averageDocumentLength() {
        final CorpusStats corpus = state.corpus;
        if (corpus.documentCount() == 0) {
            return 0.0;
        }
        return (double) corpus.totalLength() / corpus.documentCount();
    }

    public int termCount() {
        return state.postings.size();
    }

    /**
     * Dictionary terms starting with the given prefix, in lexicographic order.
     */
    public List<String> termsWithPrefix(final String prefix) {
        final NavigableSet<String> terms = state.postings
                .subMap(prefix, true, prefix + Character.MAX_VALUE, true)
                .navigableKeySet();
        return new ArrayList<>(terms);
    }

    /**
     * Live, weakly consistent view of the dictionary in lexicographic order.
     */
    public Collection<String> terms() {
        return Collections.unmodifiableSet(state.postings.keySet());
    }

    /**
     * Ids of all indexed documents in ascending order.
     */
    public Set<String> documentIds() {
        return Collections.unmodifiableSet(new TreeSet<>(state.documents.keySet()));
    }

    public long version() {
        return version.get();
    }

    private record AnalyzedDocument(DocumentStats stats, Map<String, Posting> postingsByTerm,
                                    Map<String, String> fields) {
    }

    private AnalyzedDocument analyze(final String id, final String text, final Map<String, String> fields) {
        final List<AnalyzedToken> tokens = analyzer.analyze(text != null ? text : "");

        final Map<String, List<Integer>> positionsByTerm = new TreeMap<>();
        final Set<Integer> distinctPositions = new HashSet<>();
        for (final AnalyzedToken token : tokens) {
            positionsByTerm.computeIfAbsent(token.term(), t -> new ArrayList<>()).add(token.position());
            distinctPositions.add(token.position());
        }

        final Map<String, Posting> postingsByTerm = new HashMap<>();
        for (final Map.Entry<String, List<Integer>> entry : positionsByTerm.entrySet()) {
            final int[] positions = entry.getValue().stream().mapToInt(Integer::intValue).sorted().toArray();
            postingsByTerm.put(entry.getKey(), new Posting(id, positions));
        }

        final Map<String, Integer> fieldLengths = new HashMap<>();
        final Map<String, String> safeFields = new HashMap<>();
        if (fields != null) {
            for (final Map.Entry<String, String> field : fields.entrySet()) {
                if (field.getKey() != null && field.getValue() != null) {
                    safeFields.put(field.getKey(), field.getValue());
                    fieldLengths.put(field.getKey(), countPositions(analyzer.analyze(field.getValue())));
                }
            }
        }

        return new AnalyzedDocument(new DocumentStats(id, distinctPositions.size(), fieldLengths),
                postingsByTerm, safeFields);
    }

    private static int countPositions(final List<AnalyzedToken> tokens) {
        final Set<Integer> positions = new HashSet<>();
        for (final AnalyzedToken token : tokens) {
            positions.add(token.position());
        }
        return positions.size();
    }

    private boolean applyOrDrop(final IndexState target, final AnalyzedDocument document) {
        try {
            applyDocument(target, document);
            return true;
        } catch (final IndexCorruptionException e) {
            logger.error("Dropping document from index: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Validates first, then mutates, so a rejected document leaves no partial postings behind.
     */
    private static void applyDocument(final IndexState target, final AnalyzedDocument document) {
        final DocumentStats stats = document.stats();
        final String id = stats.id();
        if (stats.length() < 0) {
            throw new IndexCorruptionException(id, "negative document length " + stats.length());
        }
        for (final Map.Entry<String, Posting> entry : document.postingsByTerm().entrySet()) {
            final Posting posting = entry.getValue();
            if (posting.termFrequency() <= 0 || posting.termFrequency() != posting.positions().length) {
                throw new IndexCorruptionException(id, "term '" + entry.getKey() + "' has frequency "
                        + posting.termFrequency() + " but " + posting.positions().length + " positions");
            }
            if (!id.equals(posting.docId())) {
                throw new IndexCorruptionException(id, "posting for term '" + entry.getKey()
                        + "' belongs to document '" + posting.docId() + "'");
            }
        }

        for (final Map.Entry<String, Posting> entry : document.postingsByTerm().entrySet()) {
            target.postings.put(entry.getKey(), withPosting(target.postings.get(entry.getKey()), entry.getValue()));
        }
        target.documents.put(id, new DocumentEntry(stats, Map.copyOf(document.fields()),
                Set.copyOf(document.postingsByTerm().keySet())));

        final CorpusStats corpus = target.corpus;
        target.corpus = new CorpusStats(corpus.documentCount() + 1, corpus.totalLength() + stats.length());
    }

    private static boolean removeInternal(final IndexState target, final String id) {
        final DocumentEntry entry = target.documents.remove(id);
        if (entry == null) {
            return false;
        }
        for (final String term : entry.terms()) {
            final List<Posting> updated = withoutPosting(target.postings.get(term), id);
            if (updated.isEmpty()) {
                target.postings.remove(term);
            } else {
                target.postings.put(term, updated);
            }
        }
        final CorpusStats corpus = target.corpus;
        target.corpus = new CorpusStats(corpus.documentCount() - 1, corpus.totalLength() - entry.stats().length());
        return true;
    }

    private static List<Posting> withPosting(final @Nullable List<Posting> existing, final Posting posting) {
        if (existing == null || existing.isEmpty()) {
            return List.of(posting);
        }
        final List<Posting> copy = new ArrayList<>(existing.size() + 1);
        boolean inserted = false;
        for (final Posting current : existing) {
            if (!inserted && current.docId().compareTo(posting.docId()) > 0) {
                copy.add(posting);
                inserted = true;
            }
            copy.add(current);
        }
        if (!inserted) {
            copy.add(posting);
        }
        return List.copyOf(copy);
    }

    private static List<Posting> withoutPosting(final @Nullable List<Posting> existing, final String docId) {
        if (existing == null) {
            return List.of();
        }
        final List<Posting> copy = new ArrayList<>(existing.size());
        for (final Posting current : existing) {
            if (!current.docId().equals(docId)) {
                copy.add(current);
            }
        }
        return List.copyOf(copy);
    }
}
