package de.mirkosertic.mcp.codeindex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact-name symbol lookup over all documents that carry a {@code symbol} field.
 * <p>
 * Lookups are single hash map reads. Writes are synchronized and replace the per-name lists
 * copy-on-write, so readers never see a partially updated list.
 */
public class SymbolTable {

    private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

    private static final Comparator<SymbolDefinition> DEFINITION_ORDER =
            Comparator.comparing(SymbolDefinition::docId);

    private final Map<String, List<SymbolDefinition>> byName = new ConcurrentHashMap<>();
    private final Map<String, List<SymbolDefinition>> byLowerCaseName = new ConcurrentHashMap<>();
    private final Map<String, SymbolDefinition> byDocId = new ConcurrentHashMap<>();

    /**
     * Registers the document's symbol, replacing what the same document declared before.
     */
    public synchronized void add(final IndexedDocument document) {
        remove(document.id());
        final SymbolDefinition definition = SymbolDefinition.fromDocument(document);
        if (definition == null) {
            return;
        }
        byDocId.put(document.id(), definition);
        byName.put(definition.name(), with(byName.get(definition.name()), definition));
        final String lower = lower(definition.name());
        byLowerCaseName.put(lower, with(byLowerCaseName.get(lower), definition));
    }

    public synchronized boolean remove(final String docId) {
        final SymbolDefinition definition = byDocId.remove(docId);
        if (definition == null) {
            return false;
        }
        replaceOrRemove(byName, definition.name(), docId);
        replaceOrRemove(byLowerCaseName, lower(definition.name()), docId);
        return true;
    }

    public synchronized void rebuild(final Collection<IndexedDocument> documents) {
        byName.clear();
        byLowerCaseName.clear();
        byDocId.clear();
        for (final IndexedDocument document : documents) {
            add(document);
        }
        logger.info("Symbol table rebuilt: {} symbols, {} distinct names", byDocId.size(), byName.size());
    }

    public List<SymbolDefinition> lookup(final String name) {
        final List<SymbolDefinition> definitions = byName.get(name);
        return definitions != null ? definitions : List.of();
    }

    public List<SymbolDefinition> lookupIgnoreCase(final String name) {
        final List<SymbolDefinition> definitions = byLowerCaseName.get(lower(name));
        return definitions != null ? definitions : List.of();
    }

    public boolean contains(final String name) {
        return byName.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(byName.keySet());
    }

    public int size() {
        return byDocId.size();
    }

    private static String lower(final String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static List<SymbolDefinition> with(final List<SymbolDefinition> existing, final SymbolDefinition definition) {
        final List<SymbolDefinition> copy = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
        copy.add(definition);
        copy.sort(DEFINITION_ORDER);
        return List.copyOf(copy);
    }

    private static void replaceOrRemove(final Map<String, List<SymbolDefinition>> map, final String key,
                                        final String docId) {
        final List<SymbolDefinition> existing = map.get(key);
        if (existing == null) {
            return;
        }
        final List<SymbolDefinition> copy = new ArrayList<>(existing);
        copy.removeIf(definition -> definition.docId().equals(docId));
        if (copy.isEmpty()) {
            map.remove(key);
        } else {
            map.put(key, List.copyOf(copy));
        }
    }
}
