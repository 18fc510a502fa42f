package de.mirkosertic.mcp.codeindex.store;

import de.mirkosertic.mcp.codeindex.index.IndexedDocument;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store, used in tests and when no store path is configured.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentHashMap<String, IndexedDocument> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<IndexedDocument> get(final String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public void put(final IndexedDocument document) {
        documents.put(document.id(), document);
    }

    @Override
    public boolean remove(final String id) {
        return documents.remove(id) != null;
    }

    @Override
    public Collection<IndexedDocument> all() {
        return List.copyOf(documents.values());
    }

    @Override
    public int size() {
        return documents.size();
    }
}
