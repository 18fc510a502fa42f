package de.mirkosertic.mcp.codeindex.store;

import de.mirkosertic.mcp.codeindex.index.IndexedDocument;

import java.io.IOException;
import java.util.Collection;
import java.util.Optional;

/**
 * Source of truth for indexed documents. The inverted index is rebuilt from it on startup
 * and on {@code rebuild}.
 */
public interface DocumentStore {

    Optional<IndexedDocument> get(String id);

    void put(IndexedDocument document) throws IOException;

    /**
     * @return true if a document with this id existed
     */
    boolean remove(String id) throws IOException;

    /**
     * Snapshot of all stored documents.
     */
    Collection<IndexedDocument> all();

    int size();

    /**
     * Re-reads the documents from the underlying medium, if there is one.
     */
    default void reload() throws IOException {
    }
}
