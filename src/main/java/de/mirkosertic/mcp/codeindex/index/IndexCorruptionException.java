package de.mirkosertic.mcp.codeindex.index;

/**
 * Thrown when the statistics computed for a document violate an index invariant,
 * for example a negative length or a posting whose frequency does not match its positions.
 * Only the affected document is dropped.
 */
public class IndexCorruptionException extends RuntimeException {

    private final String docId;

    public IndexCorruptionException(final String docId, final String message) {
        super("Document '" + docId + "': " + message);
        this.docId = docId;
    }

    public String getDocId() {
        return docId;
    }
}
