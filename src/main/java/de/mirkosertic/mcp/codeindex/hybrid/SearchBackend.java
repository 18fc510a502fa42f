package de.mirkosertic.mcp.codeindex.hybrid;

import java.io.IOException;
import java.util.List;

/**
 * An external search backend, for example a vector store. Only the order of the returned ids
 * is used.
 */
@FunctionalInterface
public interface SearchBackend {

    List<String> search(String query, int limit) throws IOException;
}
