package de.mirkosertic.mcp.codeindex.hybrid;

import de.mirkosertic.mcp.codeindex.query.ScoredDocument;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Adapts a {@link SearchBackend} that only returns an ordered id list. The i-th id
 * (0-based) gets the score {@code 1 / (i + 1)} so that the orchestrator reproduces the
 * backend's order; duplicates keep their first position.
 * <p>
 * The backend cannot see the search filters, filtering of its ids happens after fusion.
 */
public class ExternalRankedSource implements RankedSource {

    private final SourceType type;
    private final SearchBackend backend;

    public ExternalRankedSource(final SourceType type, final SearchBackend backend) {
        this.type = type;
        this.backend = backend;
    }

    @Override
    public SourceType type() {
        return type;
    }

    @Override
    public List<ScoredDocument> search(final SourceQuery query, final int limit) {
        final List<String> ids;
        try {
            ids = backend.search(query.text(), limit);
        } catch (final IOException e) {
            throw new SearchSourceException(type, "Backend " + type.key() + " failed: " + e.getMessage(), e);
        }
        if (ids == null) {
            return List.of();
        }

        final Set<String> seen = new LinkedHashSet<>();
        for (final String id : ids) {
            if (id != null) {
                seen.add(id);
            }
            if (seen.size() >= limit) {
                break;
            }
        }

        final List<ScoredDocument> result = new ArrayList<>(seen.size());
        int position = 0;
        for (final String id : seen) {
            result.add(new ScoredDocument(id, 1.0 / (++position)));
        }
        return result;
    }
}
