package de.mirkosertic.mcp.codeindex.hybrid;

/**
 * A ranked source failed. Recovered by the orchestrator, the source is reported as degraded.
 */
public class SearchSourceException extends RuntimeException {

    private final SourceType source;

    public SearchSourceException(final SourceType source, final String message) {
        super(message);
        this.source = source;
    }

    public SearchSourceException(final SourceType source, final String message, final Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public SourceType getSource() {
        return source;
    }
}
