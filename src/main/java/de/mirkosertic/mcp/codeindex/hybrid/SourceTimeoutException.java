package de.mirkosertic.mcp.codeindex.hybrid;

/**
 * A source did not answer before its deadline.
 */
public class SourceTimeoutException extends SearchSourceException {

    private final long timeoutMs;

    public SourceTimeoutException(final SourceType source, final long timeoutMs) {
        super(source, "Source " + source.key() + " exceeded its timeout of " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
