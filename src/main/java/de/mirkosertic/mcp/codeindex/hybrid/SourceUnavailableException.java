package de.mirkosertic.mcp.codeindex.hybrid;

/**
 * A source is enabled in the configuration but no implementation is registered.
 * The enabled set is narrowed for the current call only.
 */
public class SourceUnavailableException extends SearchSourceException {

    public SourceUnavailableException(final SourceType source) {
        super(source, "Source " + source.key() + " is enabled but not registered");
    }
}
