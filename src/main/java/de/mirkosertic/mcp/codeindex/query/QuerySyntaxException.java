package de.mirkosertic.mcp.codeindex.query;

/**
 * The query string could not be parsed. Never retried.
 */
public class QuerySyntaxException extends Exception {

    private final int position;

    public QuerySyntaxException(final String message, final int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.position = position;
    }

    /**
     * Character offset in the query string, or -1 if not applicable.
     */
    public int getPosition() {
        return position;
    }
}
