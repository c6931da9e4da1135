package com.mimecast.warden.exception;

/**
 * Rule search returned a non-OK status.
 *
 * <p>A failed search aborts the whole wake-up and is handled like any other transport failure.
 */
public class SearchFailedException extends TransportException {

    private final String query;

    /**
     * Constructs a new SearchFailedException instance.
     *
     * @param query   Compiled search query.
     * @param message Server response text.
     */
    public SearchFailedException(String query, String message) {
        super("Search failed for " + query + ": " + message);
        this.query = query;
    }

    /**
     * Gets the query that failed.
     *
     * @return Query string.
     */
    public String getQuery() {
        return query;
    }
}
