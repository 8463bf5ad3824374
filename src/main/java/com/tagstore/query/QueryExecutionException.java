package com.tagstore.query;

/**
 * Exception thrown when a query descriptor cannot be turned into an engine query.
 * Carries the offending descriptor for context.
 */
public class QueryExecutionException extends RuntimeException {

    private final String query;

    public QueryExecutionException(String message) {
        super(message);
        this.query = null;
    }

    public QueryExecutionException(String message, String query) {
        super(message);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
