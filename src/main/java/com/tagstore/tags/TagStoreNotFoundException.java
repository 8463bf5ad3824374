package com.tagstore.tags;

/**
 * Base class for lookups of a single tag key or value that found nothing in
 * the query window. This is an expected outcome for optional lookups, not an
 * engine failure.
 */
public abstract class TagStoreNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Why the lookup came back empty.
     */
    public enum Reason {
        /**
         * The engine returned no rows.
         */
        NO_ROWS,
        /**
         * The engine returned a row whose aggregate is zero.
         */
        ZERO_COUNT
    }

    private final String key;
    private final Reason reason;

    protected TagStoreNotFoundException(String message, String key, Reason reason) {
        super(message + " [reason=" + reason + "]");
        this.key = key;
        this.reason = reason;
    }

    public String getKey() {
        return key;
    }

    public Reason getReason() {
        return reason;
    }
}
