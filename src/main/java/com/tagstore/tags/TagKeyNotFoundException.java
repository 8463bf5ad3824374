package com.tagstore.tags;

/**
 * Thrown when a project-wide tag key has no values in the query window.
 */
public class TagKeyNotFoundException extends TagStoreNotFoundException {

    private static final long serialVersionUID = 1L;

    public TagKeyNotFoundException(String key, Reason reason) {
        super("Tag key not found: " + key, key, reason);
    }
}
