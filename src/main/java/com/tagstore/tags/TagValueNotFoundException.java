package com.tagstore.tags;

/**
 * Thrown when a project-wide tag value was not seen in the query window.
 */
public class TagValueNotFoundException extends TagStoreNotFoundException {

    private static final long serialVersionUID = 1L;

    private final String value;

    public TagValueNotFoundException(String key, String value, Reason reason) {
        super("Tag value not found: " + key + "=" + value, key, reason);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
