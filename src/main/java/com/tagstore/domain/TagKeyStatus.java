package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a tag key.
 *
 * Only visible keys exist in the analytics engine; keys that are being removed
 * are tracked elsewhere and cannot be queried through this layer.
 */
public enum TagKeyStatus {

    /**
     * Key is live and queryable.
     */
    VISIBLE("visible"),

    /**
     * Key has been scheduled for deletion.
     */
    PENDING_DELETION("pending_deletion"),

    /**
     * Key data is being purged.
     */
    DELETION_IN_PROGRESS("deletion_in_progress");

    private final String value;

    TagKeyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isQueryable() {
        return this == VISIBLE;
    }

    @Override
    public String toString() {
        return value;
    }
}
