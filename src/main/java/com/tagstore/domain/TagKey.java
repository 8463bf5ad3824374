package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A tag name visible across a project, with the number of distinct values
 * observed for it in the query window.
 */
public class TagKey {

    @JsonProperty("key")
    private final String key;

    @JsonProperty("values_seen")
    private final long valuesSeen;

    public TagKey(String key, long valuesSeen) {
        if (valuesSeen < 0) {
            throw new IllegalArgumentException("values_seen must not be negative: " + valuesSeen);
        }
        this.key = key;
        this.valuesSeen = valuesSeen;
    }

    public String getKey() {
        return key;
    }

    public long getValuesSeen() {
        return valuesSeen;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{key='" + key + "', valuesSeen=" + valuesSeen + "}";
    }
}
