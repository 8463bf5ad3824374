package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A specific value of a tag across a project.
 *
 * {@code firstSeen} and {@code lastSeen} come from min/max over the same event
 * timestamp column, so {@code firstSeen <= lastSeen} whenever both are present.
 */
public class TagValue {

    @JsonProperty("key")
    private final String key;

    @JsonProperty("value")
    private final String value;

    @JsonProperty("times_seen")
    private final long timesSeen;

    @JsonProperty("first_seen")
    private final Instant firstSeen;

    @JsonProperty("last_seen")
    private final Instant lastSeen;

    public TagValue(String key, String value, long timesSeen, Instant firstSeen, Instant lastSeen) {
        if (timesSeen < 0) {
            throw new IllegalArgumentException("times_seen must not be negative: " + timesSeen);
        }
        if (firstSeen != null && lastSeen != null && firstSeen.isAfter(lastSeen)) {
            throw new IllegalArgumentException(
                "first_seen " + firstSeen + " is after last_seen " + lastSeen + " for " + key + "=" + value);
        }
        this.key = key;
        this.value = value;
        this.timesSeen = timesSeen;
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public long getTimesSeen() {
        return timesSeen;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{key='" + key + "', value='" + value + "', timesSeen=" + timesSeen
            + ", firstSeen=" + firstSeen + ", lastSeen=" + lastSeen + "}";
    }
}
