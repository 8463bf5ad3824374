package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Statistics for a dimension that is not a real tag (a release, a user) but is
 * shaped like a tag value for downstream consumers.
 *
 * The key is a fixed label chosen by the producing operation. There is no
 * backing entity, so the identity is always {@link #SYNTHETIC_ID}.
 */
public class LabeledTagStat {

    public static final long SYNTHETIC_ID = 0L;

    /**
     * Label used for per-release statistics.
     */
    public static final String RELEASE_KEY = "release";

    /**
     * Label used for per-user statistics.
     */
    public static final String USER_KEY = "sentry:user";

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

    public LabeledTagStat(String key, String value, long timesSeen, Instant firstSeen, Instant lastSeen) {
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

    @JsonProperty("id")
    public long getId() {
        return SYNTHETIC_ID;
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
        return "LabeledTagStat{key='" + key + "', value='" + value + "', timesSeen=" + timesSeen
            + ", firstSeen=" + firstSeen + ", lastSeen=" + lastSeen + "}";
    }
}
