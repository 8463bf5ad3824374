package com.tagstore.query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Represents a half-open time range {@code [start, end)} for query filtering
 */
public class TimeRange {
    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Time range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Window ending at the clock's current instant and reaching {@code days} back.
     */
    public static TimeRange trailingDays(Clock clock, int days) {
        Instant end = clock.instant();
        return new TimeRange(end.minus(Duration.ofDays(days)), end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
