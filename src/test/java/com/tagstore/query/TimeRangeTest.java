package com.tagstore.query;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeRangeTest {

    @Test
    void testTrailingDaysEndsAtClockInstant() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-31T00:00:00Z"), ZoneOffset.UTC);

        TimeRange range = TimeRange.trailingDays(clock, 90);

        assertThat(range.getStart()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(range.getEnd()).isEqualTo(Instant.parse("2024-03-31T00:00:00Z"));
        assertThat(range).hasToString("[2024-01-01T00:00:00Z, 2024-03-31T00:00:00Z)");
    }

    @Test
    void testStartAfterEndRejected() {
        Instant now = Instant.parse("2024-03-31T00:00:00Z");

        assertThatThrownBy(() -> new TimeRange(now, now.minusSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeRange(null, now))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEmptyRangeAllowed() {
        Instant now = Instant.parse("2024-03-31T00:00:00Z");

        assertThat(new TimeRange(now, now).getStart()).isEqualTo(now);
    }
}
