package org.carball.querymon.model.stats;

import java.time.Duration;
import java.time.Instant;

/**
 * Inclusive time window.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
        }
    }

    public static TimeRange endingAt(Instant end, Duration length) {
        return new TimeRange(end.minus(length), end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    /**
     * The window of equal length that ends just before this one starts, so no instant
     * falls in both.
     */
    public TimeRange previous() {
        Instant previousEnd = start.minusNanos(1);
        return new TimeRange(previousEnd.minus(length()), previousEnd);
    }
}
