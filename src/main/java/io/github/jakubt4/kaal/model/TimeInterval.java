package io.github.jakubt4.kaal.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open interval {@code [start, end)} on the UTC time line.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " precedes start " + start);
        }
    }

    public static TimeInterval of(final Instant start, final Duration length) {
        return new TimeInterval(start, start.plus(length));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(final Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean overlaps(final TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    /**
     * True when {@code other} overlaps this interval without covering all of it.
     */
    public boolean overlapsPartially(final TimeInterval other) {
        return overlaps(other) && (start.isBefore(other.start) || end.isAfter(other.end));
    }

    /**
     * Gap between the two intervals, zero if they overlap or touch.
     */
    public Duration distanceTo(final TimeInterval other) {
        if (overlaps(other)) {
            return Duration.ZERO;
        }
        return end.isAfter(other.start)
                ? Duration.between(other.end, start)
                : Duration.between(end, other.start);
    }
}
