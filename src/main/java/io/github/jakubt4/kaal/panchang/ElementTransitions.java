package io.github.jakubt4.kaal.panchang;

import java.time.Duration;
import java.time.Instant;

/**
 * Instants at which the tithi, nakshatra, yoga and karana in force at a given
 * moment give way to the next one. The ayanamsha is held at its value for that
 * moment.
 */
public record ElementTransitions(Instant tithiEnds, Instant nakshatraEnds, Instant yogaEnds, Instant karanaEnds) {

    public Duration tithiRemaining(final Instant from) {
        return remaining(from, tithiEnds);
    }

    public Duration nakshatraRemaining(final Instant from) {
        return remaining(from, nakshatraEnds);
    }

    private static Duration remaining(final Instant from, final Instant end) {
        return from.isBefore(end) ? Duration.between(from, end) : Duration.ZERO;
    }
}
