package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.TimeInterval;
import io.github.jakubt4.kaal.model.Vara;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Divides the daytime into eight equal segments and picks the Rahu, Gulika and
 * Yamaganda periods from them.
 */
public final class InauspiciousPeriods {

    public static final int SEGMENTS = 8;

    private InauspiciousPeriods() {
    }

    /**
     * Eight contiguous segments covering exactly {@code [sunrise, sunset)}.
     * Boundaries are placed at nanosecond precision and the last one is
     * sunset itself, so the lengths always add up to the day length.
     */
    public static List<TimeInterval> daySegments(final Instant sunrise, final Instant sunset) {
        final var dayNanos = Duration.between(sunrise, sunset).toNanos();
        final var segments = new ArrayList<TimeInterval>(SEGMENTS);
        var start = sunrise;
        for (var i = 1; i <= SEGMENTS; i++) {
            final var end = i == SEGMENTS ? sunset : sunrise.plusNanos(dayNanos * i / SEGMENTS);
            segments.add(new TimeInterval(start, end));
            start = end;
        }
        return Collections.unmodifiableList(segments);
    }

    public static Map<Kaal, TimeInterval> kaals(final List<TimeInterval> segments, final Vara vara) {
        final var kaals = new EnumMap<Kaal, TimeInterval>(Kaal.class);
        for (final var kaal : Kaal.values()) {
            kaals.put(kaal, segments.get(kaal.segment(vara) - 1));
        }
        return Collections.unmodifiableMap(kaals);
    }

    /**
     * {@code [sunrise - 96 min, sunrise - 48 min)}.
     */
    public static TimeInterval brahmaMuhurta(final Instant sunrise) {
        return new TimeInterval(sunrise.minus(Duration.ofMinutes(96)), sunrise.minus(Duration.ofMinutes(48)));
    }

    /**
     * Middle fifteenth of the daytime, centred on solar noon.
     */
    public static TimeInterval abhijitMuhurta(final Instant sunrise, final Instant sunset) {
        final var dayNanos = Duration.between(sunrise, sunset).toNanos();
        final var noon = sunrise.plusNanos(dayNanos / 2);
        final var half = dayNanos / 30;
        return new TimeInterval(noon.minusNanos(half), noon.plusNanos(half));
    }
}
