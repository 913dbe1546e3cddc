package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.model.TimeInterval;
import io.github.jakubt4.kaal.model.Vara;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Sun-driven timings of one local-mean-time day at one location.
 *
 * @param segments the eight equal daytime segments, sunrise to sunset
 */
public record SolarDay(LocalDate date,
                       Location location,
                       Vara vara,
                       Instant sunrise,
                       Instant sunset,
                       Instant solarNoon,
                       Duration dayLength,
                       List<TimeInterval> segments,
                       Map<Kaal, TimeInterval> kaals,
                       TimeInterval brahmaMuhurta,
                       TimeInterval abhijitMuhurta) {

    public static SolarDay of(final LocalDate date, final Location location,
                              final Instant sunrise, final Instant sunset) {
        final var dayLength = Duration.between(sunrise, sunset);
        final var vara = Vara.of(date.getDayOfWeek());
        final var segments = InauspiciousPeriods.daySegments(sunrise, sunset);
        return new SolarDay(date, location, vara, sunrise, sunset,
                sunrise.plusNanos(dayLength.toNanos() / 2),
                dayLength,
                segments,
                InauspiciousPeriods.kaals(segments, vara),
                InauspiciousPeriods.brahmaMuhurta(sunrise),
                InauspiciousPeriods.abhijitMuhurta(sunrise, sunset));
    }

    public TimeInterval kaal(final Kaal kaal) {
        return kaals.get(kaal);
    }

    public TimeInterval rahuKaal() {
        return kaal(Kaal.RAHU);
    }

    public TimeInterval gulikaKaal() {
        return kaal(Kaal.GULIKA);
    }

    public TimeInterval yamagandaKaal() {
        return kaal(Kaal.YAMAGANDA);
    }

    public TimeInterval daytime() {
        return new TimeInterval(sunrise, sunset);
    }
}
