package io.github.jakubt4.kaal;

import io.github.jakubt4.kaal.ephemeris.EphemerisProvider;
import io.github.jakubt4.kaal.error.EphemerisUnavailableException;
import io.github.jakubt4.kaal.model.Angles;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.BodyLongitude;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.time.TimePoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Ephemeris with linearly moving longitudes and sinusoidal altitudes over UTC
 * time of day. The given longitudes hold at {@link #REFERENCE}; the Sun and Moon
 * then advance at their mean daily motions. The Sun crosses the rise/set
 * threshold (sea level) at exactly 06:00 and 18:00 UTC, which makes every day
 * period predictable for an observer on the prime meridian.
 */
public class SyntheticEphemerisProvider implements EphemerisProvider {

    public static final double SUN_THRESHOLD = -0.8333;
    public static final double MOON_PARALLAX = 0.95;
    public static final Instant REFERENCE = Instant.parse("2024-01-01T12:00:00Z");
    public static final double SUN_DEGREES_PER_DAY = 0.9856;
    public static final double MOON_DEGREES_PER_DAY = 13.1764;

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double sunLongitude;
    private final double moonLongitude;

    public SyntheticEphemerisProvider(final double sunLongitude, final double moonLongitude) {
        this.sunLongitude = sunLongitude;
        this.moonLongitude = moonLongitude;
    }

    @Override
    public BodyLongitude longitude(final Body body, final TimePoint time) {
        final var days = Duration.between(REFERENCE, time.utc()).toMillis() / 1000.0 / SECONDS_PER_DAY;
        return switch (body) {
            case SUN -> new BodyLongitude(body, Angles.normalize(sunLongitude + SUN_DEGREES_PER_DAY * days));
            case MOON -> new BodyLongitude(body, Angles.normalize(moonLongitude + MOON_DEGREES_PER_DAY * days));
            default -> throw new EphemerisUnavailableException("Not synthesised", Map.of("body", body));
        };
    }

    @Override
    public double altitude(final Body body, final TimePoint time, final Location location) {
        final var dayFraction = (Math.floorMod(time.utc().getEpochSecond(), 86_400L) + time.utc().getNano() / 1e9)
                / SECONDS_PER_DAY;
        return switch (body) {
            case SUN -> SUN_THRESHOLD + 60.0 * Math.sin(2.0 * Math.PI * (dayFraction - 0.25));
            // Moon rises at 10:00 and sets at 22:00
            case MOON -> -(0.5667 + 0.2725 * MOON_PARALLAX)
                    + 50.0 * Math.sin(2.0 * Math.PI * (dayFraction - 10.0 / 24.0));
            default -> throw new EphemerisUnavailableException("Not synthesised", Map.of("body", body));
        };
    }

    @Override
    public double horizontalParallax(final Body body, final TimePoint time) {
        return body == Body.MOON ? MOON_PARALLAX : 0.0;
    }

    @Override
    public boolean supports(final Body body) {
        return body == Body.SUN || body == Body.MOON;
    }

    @Override
    public String name() {
        return "synthetic-" + sunLongitude + "-" + moonLongitude;
    }
}
