package io.github.jakubt4.kaal.ephemeris;

import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.BodyLongitude;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.time.TimePoint;

/**
 * Narrow boundary to the source of raw body positions.
 *
 * <p>Implementations must fail with
 * {@link io.github.jakubt4.kaal.error.EphemerisUnavailableException} for
 * unsupported bodies and for instants outside their range; they never return
 * a default value.
 */
public interface EphemerisProvider {

    /**
     * Apparent geocentric tropical ecliptic longitude.
     */
    BodyLongitude longitude(Body body, TimePoint time);

    /**
     * Topocentric geometric altitude of the body's centre above the horizon, in
     * degrees. Refraction is not applied.
     */
    double altitude(Body body, TimePoint time, Location location);

    /**
     * Equatorial horizontal parallax in degrees.
     */
    double horizontalParallax(Body body, TimePoint time);

    boolean supports(Body body);

    /**
     * Short identifier used in logs and cache keys.
     */
    String name();
}
