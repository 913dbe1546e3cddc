package io.github.jakubt4.kaal.model;

import io.github.jakubt4.kaal.error.EphemerisUnavailableException;

import java.util.Map;

/**
 * Tropical apparent geocentric ecliptic longitude of a body.
 *
 * <p>Non-finite values are rejected here so that a broken provider can never
 * leak a zero or NaN into the calendrical arithmetic.
 *
 * @param body    the body
 * @param degrees longitude, normalised to [0, 360)
 */
public record BodyLongitude(Body body, double degrees) {

    public BodyLongitude {
        if (body == null) {
            throw new EphemerisUnavailableException("Longitude supplied without a body", Map.of());
        }
        if (!Double.isFinite(degrees)) {
            throw new EphemerisUnavailableException("Malformed longitude",
                    Map.of("body", body, "degrees", degrees));
        }
        degrees = Angles.normalize(degrees);
    }
}
