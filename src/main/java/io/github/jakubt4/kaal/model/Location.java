package io.github.jakubt4.kaal.model;

import io.github.jakubt4.kaal.error.InvalidCoordinateException;

import java.time.ZoneOffset;
import java.util.Map;

/**
 * Observer position on the Earth.
 *
 * @param latitude  geodetic latitude in degrees, north positive, [-90, 90]
 * @param longitude geodetic longitude in degrees, east positive, [-180, 180]
 * @param elevation height above sea level in metres
 */
public record Location(double latitude, double longitude, double elevation) {

    private static final double MIN_ELEVATION = -500.0;
    private static final double MAX_ELEVATION = 10_000.0;

    public Location {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidCoordinateException("Latitude out of range [-90, 90]",
                    Map.of("latitude", latitude));
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidCoordinateException("Longitude out of range [-180, 180]",
                    Map.of("longitude", longitude));
        }
        if (!Double.isFinite(elevation) || elevation < MIN_ELEVATION || elevation > MAX_ELEVATION) {
            throw new InvalidCoordinateException("Elevation out of range",
                    Map.of("elevation", elevation));
        }
    }

    public static Location of(final double latitude, final double longitude) {
        return new Location(latitude, longitude, 0.0);
    }

    /**
     * Local mean time offset: four minutes of time per degree of longitude.
     */
    public ZoneOffset meanTimeOffset() {
        return ZoneOffset.ofTotalSeconds((int) Math.round(longitude * 240.0));
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f, %.0fm)", latitude, longitude, elevation);
    }
}
