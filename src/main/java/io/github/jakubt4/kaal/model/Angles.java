package io.github.jakubt4.kaal.model;

/**
 * Degree arithmetic shared by the ephemeris, ayanamsha and panchang code.
 */
public final class Angles {

    public static final double FULL_CIRCLE = 360.0;

    private Angles() {
    }

    /**
     * Reduces an angle to [0, 360). Guards the upper bound explicitly because
     * {@code -1e-15 % 360 + 360} rounds to exactly 360.0.
     */
    public static double normalize(final double degrees) {
        var r = degrees % FULL_CIRCLE;
        if (r < 0) {
            r += FULL_CIRCLE;
        }
        if (r >= FULL_CIRCLE) {
            r -= FULL_CIRCLE;
        }
        return r;
    }

    /**
     * Smallest absolute separation between two angles, in [0, 180].
     */
    public static double separation(final double a, final double b) {
        final var d = normalize(a - b);
        return d > 180.0 ? FULL_CIRCLE - d : d;
    }

    public static double sinDeg(final double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cosDeg(final double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }
}
