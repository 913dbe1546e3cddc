package io.github.jakubt4.kaal.ephemeris;

import io.github.jakubt4.kaal.model.Angles;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.time.TimePoint;

/**
 * Mean ascending node of the lunar orbit (Meeus, Astronomical Algorithms 47.7).
 * Rahu is the ascending node, Ketu sits opposite.
 */
final class MeanLunarNode {

    private MeanLunarNode() {
    }

    static double longitude(final Body node, final TimePoint time) {
        final var t = time.centuriesTt();
        final var omega = 125.0445479 - 1934.1362891 * t + 0.0020754 * t * t
                + t * t * t / 467_441.0 - t * t * t * t / 60_616_000.0;
        return node == Body.KETU ? Angles.normalize(omega + 180.0) : Angles.normalize(omega);
    }
}
