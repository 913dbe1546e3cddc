package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.Rashi;

/**
 * Sidereal placement of one graha.
 *
 * @param degreeInSign degrees past the start of the rashi, [0, 30)
 */
public record GrahaPosition(Body body,
                            double tropicalLongitude,
                            double siderealLongitude,
                            Rashi rashi,
                            double degreeInSign,
                            Nakshatra nakshatra,
                            int pada) {

    public static GrahaPosition of(final Body body, final double tropical, final double sidereal) {
        final var rashi = Rashi.ofLongitude(sidereal);
        return new GrahaPosition(body, tropical, sidereal, rashi,
                sidereal - rashi.ordinal() * 30.0,
                Nakshatra.ofIndex(Nakshatra.indexOf(sidereal)),
                Nakshatra.padaOf(sidereal));
    }
}
