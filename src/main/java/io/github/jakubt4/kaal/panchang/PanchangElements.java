package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.error.EphemerisUnavailableException;
import io.github.jakubt4.kaal.model.Angles;
import io.github.jakubt4.kaal.model.Rashi;

import java.util.Map;

/**
 * The part of a panchang that depends only on the sidereal Sun and Moon
 * longitudes: the four lunar elements, moon phase, signs and season.
 *
 * @param sunLongitude        sidereal Sun, [0, 360)
 * @param moonLongitude       sidereal Moon, [0, 360)
 * @param elongation          Moon minus Sun, [0, 360)
 * @param tithiValue          elongation / 12, [0, 30)
 * @param tithiIndex          floor of tithiValue, [0, 30)
 * @param nakshatraIndex      [0, 27)
 * @param pada                quarter of the nakshatra, 1..4
 * @param yogaIndex           [0, 27)
 * @param karanaIndex         half-tithi slot, [0, 60)
 * @param illumination        lit fraction of the Moon in percent
 * @param tithiCompletion     percent of the current tithi already elapsed
 * @param nakshatraCompletion percent of the current nakshatra already traversed
 * @param ritu                season from the sidereal Sun's sign
 */
public record PanchangElements(double sunLongitude,
                               double moonLongitude,
                               double elongation,
                               double tithiValue,
                               int tithiIndex,
                               Tithi tithi,
                               int nakshatraIndex,
                               Nakshatra nakshatra,
                               int pada,
                               int yogaIndex,
                               Yoga yoga,
                               int karanaIndex,
                               Karana karana,
                               MoonPhase moonPhase,
                               double illumination,
                               double tithiCompletion,
                               double nakshatraCompletion,
                               Rashi sunRashi,
                               Rashi moonRashi,
                               Ritu ritu) {

    public Paksha paksha() {
        return tithi.paksha();
    }

    /**
     * @throws EphemerisUnavailableException if either longitude is not a finite number
     */
    public static PanchangElements compute(final double sunSidereal, final double moonSidereal,
                                           final KaranaCycle karanaCycle) {
        if (!Double.isFinite(sunSidereal) || !Double.isFinite(moonSidereal)) {
            throw new EphemerisUnavailableException("Malformed sidereal longitude",
                    Map.of("sun", sunSidereal, "moon", moonSidereal));
        }
        final var sun = Angles.normalize(sunSidereal);
        final var moon = Angles.normalize(moonSidereal);

        final var elongation = Angles.normalize(moon - sun);
        final var tithiValue = elongation / Tithi.SPAN_DEGREES;
        final var tithiIndex = Math.min((int) Math.floor(tithiValue), Tithi.COUNT - 1);

        final var nakshatraIndex = Nakshatra.indexOf(moon);
        final var nakshatraCompletion = (moon - nakshatraIndex * Nakshatra.SPAN_DEGREES)
                / Nakshatra.SPAN_DEGREES * 100.0;

        final var yogaIndex = Math.min((int) Math.floor(Angles.normalize(sun + moon) / Yoga.SPAN_DEGREES),
                Yoga.COUNT - 1);
        final var karanaIndex = Math.floorMod((int) Math.floor(tithiValue * 2.0), Karana.SLOTS);
        final var sunRashi = Rashi.ofLongitude(sun);

        return new PanchangElements(
                sun,
                moon,
                elongation,
                tithiValue,
                tithiIndex,
                Tithi.ofIndex(tithiIndex),
                nakshatraIndex,
                Nakshatra.ofIndex(nakshatraIndex),
                Nakshatra.padaOf(moon),
                yogaIndex,
                Yoga.ofIndex(yogaIndex),
                karanaIndex,
                karanaCycle.at(karanaIndex),
                MoonPhase.ofElongation(elongation),
                MoonPhase.illumination(elongation),
                (tithiValue - tithiIndex) * 100.0,
                nakshatraCompletion,
                sunRashi,
                Rashi.ofLongitude(moon),
                Ritu.ofSunRashi(sunRashi));
    }
}
