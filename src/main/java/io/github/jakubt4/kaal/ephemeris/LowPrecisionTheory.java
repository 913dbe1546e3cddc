package io.github.jakubt4.kaal.ephemeris;

import io.github.jakubt4.kaal.model.Angles;

import static io.github.jakubt4.kaal.model.Angles.cosDeg;
import static io.github.jakubt4.kaal.model.Angles.sinDeg;

/**
 * Truncated solar and lunar series from Meeus, <i>Astronomical Algorithms</i>
 * (chapters 22, 25 and 47). Accuracy is about 0.01° for the Sun and 0.05° for
 * the Moon over several centuries around J2000, which is well inside a minute
 * of tithi or rise/set time.
 *
 * <p>All inputs are Julian centuries of TT since J2000.0.
 */
final class LowPrecisionTheory {

    static final double EARTH_RADIUS_KM = 6378.14;

    // Lunar longitude and distance: D, M, M', F multipliers, Σl (1e-6 deg), Σr (1e-3 km)
    private static final int[][] LR_ARGS = {
            {0, 0, 1, 0}, {2, 0, -1, 0}, {2, 0, 0, 0}, {0, 0, 2, 0}, {0, 1, 0, 0},
            {0, 0, 0, 2}, {2, 0, -2, 0}, {2, -1, -1, 0}, {2, 0, 1, 0}, {2, -1, 0, 0},
            {0, 1, -1, 0}, {1, 0, 0, 0}, {0, 1, 1, 0}, {2, 0, 0, -2}, {0, 0, 1, 2},
            {0, 0, 1, -2}, {4, 0, -1, 0}, {0, 0, 3, 0}, {4, 0, -2, 0}, {2, 1, -1, 0},
            {2, 1, 0, 0}, {1, 0, -1, 0}, {1, 1, 0, 0}, {2, -1, 1, 0}, {2, 0, 2, 0}
    };
    private static final double[] L_COEFF = {
            6288774, 1274027, 658314, 213618, -185116,
            -114332, 58793, 57066, 53322, 45758,
            -40923, -34720, -30383, 15327, -12528,
            10980, 10675, 10034, 8548, -7888,
            -6766, -5163, 4987, 4036, 3994
    };
    private static final double[] R_COEFF = {
            -20905355, -3699111, -2955968, -569925, 48888,
            -3149, 246158, -152138, -170733, -204586,
            -129620, 108743, 104755, 10321, 0,
            79661, -34782, -23210, -21636, 24208,
            30824, -8379, -16675, -12831, -10445
    };

    // Lunar latitude: D, M, M', F multipliers, Σb (1e-6 deg)
    private static final int[][] B_ARGS = {
            {0, 0, 0, 1}, {0, 0, 1, 1}, {0, 0, 1, -1}, {2, 0, 0, -1}, {2, 0, -1, 1},
            {2, 0, -1, -1}, {2, 0, 0, 1}, {0, 0, 2, 1}, {2, 0, 1, -1}, {0, 0, 2, -1}
    };
    private static final double[] B_COEFF = {
            5128122, 280602, 277693, 173237, 55413,
            46271, 32573, 17198, 9266, 8822
    };

    private LowPrecisionTheory() {
    }

    /**
     * Apparent ecliptic longitude of the Sun, referred to the true equinox of date.
     */
    static double sunLongitude(final double t) {
        final var l0 = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        final var m = sunMeanAnomaly(t);
        final var c = (1.914602 - 0.004817 * t - 0.000014 * t * t) * sinDeg(m)
                + (0.019993 - 0.000101 * t) * sinDeg(2 * m)
                + 0.000289 * sinDeg(3 * m);
        final var omega = 125.04 - 1934.136 * t;
        return Angles.normalize(l0 + c - 0.00569 - 0.00478 * sinDeg(omega));
    }

    /**
     * Sun–Earth distance in kilometres.
     */
    static double sunDistanceKm(final double t) {
        final var m = sunMeanAnomaly(t);
        final var e = 0.016708634 - 0.000042037 * t - 0.0000001267 * t * t;
        final var c = (1.914602 - 0.004817 * t) * sinDeg(m) + 0.019993 * sinDeg(2 * m);
        final var au = 1.000001018 * (1 - e * e) / (1 + e * cosDeg(m + c));
        return au * 149_597_870.7;
    }

    static double moonLongitude(final double t) {
        final var args = lunarArguments(t);
        final var e = eccentricityFactor(t);
        var sum = 0.0;
        for (var i = 0; i < LR_ARGS.length; i++) {
            sum += L_COEFF[i] * eccentricityCorrection(LR_ARGS[i][1], e) * sinDeg(argument(LR_ARGS[i], args));
        }
        final var a1 = 119.75 + 131.849 * t;
        final var a2 = 53.09 + 479_264.290 * t;
        sum += 3958 * sinDeg(a1) + 1962 * sinDeg(args[0] - args[4]) + 318 * sinDeg(a2);
        final var omega = 125.04452 - 1934.136261 * t;
        final var nutation = -17.20 / 3600.0 * sinDeg(omega);
        return Angles.normalize(args[0] + sum / 1e6 + nutation);
    }

    static double moonLatitude(final double t) {
        final var args = lunarArguments(t);
        final var e = eccentricityFactor(t);
        var sum = 0.0;
        for (var i = 0; i < B_ARGS.length; i++) {
            sum += B_COEFF[i] * eccentricityCorrection(B_ARGS[i][1], e) * sinDeg(argument(B_ARGS[i], args));
        }
        sum += -2235 * sinDeg(args[0]) + 382 * sinDeg(313.45 + 481_266.484 * t)
                + 175 * sinDeg(119.75 + 131.849 * t - args[4])
                + 175 * sinDeg(119.75 + 131.849 * t + args[4]);
        return sum / 1e6;
    }

    static double moonDistanceKm(final double t) {
        final var args = lunarArguments(t);
        final var e = eccentricityFactor(t);
        var sum = 0.0;
        for (var i = 0; i < LR_ARGS.length; i++) {
            sum += R_COEFF[i] * eccentricityCorrection(LR_ARGS[i][1], e) * cosDeg(argument(LR_ARGS[i], args));
        }
        return 385_000.56 + sum / 1000.0;
    }

    /**
     * Mean obliquity of the ecliptic in degrees.
     */
    static double obliquity(final double t) {
        return 23.439291111 - 0.0130041667 * t - 1.64e-7 * t * t + 5.04e-7 * t * t * t;
    }

    /**
     * Ecliptic to equatorial conversion.
     *
     * @return {right ascension, declination} in degrees
     */
    static double[] toEquatorial(final double lambda, final double beta, final double epsilon) {
        final var ra = Math.toDegrees(Math.atan2(
                sinDeg(lambda) * cosDeg(epsilon) - Math.tan(Math.toRadians(beta)) * sinDeg(epsilon),
                cosDeg(lambda)));
        final var dec = Math.toDegrees(Math.asin(
                sinDeg(beta) * cosDeg(epsilon) + cosDeg(beta) * sinDeg(epsilon) * sinDeg(lambda)));
        return new double[]{Angles.normalize(ra), dec};
    }

    private static double sunMeanAnomaly(final double t) {
        return 357.52911 + 35999.05029 * t - 0.0001537 * t * t;
    }

    /**
     * @return {L', D, M, M', F} in degrees
     */
    private static double[] lunarArguments(final double t) {
        final var t2 = t * t;
        final var t3 = t2 * t;
        final var t4 = t3 * t;
        return new double[]{
                218.3164477 + 481_267.88123421 * t - 0.0015786 * t2 + t3 / 538_841 - t4 / 65_194_000,
                297.8501921 + 445_267.1114034 * t - 0.0018819 * t2 + t3 / 545_868 - t4 / 113_065_000,
                357.5291092 + 35_999.0502909 * t - 0.0001536 * t2 + t3 / 24_490_000,
                134.9633964 + 477_198.8675055 * t + 0.0087414 * t2 + t3 / 69_699 - t4 / 14_712_000,
                93.2720950 + 483_202.0175233 * t - 0.0036539 * t2 - t3 / 3_526_000 + t4 / 863_310_000
        };
    }

    private static double argument(final int[] multipliers, final double[] args) {
        return multipliers[0] * args[1] + multipliers[1] * args[2] + multipliers[2] * args[3] + multipliers[3] * args[4];
    }

    private static double eccentricityFactor(final double t) {
        return 1 - 0.002516 * t - 0.0000074 * t * t;
    }

    private static double eccentricityCorrection(final int sunAnomalyMultiplier, final double e) {
        return switch (Math.abs(sunAnomalyMultiplier)) {
            case 1 -> e;
            case 2 -> e * e;
            default -> 1.0;
        };
    }
}
