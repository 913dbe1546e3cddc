package io.github.jakubt4.kaal.time;

import io.github.jakubt4.kaal.error.InvalidInstantException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Normalises UTC instants onto a uniform timescale by applying ΔT (TT − UT).
 *
 * <p>Inside the tabulated span ΔT is interpolated linearly between the
 * published values. Outside it the Morrison–Stephenson parabola
 * {@code -20 + 32u²} ({@code u} = centuries from 1820) is used, shifted so it
 * joins the first or last tabulated value without a jump. Years outside
 * [{@value #MIN_YEAR}, {@value #MAX_YEAR}] have no meaningful correction and
 * are rejected.
 */
@Component
public class TimeScale {

    public static final int MIN_YEAR = -2000;
    public static final int MAX_YEAR = 3000;

    // Espenak & Meeus, "Five Millennium Canon of Solar Eclipses", Table 1.1 (seconds)
    private static final double[] YEARS = {
            -500, -400, -300, -200, -100, 0, 100, 200, 300, 400, 500, 600, 700, 800, 900,
            1000, 1100, 1200, 1300, 1400, 1500, 1600, 1700, 1750, 1800, 1850, 1900, 1950,
            1955, 1960, 1965, 1970, 1975, 1980, 1985, 1990, 1995, 2000, 2005, 2010, 2015, 2020
    };
    private static final double[] DELTA_T = {
            17190, 15530, 14080, 12790, 11640, 10580, 9600, 8640, 7680, 6700, 5710, 4740, 3810, 2960, 2200,
            1570, 1090, 740, 490, 320, 200, 120, 9, 13, 14, 7, -3, 29,
            31.1, 33.2, 35.7, 40.2, 45.5, 50.5, 54.3, 56.9, 60.8, 63.8, 64.7, 66.1, 67.6, 69.4
    };

    /**
     * @throws InvalidInstantException if the instant lies outside the supported years
     */
    public TimePoint at(final Instant utc) {
        final var year = decimalYear(utc);
        if (year < MIN_YEAR || year >= MAX_YEAR + 1) {
            throw new InvalidInstantException("No ΔT correction defined for instant",
                    Map.of("instant", utc, "supportedYears", MIN_YEAR + ".." + MAX_YEAR));
        }
        return new TimePoint(utc, deltaT(year));
    }

    /**
     * ΔT in seconds for a decimal year.
     */
    public double deltaT(final double year) {
        final var last = YEARS.length - 1;
        if (year <= YEARS[0]) {
            return DELTA_T[0] + parabola(year) - parabola(YEARS[0]);
        }
        if (year >= YEARS[last]) {
            return DELTA_T[last] + parabola(year) - parabola(YEARS[last]);
        }
        var i = 0;
        while (YEARS[i + 1] < year) {
            i++;
        }
        final var fraction = (year - YEARS[i]) / (YEARS[i + 1] - YEARS[i]);
        return DELTA_T[i] + fraction * (DELTA_T[i + 1] - DELTA_T[i]);
    }

    static double decimalYear(final Instant utc) {
        final var date = utc.atOffset(ZoneOffset.UTC);
        final var daysInYear = date.toLocalDate().lengthOfYear();
        final var dayFraction = (date.getDayOfYear() - 1 + date.toLocalTime().toSecondOfDay() / 86_400.0)
                / daysInYear;
        return date.getYear() + dayFraction;
    }

    private static double parabola(final double year) {
        final var u = (year - 1820.0) / 100.0;
        return -20.0 + 32.0 * u * u;
    }
}
