package io.github.jakubt4.kaal.ayanamsha;

import io.github.jakubt4.kaal.time.TimePoint;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Reference constants of one ayanamsha system:
 * <pre>
 *   ayanamsha(y) = base + (rate·y + quadratic·T² + cubic·T³) / 3600
 * </pre>
 * with {@code y} Julian years and {@code T} Julian centuries of TT since the
 * reference epoch. Outside the validated years the value continues along the
 * tangent at the nearest boundary.
 *
 * @param epochJd                    reference epoch, Julian day TT
 * @param baseDegrees                ayanamsha at the epoch
 * @param rateArcsecPerYear          linear precession rate
 * @param quadraticArcsecPerCentury2 second-order term, zero for linear systems
 * @param cubicArcsecPerCentury3     third-order term, zero for linear systems
 * @param validFromYear              first validated calendar year
 * @param validToYear                last validated calendar year
 */
public record AyanamshaModel(double epochJd,
                             double baseDegrees,
                             double rateArcsecPerYear,
                             double quadraticArcsecPerCentury2,
                             double cubicArcsecPerCentury3,
                             int validFromYear,
                             int validToYear) {

    private static final double DAYS_PER_YEAR = 365.25;

    public AyanamshaModel {
        if (validToYear < validFromYear) {
            throw new IllegalArgumentException("validToYear " + validToYear + " precedes validFromYear " + validFromYear);
        }
    }

    public boolean isPolynomial() {
        return quadraticArcsecPerCentury2 != 0.0 || cubicArcsecPerCentury3 != 0.0;
    }

    /**
     * @return {degrees, 1 if extrapolated else 0}
     */
    double[] evaluate(final double julianDayTt) {
        final var from = yearsFromEpoch(boundary(validFromYear));
        final var to = yearsFromEpoch(boundary(validToYear + 1));
        final var years = (julianDayTt - epochJd) / DAYS_PER_YEAR;
        if (years < from) {
            return new double[]{value(from) + slope(from) * (years - from), 1.0};
        }
        if (years > to) {
            return new double[]{value(to) + slope(to) * (years - to), 1.0};
        }
        return new double[]{value(years), 0.0};
    }

    private double value(final double years) {
        final var t = years / 100.0;
        return baseDegrees
                + (rateArcsecPerYear * years
                + quadraticArcsecPerCentury2 * t * t
                + cubicArcsecPerCentury3 * t * t * t) / 3600.0;
    }

    private double slope(final double years) {
        final var t = years / 100.0;
        return (rateArcsecPerYear
                + 2.0 * quadraticArcsecPerCentury2 * t / 100.0
                + 3.0 * cubicArcsecPerCentury3 * t * t / 100.0) / 3600.0;
    }

    private double yearsFromEpoch(final double julianDay) {
        return (julianDay - epochJd) / DAYS_PER_YEAR;
    }

    private static double boundary(final int year) {
        return TimePoint.julianDay(LocalDate.of(year, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC));
    }
}
