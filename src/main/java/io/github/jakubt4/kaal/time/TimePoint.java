package io.github.jakubt4.kaal.time;

import io.github.jakubt4.kaal.model.Angles;

import java.time.Instant;

/**
 * A UTC instant together with the ΔT correction that maps it onto Terrestrial
 * Time. Angles are always computed from {@link #julianDayTt()}; Earth rotation
 * (sidereal time, hour angles) uses {@link #julianDayUt()}.
 *
 * @param utc            the civil instant
 * @param deltaTSeconds  TT − UT in seconds
 */
public record TimePoint(Instant utc, double deltaTSeconds) {

    public static final double J2000 = 2451545.0;
    public static final double UNIX_EPOCH_JD = 2440587.5;
    public static final double SECONDS_PER_DAY = 86_400.0;
    public static final double DAYS_PER_CENTURY = 36_525.0;

    public double julianDayUt() {
        return julianDay(utc);
    }

    public double julianDayTt() {
        return julianDayUt() + deltaTSeconds / SECONDS_PER_DAY;
    }

    /**
     * Julian centuries of TT elapsed since J2000.0.
     */
    public double centuriesTt() {
        return (julianDayTt() - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * Greenwich mean sidereal time in degrees, [0, 360).
     */
    public double greenwichSiderealTime() {
        final var d = julianDayUt() - J2000;
        final var t = d / DAYS_PER_CENTURY;
        return Angles.normalize(280.46061837 + 360.98564736629 * d
                + 0.000387933 * t * t - t * t * t / 38_710_000.0);
    }

    /**
     * Local mean sidereal time at an east-positive longitude, in hours [0, 24).
     */
    public double localSiderealHours(final double longitude) {
        return Angles.normalize(greenwichSiderealTime() + longitude) / 15.0;
    }

    public static double julianDay(final Instant instant) {
        return UNIX_EPOCH_JD
                + instant.getEpochSecond() / SECONDS_PER_DAY
                + instant.getNano() / (SECONDS_PER_DAY * 1e9);
    }

    public static Instant fromJulianDay(final double julianDay) {
        final var seconds = (julianDay - UNIX_EPOCH_JD) * SECONDS_PER_DAY;
        final var whole = Math.floor(seconds);
        return Instant.ofEpochSecond((long) whole, Math.round((seconds - whole) * 1e9));
    }
}
