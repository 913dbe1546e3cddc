package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Angles;

/**
 * Eight named lunar phases, each a 45° sector of Sun–Moon elongation starting
 * at 0°: New Moon covers [0°, 45°), Full Moon [180°, 225°).
 */
public enum MoonPhase {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private static final MoonPhase[] VALUES = values();
    private static final double SECTOR = 45.0;

    private final String displayName;

    MoonPhase(final String displayName) {
        this.displayName = displayName;
    }

    public static MoonPhase ofElongation(final double elongationDegrees) {
        final var sector = (int) Math.floor(Angles.normalize(elongationDegrees) / SECTOR);
        return VALUES[Math.min(sector, VALUES.length - 1)];
    }

    /**
     * Illuminated fraction of the disc in percent: {@code (1 - cos e) / 2 * 100}.
     */
    public static double illumination(final double elongationDegrees) {
        return (1.0 - Angles.cosDeg(elongationDegrees)) / 2.0 * 100.0;
    }

    public String displayName() {
        return displayName;
    }
}
