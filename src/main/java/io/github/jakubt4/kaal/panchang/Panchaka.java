package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Vara;

import java.util.Optional;

/**
 * The five-nakshatra stretch from Dhanishta to Revati. Its kind rotates with the
 * nakshatra and the weekday.
 */
public enum Panchaka {
    AGNI("Agni Panchaka", "Fire element dominance, avoid fire-related activities"),
    RAJA("Raja Panchaka", "Royal element, good for leadership activities"),
    MRITYU("Mrityu Panchaka", "Death element, avoid new beginnings"),
    CHOR("Chor Panchaka", "Theft element, be cautious with valuables"),
    ROGA("Roga Panchaka", "Disease element, focus on health");

    private static final Panchaka[] VALUES = values();

    private final String displayName;
    private final String description;

    Panchaka(final String displayName, final String description) {
        this.displayName = displayName;
        this.description = description;
    }

    /**
     * @return the Panchaka in force, empty outside Dhanishta..Revati
     */
    public static Optional<Panchaka> of(final Nakshatra nakshatra, final Vara vara) {
        final var offset = nakshatra.ordinal() - Nakshatra.DHANISHTA.ordinal();
        if (offset < 0) {
            return Optional.empty();
        }
        // weekday counted from Monday
        final var weekday = (vara.ordinal() + 6) % 7;
        return Optional.of(VALUES[(offset + weekday) % VALUES.length]);
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }
}
