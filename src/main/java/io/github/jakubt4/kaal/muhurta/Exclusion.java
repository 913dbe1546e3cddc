package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.panchang.Kaal;

/**
 * Conditions that disqualify a window outright, whatever its factor score.
 */
public enum Exclusion {
    RAHU_KAAL(Kaal.RAHU),
    GULIKA_KAAL(Kaal.GULIKA),
    YAMAGANDA_KAAL(Kaal.YAMAGANDA),
    /** Vishti karana in force at any point of the window. */
    BHADRA(null);

    private final Kaal kaal;

    Exclusion(final Kaal kaal) {
        this.kaal = kaal;
    }

    /**
     * @return the day period this exclusion refers to, {@code null} for Bhadra
     */
    public Kaal kaal() {
        return kaal;
    }
}
