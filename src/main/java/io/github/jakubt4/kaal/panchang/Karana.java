package io.github.jakubt4.kaal.panchang;

import java.util.Locale;

/**
 * The eleven karana names. Seven are movable and repeat through the month; four
 * are fixed to single slots around the new moon.
 */
public enum Karana {
    BAVA(false),
    BALAVA(false),
    KAULAVA(false),
    TAITILA(false),
    GARA(false),
    VANIJA(false),
    VISHTI(false),
    SHAKUNI(true),
    CHATUSHPADA(true),
    NAGA(true),
    KIMSTUGHNA(true);

    public static final int SLOTS = 60;

    private final boolean fixed;

    Karana(final boolean fixed) {
        this.fixed = fixed;
    }

    public boolean isFixed() {
        return fixed;
    }

    /**
     * Vishti is also called Bhadra, traditionally avoided for auspicious work.
     */
    public boolean isBhadra() {
        return this == VISHTI;
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}
