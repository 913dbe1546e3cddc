package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Rashi;

/**
 * The six seasons, two solar months each, counted from the Sun's entry into
 * Meena.
 */
public enum Ritu {
    VASANTA("Vasanta", "Spring"),
    GRISHMA("Grishma", "Summer"),
    VARSHA("Varsha", "Monsoon"),
    SHARAD("Sharad", "Autumn"),
    HEMANTA("Hemanta", "Pre-winter"),
    SHISHIRA("Shishira", "Winter");

    private static final Ritu[] VALUES = values();

    private final String displayName;
    private final String englishName;

    Ritu(final String displayName, final String englishName) {
        this.displayName = displayName;
        this.englishName = englishName;
    }

    public static Ritu ofSunRashi(final Rashi sunRashi) {
        return VALUES[Math.floorMod(sunRashi.ordinal() + 1, 12) / 2];
    }

    public String displayName() {
        return displayName;
    }

    public String englishName() {
        return englishName;
    }
}
