package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Body;

/**
 * The 27 lunar mansions of 13°20' each, with their Vimshottari lords.
 */
public enum Nakshatra {
    ASHWINI("Ashwini"),
    BHARANI("Bharani"),
    KRITTIKA("Krittika"),
    ROHINI("Rohini"),
    MRIGASHIRA("Mrigashira"),
    ARDRA("Ardra"),
    PUNARVASU("Punarvasu"),
    PUSHYA("Pushya"),
    ASHLESHA("Ashlesha"),
    MAGHA("Magha"),
    PURVA_PHALGUNI("Purva Phalguni"),
    UTTARA_PHALGUNI("Uttara Phalguni"),
    HASTA("Hasta"),
    CHITRA("Chitra"),
    SWATI("Swati"),
    VISHAKHA("Vishakha"),
    ANURADHA("Anuradha"),
    JYESHTHA("Jyeshtha"),
    MOOLA("Moola"),
    PURVA_ASHADHA("Purva Ashadha"),
    UTTARA_ASHADHA("Uttara Ashadha"),
    SHRAVANA("Shravana"),
    DHANISHTA("Dhanishta"),
    SHATABHISHA("Shatabhisha"),
    PURVA_BHADRAPADA("Purva Bhadrapada"),
    UTTARA_BHADRAPADA("Uttara Bhadrapada"),
    REVATI("Revati");

    public static final int COUNT = 27;
    public static final double SPAN_DEGREES = 360.0 / COUNT;
    public static final double PADA_DEGREES = SPAN_DEGREES / 4.0;

    private static final Nakshatra[] VALUES = values();
    private static final Body[] LORDS = {
            Body.KETU, Body.VENUS, Body.SUN, Body.MOON, Body.MARS,
            Body.RAHU, Body.JUPITER, Body.SATURN, Body.MERCURY
    };

    private final String displayName;

    Nakshatra(final String displayName) {
        this.displayName = displayName;
    }

    public static Nakshatra ofIndex(final int index) {
        return VALUES[index];
    }

    public static int indexOf(final double siderealDegrees) {
        return Math.min((int) Math.floor(siderealDegrees / SPAN_DEGREES), COUNT - 1);
    }

    /**
     * Quarter of the mansion, 1..4.
     */
    public static int padaOf(final double siderealDegrees) {
        final var within = siderealDegrees - indexOf(siderealDegrees) * SPAN_DEGREES;
        return Math.max(1, Math.min(4, (int) Math.floor(within / PADA_DEGREES) + 1));
    }

    /**
     * Ganda Moola: the nakshatras at the junctions of the water and fire signs.
     */
    public boolean isGandaMoola() {
        return this == ASHWINI || this == ASHLESHA || this == MAGHA
                || this == JYESHTHA || this == MOOLA || this == REVATI;
    }

    public Body lord() {
        return LORDS[ordinal() % LORDS.length];
    }

    public String displayName() {
        return displayName;
    }
}
