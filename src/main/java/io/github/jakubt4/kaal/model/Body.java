package io.github.jakubt4.kaal.model;

/**
 * The nine grahas. Rahu and Ketu are the lunar nodes rather than physical bodies.
 */
public enum Body {
    SUN("Surya"),
    MOON("Chandra"),
    MARS("Mangala"),
    MERCURY("Budha"),
    JUPITER("Guru"),
    VENUS("Shukra"),
    SATURN("Shani"),
    RAHU("Rahu"),
    KETU("Ketu");

    private final String sanskritName;

    Body(final String sanskritName) {
        this.sanskritName = sanskritName;
    }

    public String sanskritName() {
        return sanskritName;
    }

    public boolean isNode() {
        return this == RAHU || this == KETU;
    }
}
