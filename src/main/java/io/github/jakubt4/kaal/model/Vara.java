package io.github.jakubt4.kaal.model;

import java.time.DayOfWeek;

/**
 * Weekday with its Sanskrit name and planetary lord. Declared Sunday first,
 * which is the order every weekday lookup table in the panchang uses.
 */
public enum Vara {
    SUNDAY("Ravivara", Body.SUN),
    MONDAY("Somavara", Body.MOON),
    TUESDAY("Mangalavara", Body.MARS),
    WEDNESDAY("Budhavara", Body.MERCURY),
    THURSDAY("Guruvara", Body.JUPITER),
    FRIDAY("Shukravara", Body.VENUS),
    SATURDAY("Shanivara", Body.SATURN);

    private final String sanskritName;
    private final Body lord;

    Vara(final String sanskritName, final Body lord) {
        this.sanskritName = sanskritName;
        this.lord = lord;
    }

    public static Vara of(final DayOfWeek dayOfWeek) {
        return values()[dayOfWeek.getValue() % 7];
    }

    public String sanskritName() {
        return sanskritName;
    }

    public Body lord() {
        return lord;
    }

    /**
     * Zero-based position with Sunday = 0.
     */
    public int sundayIndex() {
        return ordinal();
    }
}
