package io.github.jakubt4.kaal.panchang;

import java.util.Locale;

/**
 * The 27 yogas, indexed by the sum of the sidereal Sun and Moon longitudes.
 */
public enum Yoga {
    VISHKAMBHA, PRITI, AYUSHMAN, SAUBHAGYA, SHOBHANA, ATIGANDA, SUKARMA, DHRITI, SHULA,
    GANDA, VRIDDHI, DHRUVA, VYAGHATA, HARSHANA, VAJRA, SIDDHI, VYATIPATA, VARIYAN,
    PARIGHA, SHIVA, SIDDHA, SADHYA, SHUBHA, SHUKLA, BRAHMA, INDRA, VAIDHRITI;

    public static final int COUNT = 27;
    public static final double SPAN_DEGREES = 360.0 / COUNT;

    private static final Yoga[] VALUES = values();

    public static Yoga ofIndex(final int index) {
        return VALUES[index];
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}
