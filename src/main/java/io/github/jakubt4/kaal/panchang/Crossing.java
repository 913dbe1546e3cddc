package io.github.jakubt4.kaal.panchang;

/**
 * Direction of a horizon crossing.
 */
public enum Crossing {
    /** Altitude passes the threshold going up. */
    RISE,
    /** Altitude passes the threshold going down. */
    SET;

    boolean matches(final double before, final double after) {
        return this == RISE ? before < 0.0 && after >= 0.0 : before >= 0.0 && after < 0.0;
    }
}
