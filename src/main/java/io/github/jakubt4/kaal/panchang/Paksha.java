package io.github.jakubt4.kaal.panchang;

/**
 * Lunar fortnight: waxing (bright) or waning (dark) half of the month.
 */
public enum Paksha {
    SHUKLA,
    KRISHNA
}
