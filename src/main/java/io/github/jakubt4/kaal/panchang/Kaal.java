package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Vara;

/**
 * Inauspicious eighth-of-the-day periods. Each weekday selects one of the eight
 * equal daytime segments; the tables are Sunday first and 1-based.
 */
public enum Kaal {
    RAHU("Rahu Kaal", new int[]{8, 2, 7, 5, 6, 4, 3}),
    GULIKA("Gulika Kaal", new int[]{7, 6, 5, 4, 3, 2, 1}),
    YAMAGANDA("Yamaganda Kaal", new int[]{5, 4, 3, 2, 1, 7, 6});

    private final String displayName;
    private final int[] segmentByWeekday;

    Kaal(final String displayName, final int[] segmentByWeekday) {
        this.displayName = displayName;
        this.segmentByWeekday = segmentByWeekday;
    }

    /**
     * 1-based segment of the day, 1..8.
     */
    public int segment(final Vara vara) {
        return segmentByWeekday[vara.sundayIndex()];
    }

    public String displayName() {
        return displayName;
    }
}
