package io.github.jakubt4.kaal.muhurta;

import java.util.Optional;

/**
 * Fixed score bands. Lower bounds are inclusive; every integer 0..100 falls into
 * exactly one tier.
 */
public enum QualityTier {
    EXCELLENT("Excellent", 80, "Excellent time for this activity - all factors are highly favorable"),
    VERY_GOOD("Very Good", 70, "Very auspicious timing with strong favorable factors"),
    GOOD("Good", 60, "Good timing for this activity with mostly favorable conditions"),
    AVERAGE("Average", 50, "Acceptable timing but consider waiting for better muhurta if possible"),
    POOR("Poor", 40, null),
    AVOID("Avoid", 0, null);

    static final String CHALLENGING =
            "This timing has significant challenges - strongly recommend finding alternative";

    private final String displayName;
    private final int minimumScore;
    private final String recommendation;

    QualityTier(final String displayName, final int minimumScore, final String recommendation) {
        this.displayName = displayName;
        this.minimumScore = minimumScore;
        this.recommendation = recommendation;
    }

    public static QualityTier of(final int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score out of range [0, 100]: " + score);
        }
        for (final var tier : values()) {
            if (score >= tier.minimumScore) {
                return tier;
            }
        }
        return AVOID;
    }

    public boolean isAtLeast(final QualityTier other) {
        return minimumScore >= other.minimumScore;
    }

    public int minimumScore() {
        return minimumScore;
    }

    /**
     * @return advice for a window of this tier, empty for Poor and Avoid
     */
    public Optional<String> recommendation() {
        return Optional.ofNullable(recommendation);
    }

    public String displayName() {
        return displayName;
    }
}
