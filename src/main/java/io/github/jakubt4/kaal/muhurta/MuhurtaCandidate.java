package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.model.TimeInterval;

import java.util.List;

/**
 * A scored window.
 *
 * @param score           0..100, zero whenever {@code excluded}
 * @param breakdown       per-factor contributions, empty for an excluded window
 * @param recommendations advice for the tier, empty for an excluded window and below Average
 * @param excluded        a hard exclusion applied
 */
public record MuhurtaCandidate(TimeInterval window,
                               int score,
                               QualityTier tier,
                               List<FactorScore> breakdown,
                               List<String> warnings,
                               List<String> recommendations,
                               String description,
                               boolean excluded) {

    public MuhurtaCandidate {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score out of range [0, 100]: " + score);
        }
        breakdown = List.copyOf(breakdown);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }
}
