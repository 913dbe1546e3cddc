package io.github.jakubt4.kaal.muhurta;

import java.util.Set;

/**
 * Favourable and unfavourable values of one factor. Values in neither set are
 * neutral.
 */
public record FactorPreference(Set<String> favourable, Set<String> unfavourable) {

    public static final FactorPreference NONE = new FactorPreference(Set.of(), Set.of());

    public FactorPreference {
        favourable = favourable == null ? Set.of() : Set.copyOf(favourable);
        unfavourable = unfavourable == null ? Set.of() : Set.copyOf(unfavourable);
    }

    /**
     * 1 for a favourable value, 0 for an unfavourable one, {@code neutral} otherwise.
     */
    public double favourability(final String value, final double neutral) {
        if (favourable.contains(value)) {
            return 1.0;
        }
        if (unfavourable.contains(value)) {
            return 0.0;
        }
        return neutral;
    }
}
