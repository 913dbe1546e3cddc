package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.model.Body;

import java.util.Map;
import java.util.Set;

/**
 * Scoring rule of one event type. Immutable once built by {@link MuhurtaRuleSet}.
 *
 * @param weights               relative weight per factor, every factor present
 * @param preferences           value sets per factor, absent factors are neutral throughout
 * @param exclusions            conditions forcing a zero score
 * @param keyPlanets            grahas whose dignity feeds {@link Factor#PLANETARY_STRENGTH}
 * @param neutralFavourability  favourability of a value in neither set, [0, 1]
 * @param gandaMoolaPenalty     subtracted from the nakshatra favourability while the Moon is in a
 *                              junction nakshatra, [0, 1]
 */
public record MuhurtaRule(EventType eventType,
                          Map<Factor, Double> weights,
                          Map<Factor, FactorPreference> preferences,
                          Set<Exclusion> exclusions,
                          Set<Body> keyPlanets,
                          double neutralFavourability,
                          double gandaMoolaPenalty) {

    public MuhurtaRule {
        weights = Map.copyOf(weights);
        preferences = Map.copyOf(preferences);
        exclusions = Set.copyOf(exclusions);
        keyPlanets = Set.copyOf(keyPlanets);
    }

    public double weight(final Factor factor) {
        return weights.getOrDefault(factor, 0.0);
    }

    public double totalWeight() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public FactorPreference preference(final Factor factor) {
        return preferences.getOrDefault(factor, FactorPreference.NONE);
    }

    public boolean excludes(final Exclusion exclusion) {
        return exclusions.contains(exclusion);
    }
}
