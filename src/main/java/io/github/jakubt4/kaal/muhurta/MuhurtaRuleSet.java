package io.github.jakubt4.kaal.muhurta;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.kaal.model.Body;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The versioned table of muhurta rules, one per {@link EventType}.
 *
 * <p>The JSON document holds shared defaults and per-event overrides. An
 * override replaces the default entry for each factor it names; exclusions, key
 * planets and the Ganda Moola penalty, when given, replace the defaults
 * entirely. Every value is checked against its factor's vocabulary while
 * loading, so a typo fails start-up instead of silently scoring as neutral.
 */
@Slf4j
public final class MuhurtaRuleSet {

    public static final String DEFAULT_RESOURCE = "muhurta/rules.json";

    private final String version;
    private final Map<EventType, MuhurtaRule> rules;

    private MuhurtaRuleSet(final String version, final Map<EventType, MuhurtaRule> rules) {
        this.version = version;
        this.rules = Collections.unmodifiableMap(rules);
    }

    record Document(String version,
                    Double neutralFavourability,
                    RuleDocument defaults,
                    Map<EventType, RuleDocument> events) {
    }

    record RuleDocument(Map<Factor, Double> weights,
                        Map<Factor, PreferenceDocument> preferences,
                        Set<Exclusion> exclusions,
                        Set<Body> keyPlanets,
                        Double gandaMoolaPenalty) {
    }

    record PreferenceDocument(Set<String> favourable, Set<String> unfavourable) {
    }

    public static MuhurtaRuleSet load(final ObjectMapper objectMapper, final String resource) {
        final var url = MuhurtaRuleSet.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalStateException(resource + " not found on classpath");
        }
        try (var in = url.openStream()) {
            return of(objectMapper.readValue(in, Document.class));
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read muhurta rules from " + resource, e);
        }
    }

    static MuhurtaRuleSet of(final Document document) {
        if (document.version() == null || document.version().isBlank()) {
            throw new IllegalStateException("Muhurta rule set has no version");
        }
        final var neutral = document.neutralFavourability() == null ? 0.5 : document.neutralFavourability();
        if (neutral < 0.0 || neutral > 1.0) {
            throw new IllegalStateException("neutralFavourability out of [0, 1]: " + neutral);
        }
        final var defaults = document.defaults() == null
                ? new RuleDocument(null, null, null, null, null)
                : document.defaults();
        final var events = document.events() == null ? Map.<EventType, RuleDocument>of() : document.events();

        final var rules = new EnumMap<EventType, MuhurtaRule>(EventType.class);
        for (final var type : EventType.values()) {
            rules.put(type, merge(type, defaults, events.get(type), neutral));
        }
        log.info("Muhurta rules loaded — version={}, events={}, neutral={}", document.version(), rules.size(), neutral);
        return new MuhurtaRuleSet(document.version(), rules);
    }

    public MuhurtaRule rule(final EventType eventType) {
        return rules.get(eventType);
    }

    public String version() {
        return version;
    }

    private static MuhurtaRule merge(final EventType type, final RuleDocument defaults, final RuleDocument override,
                                     final double neutral) {
        final var weights = new EnumMap<Factor, Double>(Factor.class);
        putAll(weights, defaults.weights());
        final var preferences = new EnumMap<Factor, FactorPreference>(Factor.class);
        putPreferences(preferences, defaults.preferences());
        var exclusions = orEmpty(defaults.exclusions());
        var keyPlanets = orEmpty(defaults.keyPlanets());
        var gandaMoolaPenalty = defaults.gandaMoolaPenalty() == null ? 0.0 : defaults.gandaMoolaPenalty();

        if (override != null) {
            putAll(weights, override.weights());
            putPreferences(preferences, override.preferences());
            if (override.exclusions() != null) {
                exclusions = override.exclusions();
            }
            if (override.keyPlanets() != null) {
                keyPlanets = override.keyPlanets();
            }
            if (override.gandaMoolaPenalty() != null) {
                gandaMoolaPenalty = override.gandaMoolaPenalty();
            }
        }

        validate(type, weights, preferences);
        if (gandaMoolaPenalty < 0.0 || gandaMoolaPenalty > 1.0) {
            throw new IllegalStateException(type + ": gandaMoolaPenalty out of [0, 1]: " + gandaMoolaPenalty);
        }
        return new MuhurtaRule(type, weights, preferences, exclusions, keyPlanets, neutral, gandaMoolaPenalty);
    }

    private static void validate(final EventType type, final Map<Factor, Double> weights,
                                 final Map<Factor, FactorPreference> preferences) {
        var total = 0.0;
        for (final var factor : Factor.values()) {
            final var weight = weights.get(factor);
            if (weight == null || !Double.isFinite(weight) || weight < 0.0) {
                throw new IllegalStateException(type + ": missing or invalid weight for " + factor);
            }
            total += weight;
        }
        if (total <= 0.0) {
            throw new IllegalStateException(type + ": factor weights sum to zero");
        }
        preferences.forEach((factor, preference) -> {
            final var unknown = new HashSet<String>(preference.favourable());
            unknown.addAll(preference.unfavourable());
            unknown.removeAll(factor.vocabulary());
            if (!unknown.isEmpty()) {
                throw new IllegalStateException(type + ": unknown " + factor + " values " + unknown);
            }
            final var both = new HashSet<String>(preference.favourable());
            both.retainAll(preference.unfavourable());
            if (!both.isEmpty()) {
                throw new IllegalStateException(type + ": " + factor + " values both favourable and unfavourable "
                        + both);
            }
        });
    }

    private static void putAll(final Map<Factor, Double> target, final Map<Factor, Double> source) {
        if (source != null) {
            target.putAll(source);
        }
    }

    private static void putPreferences(final Map<Factor, FactorPreference> target,
                                       final Map<Factor, PreferenceDocument> source) {
        if (source != null) {
            source.forEach((factor, doc) -> target.put(factor, new FactorPreference(doc.favourable(),
                    doc.unfavourable())));
        }
    }

    private static <T> Set<T> orEmpty(final Set<T> set) {
        return set == null ? Set.of() : set;
    }
}
