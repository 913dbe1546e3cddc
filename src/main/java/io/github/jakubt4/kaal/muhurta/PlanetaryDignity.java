package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.Rashi;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Sign-based strength of a graha. Exaltation takes precedence over own sign;
 * the nodes are always neutral.
 */
public enum PlanetaryDignity {
    EXALTED,
    OWN_SIGN,
    NEUTRAL,
    DEBILITATED;

    private static final Map<Body, Rashi> EXALTATION = new EnumMap<>(Map.of(
            Body.SUN, Rashi.MESHA,
            Body.MOON, Rashi.VRISHABHA,
            Body.MARS, Rashi.MAKARA,
            Body.MERCURY, Rashi.KANYA,
            Body.JUPITER, Rashi.KARKA,
            Body.VENUS, Rashi.MEENA,
            Body.SATURN, Rashi.TULA));

    private static final Map<Body, Set<Rashi>> OWN = new EnumMap<>(Map.of(
            Body.SUN, EnumSet.of(Rashi.SIMHA),
            Body.MOON, EnumSet.of(Rashi.KARKA),
            Body.MARS, EnumSet.of(Rashi.MESHA, Rashi.VRISHCHIKA),
            Body.MERCURY, EnumSet.of(Rashi.MITHUNA, Rashi.KANYA),
            Body.JUPITER, EnumSet.of(Rashi.DHANU, Rashi.MEENA),
            Body.VENUS, EnumSet.of(Rashi.VRISHABHA, Rashi.TULA),
            Body.SATURN, EnumSet.of(Rashi.MAKARA, Rashi.KUMBHA)));

    public static PlanetaryDignity of(final Body body, final Rashi rashi) {
        final var exaltation = EXALTATION.get(body);
        if (exaltation == null) {
            return NEUTRAL;
        }
        if (exaltation == rashi) {
            return EXALTED;
        }
        if (OWN.get(body).contains(rashi)) {
            return OWN_SIGN;
        }
        // debilitation is the sign opposite exaltation
        if (Rashi.values()[(exaltation.ordinal() + 6) % 12] == rashi) {
            return DEBILITATED;
        }
        return NEUTRAL;
    }

    /**
     * Favourability contribution: strong placements count fully, debilitation
     * not at all.
     */
    public double favourability(final double neutral) {
        return switch (this) {
            case EXALTED, OWN_SIGN -> 1.0;
            case DEBILITATED -> 0.0;
            case NEUTRAL -> neutral;
        };
    }
}
