package io.github.jakubt4.kaal.muhurta;

/**
 * One line of a candidate's breakdown.
 *
 * @param value         the factor's value at the window start, e.g. {@code "11"} or {@code "ROHINI"}
 * @param favourability 0, 1 or the rule's neutral value, less the Ganda Moola penalty for the nakshatra;
 *                      a mean for planetary strength
 */
public record FactorScore(Factor factor, String value, double weight, double favourability, Effect effect) {

    public enum Effect {
        HELPED,
        HURT,
        NEUTRAL
    }

    static FactorScore of(final Factor factor, final String value, final double weight,
                          final double favourability, final double neutral) {
        final Effect effect;
        if (favourability > neutral) {
            effect = Effect.HELPED;
        } else if (favourability < neutral) {
            effect = Effect.HURT;
        } else {
            effect = Effect.NEUTRAL;
        }
        return new FactorScore(factor, value, weight, favourability, effect);
    }
}
