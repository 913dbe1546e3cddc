package io.github.jakubt4.kaal.ayanamsha;

/**
 * Human-facing summary of one system's reference constants.
 */
public record AyanamshaDescription(AyanamshaSystem system,
                                   String description,
                                   double epochJd,
                                   double baseDegrees,
                                   double rateArcsecPerYear,
                                   boolean polynomial,
                                   int validFromYear,
                                   int validToYear) {
}
