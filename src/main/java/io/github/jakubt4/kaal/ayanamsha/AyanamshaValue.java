package io.github.jakubt4.kaal.ayanamsha;

import io.github.jakubt4.kaal.time.TimePoint;

/**
 * Ayanamsha of one system at one instant.
 *
 * @param extrapolated true when the instant lies outside the system's validated
 *                     years and the value was extended linearly
 */
public record AyanamshaValue(AyanamshaSystem system, TimePoint time, double degrees, boolean extrapolated) {
}
