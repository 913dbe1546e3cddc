package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.ayanamsha.AyanamshaValue;

import java.util.List;

/**
 * A {@link PanchangResult} together with the frame it was computed in: the
 * ayanamsha applied and the sidereal position of every graha the ephemeris
 * provider supplies. {@code transitions} holds when each lunar element in force
 * ends.
 */
public record PanchangReport(PanchangResult panchang,
                             AyanamshaValue ayanamsha,
                             List<GrahaPosition> grahas,
                             ElementTransitions transitions) {
}
