package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.Rashi;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlanetaryDignityTest {

    @Test
    void jupiterDignities() {
        assertThat(PlanetaryDignity.of(Body.JUPITER, Rashi.KARKA)).isEqualTo(PlanetaryDignity.EXALTED);
        assertThat(PlanetaryDignity.of(Body.JUPITER, Rashi.DHANU)).isEqualTo(PlanetaryDignity.OWN_SIGN);
        assertThat(PlanetaryDignity.of(Body.JUPITER, Rashi.MAKARA)).isEqualTo(PlanetaryDignity.DEBILITATED);
        assertThat(PlanetaryDignity.of(Body.JUPITER, Rashi.MESHA)).isEqualTo(PlanetaryDignity.NEUTRAL);
    }

    @Test
    void exaltationWinsOverOwnSign() {
        // Kanya is both own sign and exaltation of Mercury
        assertThat(PlanetaryDignity.of(Body.MERCURY, Rashi.KANYA)).isEqualTo(PlanetaryDignity.EXALTED);
        assertThat(PlanetaryDignity.of(Body.MERCURY, Rashi.MEENA)).isEqualTo(PlanetaryDignity.DEBILITATED);
    }

    @Test
    void nodesAreAlwaysNeutral() {
        for (final var rashi : Rashi.values()) {
            assertThat(PlanetaryDignity.of(Body.RAHU, rashi)).isEqualTo(PlanetaryDignity.NEUTRAL);
            assertThat(PlanetaryDignity.of(Body.KETU, rashi)).isEqualTo(PlanetaryDignity.NEUTRAL);
        }
    }

    @Test
    void favourability() {
        assertThat(PlanetaryDignity.EXALTED.favourability(0.5)).isEqualTo(1.0);
        assertThat(PlanetaryDignity.OWN_SIGN.favourability(0.5)).isEqualTo(1.0);
        assertThat(PlanetaryDignity.NEUTRAL.favourability(0.4)).isEqualTo(0.4);
        assertThat(PlanetaryDignity.DEBILITATED.favourability(0.5)).isZero();
    }
}
