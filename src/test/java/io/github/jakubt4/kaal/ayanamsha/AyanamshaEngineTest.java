package io.github.jakubt4.kaal.ayanamsha;

import io.github.jakubt4.kaal.KaalFixtures;
import io.github.jakubt4.kaal.cache.CacheRegion;
import io.github.jakubt4.kaal.cache.ResultCache;
import io.github.jakubt4.kaal.error.UnknownAyanamshaSystemException;
import io.github.jakubt4.kaal.model.Angles;
import io.github.jakubt4.kaal.time.TimeScale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AyanamshaEngineTest {

    private static final List<Instant> INSTANTS = List.of(
            Instant.parse("1200-05-01T00:00:00Z"),
            Instant.parse("1900-01-01T00:00:00Z"),
            Instant.parse("2000-01-01T12:00:00Z"),
            Instant.parse("2024-03-15T06:30:00Z"),
            Instant.parse("2999-12-31T00:00:00Z"),
            Instant.parse("0500-07-01T00:00:00Z"));

    private final TimeScale timeScale = new TimeScale();
    private ResultCache cache;
    private AyanamshaEngine engine;

    @BeforeEach
    void setUp() {
        cache = KaalFixtures.cache();
        engine = KaalFixtures.ayanamshaEngine(cache);
    }

    @Test
    void lahiriAtJ2000EqualsBaseValue() {
        final var value = engine.ayanamsha(AyanamshaSystem.LAHIRI, timeScale.at(Instant.parse("2000-01-01T12:00:00Z")));

        assertThat(value.degrees()).isCloseTo(23.857, within(0.001));
        assertThat(value.extrapolated()).isFalse();
    }

    @Test
    void lahiriIn2024IsAboutTwentyFourPointTwoDegrees() {
        final var value = engine.ayanamsha(AyanamshaSystem.LAHIRI, timeScale.at(Instant.parse("2024-01-01T00:00:00Z")));

        assertThat(value.degrees()).isCloseTo(24.19, within(0.02));
    }

    @Test
    void siderealTropicalRoundTripForEverySystemAndInstant() {
        for (final var system : AyanamshaSystem.values()) {
            for (final var instant : INSTANTS) {
                final var time = timeScale.at(instant);
                for (var longitude = 0.0; longitude < 360.0; longitude += 17.3) {
                    final var back = engine.toTropical(engine.toSidereal(longitude, system, time), system, time);

                    assertThat(Angles.separation(back, longitude))
                            .as("%s at %s, L=%s", system, instant, longitude)
                            .isLessThan(1e-9);
                }
            }
        }
    }

    @Test
    void siderealLongitudeIsNormalised() {
        final var time = timeScale.at(Instant.parse("2024-03-15T00:00:00Z"));

        assertThat(engine.toSidereal(5.0, AyanamshaSystem.LAHIRI, time)).isBetween(340.0, 360.0);
        assertThat(engine.toSidereal(359.999, AyanamshaSystem.FAGAN_BRADLEY, time)).isBetween(0.0, 360.0);
    }

    @Test
    void valuesOutsideValidatedYearsAreFlaggedExtrapolated() {
        final var ancient = engine.ayanamsha(AyanamshaSystem.RAMAN, timeScale.at(Instant.parse("0500-07-01T00:00:00Z")));
        final var modern = engine.ayanamsha(AyanamshaSystem.RAMAN, timeScale.at(Instant.parse("1950-07-01T00:00:00Z")));

        assertThat(ancient.extrapolated()).isTrue();
        assertThat(modern.extrapolated()).isFalse();
        assertThat(ancient.degrees()).isLessThan(modern.degrees());
    }

    @Test
    void compareAllCoversEverySystem() {
        final var all = engine.compareAll(timeScale.at(Instant.parse("2024-03-15T00:00:00Z")));

        assertThat(all).hasSize(10).containsOnlyKeys(AyanamshaSystem.values());
        assertThat(all.values()).allSatisfy(v -> assertThat(v.degrees()).isBetween(20.0, 30.0));
    }

    @Test
    void differenceIsSignedOffset() {
        final var time = timeScale.at(Instant.parse("2024-03-15T00:00:00Z"));

        final var difference = engine.difference(AyanamshaSystem.FAGAN_BRADLEY, AyanamshaSystem.LAHIRI, time);

        assertThat(difference).isCloseTo(engine.ayanamsha(AyanamshaSystem.FAGAN_BRADLEY, time).degrees()
                - engine.ayanamsha(AyanamshaSystem.LAHIRI, time).degrees(), within(1e-12));
        assertThat(difference).isPositive();
    }

    @Test
    void historySamplesEveryStepYears() {
        final var history = engine.history(AyanamshaSystem.LAHIRI, 1900, 2000, 50);

        assertThat(history).hasSize(3);
        assertThat(history.get(0).degrees()).isLessThan(history.get(1).degrees());
        assertThat(history.get(1).degrees()).isLessThan(history.get(2).degrees());
        assertThatThrownBy(() -> engine.history(AyanamshaSystem.LAHIRI, 2000, 1900, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describeExposesReferenceConstants() {
        final var description = engine.describe(AyanamshaSystem.LAHIRI);

        assertThat(description.polynomial()).isTrue();
        assertThat(description.epochJd()).isEqualTo(2451545.0);
        assertThat(description.description()).contains("Chitrapaksha");
        assertThat(engine.describe(AyanamshaSystem.RAMAN).polynomial()).isFalse();
    }

    @Test
    void valuesAreCachedPerSystemAndInstant() {
        final var time = timeScale.at(Instant.parse("2024-03-15T00:00:00Z"));

        final var first = engine.ayanamsha(AyanamshaSystem.LAHIRI, time);
        final var second = engine.ayanamsha(AyanamshaSystem.LAHIRI, time);

        assertThat(second).isSameAs(first);
        assertThat(cache.size(CacheRegion.AYANAMSHA)).isEqualTo(1);
    }

    @Test
    void unknownTagIsRejected() {
        assertThatThrownBy(() -> AyanamshaSystem.fromTag("vedic-ish"))
                .isInstanceOf(UnknownAyanamshaSystemException.class)
                .hasMessageContaining("tag=vedic-ish");
        assertThat(AyanamshaSystem.fromTag("fagan-bradley")).isEqualTo(AyanamshaSystem.FAGAN_BRADLEY);
        assertThat(AyanamshaSystem.fromTag("Surya Siddhanta")).isEqualTo(AyanamshaSystem.SURYA_SIDDHANTA);
    }
}
