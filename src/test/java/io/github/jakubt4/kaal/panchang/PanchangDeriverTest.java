package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.KaalFixtures;
import io.github.jakubt4.kaal.SyntheticEphemerisProvider;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.ephemeris.AnalyticEphemerisProvider;
import io.github.jakubt4.kaal.error.NoRiseOrSetException;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.model.Rashi;
import io.github.jakubt4.kaal.model.Vara;
import io.github.jakubt4.kaal.time.TimePoint;
import io.github.jakubt4.kaal.time.TimeScale;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PanchangDeriverTest {

    private static final Location GREENWICH = Location.of(0.0, 0.0);
    private static final Duration SECOND = Duration.ofSeconds(1);

    private final TimeScale timeScale = new TimeScale();

    private static void assertNear(final Instant actual, final String expected) {
        assertThat(Duration.between(Instant.parse(expected), actual).abs()).isLessThanOrEqualTo(SECOND);
    }

    @Test
    void solarDayFollowsTheHorizonCrossings() {
        final var deriver = KaalFixtures.deriver(new SyntheticEphemerisProvider(280.0, 45.0), KaalFixtures.cache());

        final var day = deriver.solarDay(LocalDate.of(2024, 1, 1), GREENWICH);

        assertNear(day.sunrise(), "2024-01-01T06:00:00Z");
        assertNear(day.sunset(), "2024-01-01T18:00:00Z");
        assertNear(day.solarNoon(), "2024-01-01T12:00:00Z");
        assertThat(day.vara()).isEqualTo(Vara.MONDAY);
        assertNear(day.rahuKaal().start(), "2024-01-01T07:30:00Z");
        assertNear(day.rahuKaal().end(), "2024-01-01T09:00:00Z");
    }

    @Test
    void computeReturnsFullyPopulatedReport() {
        final var deriver = KaalFixtures.deriver(new SyntheticEphemerisProvider(280.0, 45.0), KaalFixtures.cache());
        final var time = timeScale.at(Instant.parse("2024-01-01T12:00:00Z"));

        final var report = deriver.compute(GREENWICH, time, AyanamshaSystem.LAHIRI);
        final var panchang = report.panchang();

        assertThat(panchang.localDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(panchang.vara()).isEqualTo(Vara.MONDAY);
        assertThat(panchang.elements().tithi()).isEqualTo(Tithi.SHUKLA_EKADASHI);
        assertThat(panchang.elements().elongation()).isCloseTo(125.0, within(1e-9));
        assertNear(panchang.moon().moonrise(), "2024-01-01T10:00:00Z");
        assertNear(panchang.moon().moonset(), "2024-01-01T22:00:00Z");
        assertThat(report.ayanamsha().system()).isEqualTo(AyanamshaSystem.LAHIRI);
        assertThat(report.grahas()).extracting(GrahaPosition::body).containsExactly(Body.SUN, Body.MOON);
        assertThat(report.grahas().get(0).siderealLongitude())
                .isCloseTo(280.0 - report.ayanamsha().degrees(), within(1e-9));
    }

    @Test
    void reportCarriesLocalTimesAndSeason() {
        final var deriver = KaalFixtures.deriver(new SyntheticEphemerisProvider(280.0, 45.0), KaalFixtures.cache());
        final var time = timeScale.at(Instant.parse("2024-01-01T12:00:00Z"));

        final var panchang = deriver.compute(GREENWICH, time, AyanamshaSystem.LAHIRI).panchang();

        assertThat(panchang.localMeanTime()).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 0));
        // GMST at 2024-01-01 12:00 UT is 18h42m35s
        assertThat(panchang.localSiderealHours()).isCloseTo(18.7097, within(1e-3));
        // sidereal Sun near 256°, in Dhanu
        assertThat(panchang.elements().sunRashi()).isEqualTo(Rashi.DHANU);
        assertThat(panchang.elements().ritu()).isEqualTo(Ritu.HEMANTA);
    }

    @Test
    void elementEndsFollowTheMeanMotions() {
        final var deriver = KaalFixtures.deriver(new SyntheticEphemerisProvider(280.0, 45.0), KaalFixtures.cache());
        final var noon = SyntheticEphemerisProvider.REFERENCE;

        final var report = deriver.compute(GREENWICH, timeScale.at(noon), AyanamshaSystem.LAHIRI);
        final var transitions = report.transitions();
        final var elongationRate = SyntheticEphemerisProvider.MOON_DEGREES_PER_DAY
                - SyntheticEphemerisProvider.SUN_DEGREES_PER_DAY;

        // elongation 125°: Ekadashi ends at 132°, the karana at 126°
        assertNearDays(transitions.tithiEnds(), noon, 7.0 / elongationRate);
        assertNearDays(transitions.karanaEnds(), noon, 1.0 / elongationRate);

        final var moon = report.grahas().get(1).siderealLongitude();
        final var nakshatraBoundary = (Math.floor(moon / Nakshatra.SPAN_DEGREES) + 1) * Nakshatra.SPAN_DEGREES;
        assertNearDays(transitions.nakshatraEnds(), noon,
                (nakshatraBoundary - moon) / SyntheticEphemerisProvider.MOON_DEGREES_PER_DAY);

        final var sum = report.grahas().get(0).siderealLongitude() + moon;
        final var yogaBoundary = (Math.floor(sum / Yoga.SPAN_DEGREES) + 1) * Yoga.SPAN_DEGREES;
        assertNearDays(transitions.yogaEnds(), noon, (yogaBoundary - sum)
                / (SyntheticEphemerisProvider.SUN_DEGREES_PER_DAY + SyntheticEphemerisProvider.MOON_DEGREES_PER_DAY));

        assertThat(transitions.tithiRemaining(noon)).isEqualTo(Duration.between(noon, transitions.tithiEnds()));
        assertThat(transitions.tithiRemaining(transitions.tithiEnds().plusSeconds(1))).isZero();
        assertThat(deriver.elementsAt(timeScale.at(transitions.tithiEnds().plusSeconds(60)), AyanamshaSystem.LAHIRI)
                .tithi()).isEqualTo(Tithi.SHUKLA_DWADASHI);
    }

    private static void assertNearDays(final Instant actual, final Instant from, final double days) {
        final var expected = from.plusMillis(Math.round(days * 86_400_000.0));
        assertThat(Duration.between(expected, actual).abs()).isLessThanOrEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void identicalRequestsAreServedFromCache() {
        final var deriver = KaalFixtures.deriver(new SyntheticEphemerisProvider(280.0, 45.0), KaalFixtures.cache());
        final var time = timeScale.at(Instant.parse("2024-01-01T12:00:00Z"));

        final var first = deriver.compute(GREENWICH, time, AyanamshaSystem.LAHIRI);
        final var second = deriver.compute(GREENWICH, time, AyanamshaSystem.LAHIRI);

        assertThat(second).isSameAs(first);
        assertThat(deriver.compute(GREENWICH, time, AyanamshaSystem.RAMAN)).isNotEqualTo(first);
    }

    @Test
    void deriveFromGivenLongitudes() {
        final var deriver = KaalFixtures.deriver(new SyntheticEphemerisProvider(0.0, 0.0), KaalFixtures.cache());
        final var time = timeScale.at(Instant.parse("2024-01-02T03:00:00Z"));

        final var result = deriver.derive(10.0, 10.0, time, GREENWICH);

        assertThat(result.elements().tithi()).isEqualTo(Tithi.SHUKLA_PRATIPADA);
        assertThat(result.elements().moonPhase()).isEqualTo(MoonPhase.NEW_MOON);
        assertThat(result.vara()).isEqualTo(Vara.TUESDAY);
        assertThat(result.solarDay().date()).isEqualTo(LocalDate.of(2024, 1, 2));
    }

    @Test
    void sunThatNeverRisesIsReported() {
        final var polarNight = new SyntheticEphemerisProvider(280.0, 45.0) {
            @Override
            public double altitude(final Body body, final TimePoint time, final Location location) {
                return -20.0;
            }
        };
        final var deriver = KaalFixtures.deriver(polarNight, KaalFixtures.cache());

        assertThatThrownBy(() -> deriver.solarDay(LocalDate.of(2024, 12, 21), Location.of(89.0, 0.0)))
                .isInstanceOf(NoRiseOrSetException.class)
                .satisfies(e -> assertThat(((NoRiseOrSetException) e).context()).containsEntry("body", Body.SUN));
    }

    @Test
    void delhiSummerSolsticeWithAnalyticEphemeris() {
        final var delhi = new Location(28.6139, 77.2090, 216.0);
        final var deriver = KaalFixtures.deriver(new AnalyticEphemerisProvider(), KaalFixtures.cache());

        final var day = deriver.solarDay(LocalDate.of(2024, 6, 21), delhi);

        // 05:24 and 19:22 IST
        assertThat(day.sunrise()).isBetween(Instant.parse("2024-06-20T23:44:00Z"), Instant.parse("2024-06-21T00:04:00Z"));
        assertThat(day.sunset()).isBetween(Instant.parse("2024-06-21T13:42:00Z"), Instant.parse("2024-06-21T14:02:00Z"));
        assertThat(day.dayLength()).isBetween(Duration.ofMinutes(13 * 60 + 40), Duration.ofMinutes(14 * 60 + 15));
        assertThat(day.vara()).isEqualTo(Vara.FRIDAY);

        final var elements = deriver.elementsAt(new TimeScale().at(Instant.parse("2024-06-21T06:30:00Z")),
                AyanamshaSystem.LAHIRI);
        assertThat(elements.sunRashi()).isEqualTo(Rashi.MITHUNA);
    }
}
