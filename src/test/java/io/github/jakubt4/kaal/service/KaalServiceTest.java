package io.github.jakubt4.kaal.service;

import io.github.jakubt4.kaal.KaalFixtures;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.cache.ResultCache;
import io.github.jakubt4.kaal.ephemeris.AnalyticEphemerisProvider;
import io.github.jakubt4.kaal.error.ErrorKind;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.muhurta.EventType;
import io.github.jakubt4.kaal.muhurta.MuhurtaQuery;
import io.github.jakubt4.kaal.muhurta.MuhurtaRuleSet;
import io.github.jakubt4.kaal.muhurta.MuhurtaScorer;
import io.github.jakubt4.kaal.muhurta.MuhurtaSearchResult;
import io.github.jakubt4.kaal.panchang.PanchangDeriver;
import io.github.jakubt4.kaal.time.TimeScale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KaalServiceTest {

    private static final Location DELHI = new Location(28.6139, 77.2090, 216.0);
    private static final Instant NOON_IST = Instant.parse("2024-03-20T06:30:00Z");

    private ExecutorService executor;
    private ResultCache cache;
    private MuhurtaRuleSet ruleSet;
    private KaalService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        cache = KaalFixtures.cache();
        ruleSet = KaalFixtures.ruleSet();
        final var deriver = KaalFixtures.deriver(new AnalyticEphemerisProvider(), cache);
        final var scorer = new MuhurtaScorer(deriver, new TimeScale(), ruleSet, executor,
                Duration.ofMinutes(15), Duration.ofHours(1), 5);
        service = new KaalService(new TimeScale(), KaalFixtures.ayanamshaEngine(cache), deriver, ruleSet, scorer,
                cache);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        cache.close();
    }

    private static ErrorKind kindOf(final Calculation<?> calculation) {
        assertThat(calculation).isInstanceOf(Calculation.Failure.class);
        return ((Calculation.Failure<?>) calculation).kind();
    }

    @Test
    void panchangForDelhi() {
        final var report = service.computePanchang(DELHI, NOON_IST, AyanamshaSystem.LAHIRI).orElseThrow();

        assertThat(report.panchang().solarDay().sunrise()).isBefore(NOON_IST);
        assertThat(report.panchang().solarDay().sunset()).isAfter(NOON_IST);
        assertThat(report.ayanamsha().degrees()).isBetween(24.0, 24.4);
        assertThat(report.grahas()).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    void identicalInputsGiveEqualResults() {
        final var first = service.computePanchang(DELHI, NOON_IST, AyanamshaSystem.LAHIRI);
        cache.close();
        final var second = service.computePanchang(DELHI, NOON_IST, AyanamshaSystem.LAHIRI);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void invalidCoordinateIsAFailure() {
        assertThat(kindOf(service.computePanchang(91.0, 0.0, 0.0, NOON_IST, "lahiri")))
                .isEqualTo(ErrorKind.INVALID_COORDINATE);
    }

    @Test
    void unknownAyanamshaSystemIsAFailure() {
        final var failure = service.computePanchang(28.6, 77.2, 0.0, NOON_IST, "galactic-centre");

        assertThat(kindOf(failure)).isEqualTo(ErrorKind.UNKNOWN_AYANAMSHA_SYSTEM);
        assertThat(kindOf(service.describeAyanamsha("nope"))).isEqualTo(ErrorKind.UNKNOWN_AYANAMSHA_SYSTEM);
    }

    @Test
    void instantOutsideSupportedYearsIsAFailure() {
        assertThat(kindOf(service.computePanchang(DELHI, Instant.parse("5000-01-01T00:00:00Z"),
                AyanamshaSystem.LAHIRI))).isEqualTo(ErrorKind.INVALID_INSTANT);
    }

    @Test
    void polarNightIsAFailureWithContext() {
        final var failure = service.computePanchang(new Location(89.0, 0.0, 0.0),
                Instant.parse("2024-12-21T12:00:00Z"), AyanamshaSystem.LAHIRI);

        assertThat(kindOf(failure)).isEqualTo(ErrorKind.NO_RISE_OR_SET);
        assertThat(((Calculation.Failure<?>) failure).context()).containsKeys("body", "date", "location");
    }

    @Test
    void unknownEventTypeIsAFailure() {
        final var query = MuhurtaQuery.builder()
                .location(DELHI).start(NOON_IST).end(NOON_IST.plus(Duration.ofHours(2))).step(Duration.ofHours(1))
                .build();

        assertThat(kindOf(service.findMuhurta("picnic", query))).isEqualTo(ErrorKind.UNKNOWN_EVENT_TYPE);
    }

    @Test
    void emptySearchWindowIsAFailure() {
        final var query = MuhurtaQuery.builder()
                .location(DELHI).start(NOON_IST).end(NOON_IST).step(Duration.ofHours(1))
                .build();

        assertThat(kindOf(service.findMuhurta(EventType.TRAVEL, query))).isEqualTo(ErrorKind.EMPTY_SEARCH_WINDOW);
    }

    @Test
    void negativeWindowDurationIsAFailure() {
        final var query = MuhurtaQuery.builder()
                .location(DELHI).start(NOON_IST).end(NOON_IST.plus(Duration.ofHours(2))).step(Duration.ofHours(1))
                .windowDuration(Duration.ofMinutes(-30))
                .build();

        final var failure = service.findMuhurta(EventType.TRAVEL, query);

        assertThat(kindOf(failure)).isEqualTo(ErrorKind.EMPTY_SEARCH_WINDOW);
        assertThat(((Calculation.Failure<?>) failure).context()).containsKey("windowDuration");
    }

    @Test
    void muhurtaSearchByTag() {
        final var query = MuhurtaQuery.builder()
                .location(DELHI).start(NOON_IST).end(NOON_IST.plus(Duration.ofHours(3))).step(Duration.ofHours(1))
                .build();

        final var result = service.findMuhurta("business", query).orElseThrow();

        assertThat(result.eventType()).isEqualTo(EventType.BUSINESS);
        assertThat(result.samplesEvaluated()).isEqualTo(3);
        assertThat(result.candidates()).hasSize(3);
        assertThat(result.ruleSetVersion()).isEqualTo(ruleSet.version());
        assertThat(service.bestMuhurta(EventType.BUSINESS, query).orElseThrow())
                .contains(result.candidates().get(0));
    }

    @Test
    void compareAndHistory() {
        assertThat(service.compareAyanamsha(NOON_IST).orElseThrow()).hasSize(AyanamshaSystem.values().length);
        assertThat(service.ayanamsha("krishnamurti", NOON_IST).isSuccess()).isTrue();
        assertThat(service.ayanamshaHistory(AyanamshaSystem.LAHIRI, 2000, 2010, 5).orElseThrow()).hasSize(3);
    }

    @Test
    void unbudgetedSearchesAreCachedBudgetedOnesAreNot() {
        final var scorer = mock(MuhurtaScorer.class);
        final var result = new MuhurtaSearchResult(EventType.GENERAL, List.of(), 1, 0, 1, false, ruleSet.version());
        when(scorer.search(any(), any())).thenReturn(result);
        final var mocked = new KaalService(new TimeScale(), KaalFixtures.ayanamshaEngine(cache),
                mock(PanchangDeriver.class), ruleSet, scorer, cache);
        final var query = MuhurtaQuery.builder()
                .location(DELHI).start(NOON_IST).end(NOON_IST.plus(Duration.ofHours(1))).step(Duration.ofHours(1))
                .build();
        final var budgeted = query.toBuilder().timeBudget(Duration.ofSeconds(1)).build();

        mocked.findMuhurta(EventType.GENERAL, query);
        mocked.findMuhurta(EventType.GENERAL, query);
        mocked.findMuhurta(EventType.GENERAL, budgeted);
        mocked.findMuhurta(EventType.GENERAL, budgeted);

        verify(scorer, times(3)).search(any(), any());
    }

    @Test
    void orElseThrowReraisesFailures() {
        final var failure = service.describeAyanamsha("nope");

        assertThatThrownBy(failure::orElseThrow)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("UNKNOWN_AYANAMSHA_SYSTEM");
        assertThat(failure.map(Object::toString)).isInstanceOf(Calculation.Failure.class);
    }
}
