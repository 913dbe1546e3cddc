package io.github.jakubt4.kaal;

import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.ephemeris.AnalyticEphemerisProvider;
import io.github.jakubt4.kaal.ephemeris.EphemerisProvider;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.muhurta.EventType;
import io.github.jakubt4.kaal.muhurta.MuhurtaQuery;
import io.github.jakubt4.kaal.service.KaalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class KaalApplicationTest {

    private static final Instant INSTANT = Instant.parse("2024-01-15T06:00:00Z");

    @Autowired
    private KaalService kaalService;

    @Autowired
    private EphemerisProvider ephemerisProvider;

    @Test
    void contextWiresTheAnalyticProvider() {
        assertThat(ephemerisProvider).isInstanceOf(AnalyticEphemerisProvider.class);
    }

    @Test
    void comparesEveryAyanamshaSystem() {
        final var comparison = kaalService.compareAyanamsha(INSTANT).orElseThrow();

        assertThat(comparison).hasSize(AyanamshaSystem.values().length);
        assertThat(comparison.get(AyanamshaSystem.LAHIRI).degrees()).isBetween(24.0, 24.4);
    }

    @Test
    void panchangAndMuhurtaThroughTheContext() {
        final var ujjain = new Location(23.1765, 75.7885, 494.0);

        final var report = kaalService.computePanchang(ujjain, INSTANT, AyanamshaSystem.LAHIRI);
        assertThat(report.isSuccess()).isTrue();

        final var query = MuhurtaQuery.builder()
                .location(ujjain)
                .start(INSTANT)
                .end(INSTANT.plus(Duration.ofHours(4)))
                .step(Duration.ofMinutes(30))
                .build();
        final var result = kaalService.findMuhurta(EventType.EDUCATION, query).orElseThrow();
        assertThat(result.samplesEvaluated()).isEqualTo(8);
        assertThat(result.partial()).isFalse();
    }
}
