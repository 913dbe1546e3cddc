package io.github.jakubt4.kaal.service;

import io.github.jakubt4.kaal.ayanamsha.AyanamshaDescription;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaEngine;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaValue;
import io.github.jakubt4.kaal.cache.CacheRegion;
import io.github.jakubt4.kaal.cache.ResultCache;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.muhurta.EventType;
import io.github.jakubt4.kaal.muhurta.MuhurtaCandidate;
import io.github.jakubt4.kaal.muhurta.MuhurtaQuery;
import io.github.jakubt4.kaal.muhurta.MuhurtaRuleSet;
import io.github.jakubt4.kaal.muhurta.MuhurtaScorer;
import io.github.jakubt4.kaal.muhurta.MuhurtaSearchResult;
import io.github.jakubt4.kaal.panchang.PanchangDeriver;
import io.github.jakubt4.kaal.panchang.PanchangReport;
import io.github.jakubt4.kaal.time.TimeScale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Entry point for calling layers. Every operation returns a {@link Calculation};
 * failures of the core arrive as {@link Calculation.Failure} with their
 * {@link io.github.jakubt4.kaal.error.ErrorKind} and context.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KaalService {

    private final TimeScale timeScale;
    private final AyanamshaEngine ayanamshaEngine;
    private final PanchangDeriver panchangDeriver;
    private final MuhurtaRuleSet ruleSet;
    private final MuhurtaScorer scorer;
    private final ResultCache cache;

    private record SearchKey(String ruleSetVersion, String catalogVersion, EventType eventType, MuhurtaQuery query) {
    }

    public Calculation<PanchangReport> computePanchang(final Location location, final Instant instant,
                                                       final AyanamshaSystem system) {
        return Calculation.of(() -> panchangDeriver.compute(location, timeScale.at(instant), system));
    }

    /**
     * Variant taking raw coordinates and a system tag, so that invalid input is
     * reported as a failure rather than thrown.
     */
    public Calculation<PanchangReport> computePanchang(final double latitude, final double longitude,
                                                       final double elevation, final Instant instant,
                                                       final String systemTag) {
        return Calculation.of(() -> panchangDeriver.compute(new Location(latitude, longitude, elevation),
                timeScale.at(instant), AyanamshaSystem.fromTag(systemTag)));
    }

    public Calculation<Map<AyanamshaSystem, AyanamshaValue>> compareAyanamsha(final Instant instant) {
        return Calculation.of(() -> ayanamshaEngine.compareAll(timeScale.at(instant)));
    }

    public Calculation<AyanamshaValue> ayanamsha(final String systemTag, final Instant instant) {
        return Calculation.of(() -> ayanamshaEngine.ayanamsha(AyanamshaSystem.fromTag(systemTag),
                timeScale.at(instant)));
    }

    public Calculation<AyanamshaDescription> describeAyanamsha(final String systemTag) {
        return Calculation.of(() -> ayanamshaEngine.describe(AyanamshaSystem.fromTag(systemTag)));
    }

    public Calculation<List<AyanamshaValue>> ayanamshaHistory(final AyanamshaSystem system, final int fromYear,
                                                              final int toYear, final int step) {
        return Calculation.of(() -> ayanamshaEngine.history(system, fromYear, toYear, step));
    }

    /**
     * Ranked muhurta candidates. Searches without a time budget are cached in
     * {@link CacheRegion#MUHURTA} under the rule-set and ayanamsha catalog
     * versions; budgeted searches may be partial and are always recomputed.
     */
    public Calculation<MuhurtaSearchResult> findMuhurta(final EventType eventType, final MuhurtaQuery query) {
        log.debug("Muhurta search requested — event={}, query={}", eventType, query);
        return Calculation.of(() -> {
            final var rule = ruleSet.rule(eventType);
            if (query.timeBudget() != null) {
                return scorer.search(rule, query);
            }
            final var key = new SearchKey(ruleSet.version(), ayanamshaEngine.catalogVersion(), eventType, query);
            return cache.get(CacheRegion.MUHURTA, key, () -> scorer.search(rule, query));
        });
    }

    public Calculation<MuhurtaSearchResult> findMuhurta(final String eventTag, final MuhurtaQuery query) {
        return Calculation.of(() -> EventType.fromTag(eventTag))
                .flatMap(eventType -> findMuhurta(eventType, query));
    }

    public Calculation<Optional<MuhurtaCandidate>> bestMuhurta(final EventType eventType, final MuhurtaQuery query) {
        return Calculation.of(() -> scorer.best(ruleSet.rule(eventType), query));
    }

    public Calculation<SortedMap<LocalDate, List<MuhurtaCandidate>>> muhurtaCalendar(final EventType eventType,
                                                                                  final Location location,
                                                                                  final LocalDate from,
                                                                                  final LocalDate to,
                                                                                  final AyanamshaSystem system) {
        return Calculation.of(() -> scorer.calendar(ruleSet.rule(eventType), location, from, to, system));
    }
}
