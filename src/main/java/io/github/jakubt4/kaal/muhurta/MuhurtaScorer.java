package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.error.EmptySearchWindowException;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.model.TimeInterval;
import io.github.jakubt4.kaal.model.Vara;
import io.github.jakubt4.kaal.panchang.GrahaPosition;
import io.github.jakubt4.kaal.panchang.Kaal;
import io.github.jakubt4.kaal.panchang.PanchangDeriver;
import io.github.jakubt4.kaal.panchang.PanchangElements;
import io.github.jakubt4.kaal.panchang.SolarDay;
import io.github.jakubt4.kaal.time.TimeScale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Samples a time range, scores every window against a {@link MuhurtaRule} and
 * ranks the results.
 *
 * <p>Samples are independent and are scored concurrently on the muhurta worker
 * pool; ordering is restored afterwards (score descending, then earlier start).
 * Hard exclusions are checked before any factor is looked at: a window that
 * overlaps an excluded kaal, or falls in Bhadra when Bhadra is excluded, scores
 * zero and lands in {@link QualityTier#AVOID}.
 */
@Slf4j
@Service
public class MuhurtaScorer {

    private static final Comparator<MuhurtaCandidate> RANKING =
            Comparator.comparingInt(MuhurtaCandidate::score).reversed()
                    .thenComparing(candidate -> candidate.window().start());

    private final PanchangDeriver deriver;
    private final TimeScale timeScale;
    private final MuhurtaRuleSet ruleSet;
    private final ExecutorService executor;
    private final Duration boundaryMargin;
    private final Duration calendarStep;
    private final int calendarMaxPerDay;

    public MuhurtaScorer(final PanchangDeriver deriver,
                         final TimeScale timeScale,
                         final MuhurtaRuleSet ruleSet,
                         @Qualifier("muhurtaExecutor") final ExecutorService executor,
                         @Value("${kaal.muhurta.boundary-margin:PT15M}") final Duration boundaryMargin,
                         @Value("${kaal.muhurta.calendar-step:PT1H}") final Duration calendarStep,
                         @Value("${kaal.muhurta.calendar-max-per-day:5}") final int calendarMaxPerDay) {
        this.deriver = deriver;
        this.timeScale = timeScale;
        this.ruleSet = ruleSet;
        this.executor = executor;
        this.boundaryMargin = boundaryMargin;
        this.calendarStep = calendarStep;
        this.calendarMaxPerDay = calendarMaxPerDay;
    }

    /**
     * @throws EmptySearchWindowException if the step or window duration is not positive, or the range is
     *                                    shorter than one step
     */
    public MuhurtaSearchResult search(final MuhurtaRule rule, final MuhurtaQuery query) {
        final var step = query.step();
        if (step.isZero() || step.isNegative()) {
            throw new EmptySearchWindowException("Search step must be positive", Map.of("step", step));
        }
        if (query.windowDuration().isZero() || query.windowDuration().isNegative()) {
            throw new EmptySearchWindowException("Window duration must be positive",
                    Map.of("windowDuration", query.windowDuration()));
        }
        if (query.range().compareTo(step) < 0) {
            throw new EmptySearchWindowException("Search range shorter than one step",
                    Map.of("start", query.start(), "end", query.end(), "step", step));
        }

        final var planned = Math.toIntExact(query.range().dividedBy(step));
        final var tasks = new ArrayList<Callable<MuhurtaCandidate>>(planned);
        var skipped = 0;
        for (var k = 0; k < planned; k++) {
            final var window = TimeInterval.of(query.start().plus(step.multipliedBy(k)), query.windowDuration());
            if (query.excludedPeriods().stream().anyMatch(window::overlaps)) {
                skipped++;
                continue;
            }
            tasks.add(() -> evaluate(rule, query.system(), query.location(), window));
        }

        final var scored = new ArrayList<MuhurtaCandidate>(tasks.size());
        var partial = false;
        try {
            final List<Future<MuhurtaCandidate>> futures = query.timeBudget() == null
                    ? executor.invokeAll(tasks)
                    : executor.invokeAll(tasks, query.timeBudget().toNanos(), TimeUnit.NANOSECONDS);
            for (final var future : futures) {
                if (future.isCancelled()) {
                    partial = true;
                } else {
                    scored.add(resultOf(future));
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Muhurta search interrupted after {} of {} samples", scored.size(), tasks.size());
            partial = true;
        }

        final var candidates = scored.stream()
                .sorted(RANKING)
                .filter(candidate -> candidate.tier().isAtLeast(query.minimumTier()))
                .limit(query.maxResults())
                .collect(Collectors.toList());
        log.info("Muhurta search [{}] {} — planned={}, skipped={}, evaluated={}, kept={}, partial={}",
                rule.eventType(), query.location(), planned, skipped, scored.size(), candidates.size(), partial);
        return new MuhurtaSearchResult(rule.eventType(), candidates, planned, skipped, scored.size(), partial,
                ruleSet.version());
    }

    public Optional<MuhurtaCandidate> best(final MuhurtaRule rule, final MuhurtaQuery query) {
        return search(rule, query.toBuilder().maxResults(1).build()).candidates().stream().findFirst();
    }

    /**
     * Good-or-better windows for every local-mean-time day in
     * [{@code from}, {@code to}]. Days without such a window are left out.
     */
    public SortedMap<LocalDate, List<MuhurtaCandidate>> calendar(final MuhurtaRule rule,
                                                                final Location location,
                                                                final LocalDate from,
                                                                final LocalDate to,
                                                                final AyanamshaSystem system) {
        if (to.isBefore(from)) {
            throw new EmptySearchWindowException("Calendar range is empty", Map.of("from", from, "to", to));
        }
        final var calendar = new TreeMap<LocalDate, List<MuhurtaCandidate>>();
        for (var date = from; !date.isAfter(to); date = date.plusDays(1)) {
            final var start = date.atStartOfDay().toInstant(location.meanTimeOffset());
            final var query = MuhurtaQuery.builder()
                    .location(location)
                    .start(start)
                    .end(start.plus(Duration.ofDays(1)))
                    .step(calendarStep)
                    .minimumTier(QualityTier.GOOD)
                    .maxResults(calendarMaxPerDay)
                    .system(system)
                    .build();
            final var candidates = search(rule, query).candidates();
            if (!candidates.isEmpty()) {
                calendar.put(date, candidates);
            }
        }
        return Collections.unmodifiableSortedMap(calendar);
    }

    MuhurtaCandidate evaluate(final MuhurtaRule rule, final AyanamshaSystem system, final Location location,
                              final TimeInterval window) {
        final var time = timeScale.at(window.start());
        final var grahas = deriver.grahaPositions(time, system);
        final var elements = deriver.elements(siderealOf(grahas, Body.SUN), siderealOf(grahas, Body.MOON));
        final var endElements = deriver.elementsAt(timeScale.at(window.end()), system);
        final var days = solarDays(window, location);
        final var localDate = PanchangDeriver.localDate(window.start(), location);
        final var vara = Vara.of(localDate.getDayOfWeek());

        final var warnings = new ArrayList<String>();
        final var triggered = new ArrayList<String>();
        for (final var exclusion : Exclusion.values()) {
            if (!rule.excludes(exclusion)) {
                continue;
            }
            if (exclusion.kaal() == null) {
                if (elements.karana().isBhadra() || endElements.karana().isBhadra()) {
                    triggered.add("Bhadra");
                    warnings.add("Window falls in Bhadra (Vishti karana), excluded");
                }
                continue;
            }
            for (final var day : days) {
                final var period = day.kaal(exclusion.kaal());
                if (window.overlaps(period)) {
                    triggered.add(exclusion.kaal().displayName());
                    warnings.add(overlapWarning(window, period, exclusion.kaal()) + ", excluded");
                }
            }
        }
        if (!triggered.isEmpty()) {
            return new MuhurtaCandidate(window, 0, QualityTier.AVOID, List.of(), warnings, List.of(),
                    "Avoid: " + rule.eventType().name().toLowerCase(Locale.ROOT) + " window excluded by "
                            + String.join(", ", triggered),
                    true);
        }

        advisoryWarnings(rule, window, days, warnings);
        if (elements.tithi() != endElements.tithi()) {
            warnings.add("Tithi changes within the window: " + elements.tithi().fullName() + " to "
                    + endElements.tithi().fullName());
        }
        if (elements.nakshatra() != endElements.nakshatra()) {
            warnings.add("Nakshatra changes within the window: " + elements.nakshatra().displayName() + " to "
                    + endElements.nakshatra().displayName());
        }
        if (elements.nakshatra().isGandaMoola() && rule.gandaMoolaPenalty() > 0.0) {
            warnings.add("Moon in Ganda Moola nakshatra " + elements.nakshatra().displayName());
        }

        final var breakdown = breakdown(rule, elements, vara, localDate.getMonth(), grahas);
        final var weighted = breakdown.stream().mapToDouble(f -> f.weight() * f.favourability()).sum();
        final var score = (int) Math.max(0, Math.min(100, Math.round(100.0 * weighted / rule.totalWeight())));
        final var tier = QualityTier.of(score);
        final var recommendations = tier.recommendation().map(List::of).orElse(List.of());
        if (recommendations.isEmpty()) {
            warnings.add(QualityTier.CHALLENGING);
        }
        return new MuhurtaCandidate(window, score, tier, breakdown, warnings, recommendations,
                describe(rule, tier, elements, vara), false);
    }

    private List<FactorScore> breakdown(final MuhurtaRule rule, final PanchangElements elements, final Vara vara,
                                        final Month month, final List<GrahaPosition> grahas) {
        final var neutral = rule.neutralFavourability();
        final var scores = new ArrayList<FactorScore>(Factor.values().length);
        for (final var factor : Factor.values()) {
            if (factor == Factor.PLANETARY_STRENGTH) {
                scores.add(planetaryStrength(rule, grahas));
                continue;
            }
            final var value = switch (factor) {
                case TITHI -> Integer.toString(elements.tithi().number());
                case NAKSHATRA -> elements.nakshatra().name();
                case YOGA -> elements.yoga().name();
                case KARANA -> elements.karana().name();
                case VARA -> vara.name();
                case MOON_PHASE -> elements.moonPhase().name();
                case MONTH -> month.name();
                case PLANETARY_STRENGTH -> throw new IllegalStateException("handled above");
            };
            var favourability = rule.preference(factor).favourability(value, neutral);
            if (factor == Factor.NAKSHATRA && elements.nakshatra().isGandaMoola()) {
                favourability = Math.max(0.0, favourability - rule.gandaMoolaPenalty());
            }
            scores.add(FactorScore.of(factor, value, rule.weight(factor), favourability, neutral));
        }
        return scores;
    }

    private FactorScore planetaryStrength(final MuhurtaRule rule, final List<GrahaPosition> grahas) {
        final var neutral = rule.neutralFavourability();
        final var parts = new ArrayList<String>();
        var sum = 0.0;
        for (final var position : grahas) {
            if (rule.keyPlanets().contains(position.body())) {
                final var dignity = PlanetaryDignity.of(position.body(), position.rashi());
                parts.add(position.body() + ":" + dignity);
                sum += dignity.favourability(neutral);
            }
        }
        final var favourability = parts.isEmpty() ? neutral : sum / parts.size();
        final var value = parts.isEmpty() ? "none available" : String.join(",", parts);
        return FactorScore.of(Factor.PLANETARY_STRENGTH, value, rule.weight(Factor.PLANETARY_STRENGTH),
                favourability, neutral);
    }

    private void advisoryWarnings(final MuhurtaRule rule, final TimeInterval window, final List<SolarDay> days,
                                  final List<String> warnings) {
        for (final var kaal : Kaal.values()) {
            for (final var day : days) {
                final var period = day.kaal(kaal);
                if (window.overlaps(period)) {
                    warnings.add(overlapWarning(window, period, kaal) + ", not excluded for "
                            + rule.eventType().name().toLowerCase(Locale.ROOT));
                } else if (window.distanceTo(period).compareTo(boundaryMargin) < 0) {
                    warnings.add("Within " + window.distanceTo(period).toMinutes() + " min of "
                            + kaal.displayName() + " " + period.start() + " to " + period.end());
                }
            }
        }
    }

    private List<SolarDay> solarDays(final TimeInterval window, final Location location) {
        final var first = PanchangDeriver.localDate(window.start(), location);
        final var last = PanchangDeriver.localDate(window.end().minusNanos(1), location);
        final var days = new ArrayList<SolarDay>(2);
        for (var date = first; !date.isAfter(last); date = date.plusDays(1)) {
            days.add(deriver.solarDay(date, location));
        }
        return days;
    }

    private static String overlapWarning(final TimeInterval window, final TimeInterval period, final Kaal kaal) {
        final var kind = window.overlapsPartially(period) ? "Partially overlaps " : "Inside ";
        return kind + kaal.displayName() + " " + period.start() + " to " + period.end();
    }

    private static String describe(final MuhurtaRule rule, final QualityTier tier, final PanchangElements elements,
                                   final Vara vara) {
        return tier.displayName() + " " + rule.eventType().name().toLowerCase(Locale.ROOT) + " muhurta on "
                + vara.sanskritName() + ", " + elements.tithi().fullName() + " tithi in "
                + elements.nakshatra().displayName() + " nakshatra, " + elements.yoga().displayName() + " yoga";
    }

    private static double siderealOf(final List<GrahaPosition> grahas, final Body body) {
        return grahas.stream()
                .filter(g -> g.body() == body)
                .findFirst()
                .orElseThrow()
                .siderealLongitude();
    }

    private static MuhurtaCandidate resultOf(final Future<MuhurtaCandidate> future) throws InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Muhurta sample failed", cause);
        }
    }
}
