package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.ayanamsha.AyanamshaEngine;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.cache.CacheRegion;
import io.github.jakubt4.kaal.cache.ResultCache;
import io.github.jakubt4.kaal.ephemeris.EphemerisProvider;
import io.github.jakubt4.kaal.model.Angles;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.time.TimePoint;
import io.github.jakubt4.kaal.time.TimeScale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Derives panchang elements and day timings.
 *
 * <p>The lunar elements are a pure function of the sidereal Sun and Moon
 * longitudes. Rise and set times depend on the location and the local-mean-time
 * date and are cached per (date, location) in {@link CacheRegion#RISE_SET};
 * complete reports, including when each element ends, are cached in
 * {@link CacheRegion#PANCHANG}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PanchangDeriver {

    private static final Duration DAY = Duration.ofDays(1);
    // longest tithi or nakshatra runs just under 27 hours
    private static final Duration TRANSITION_WINDOW = Duration.ofHours(30);
    private static final double SUN_H0 = 0.8333;
    private static final double MOON_H0 = 0.5667;
    private static final double MOON_RADIUS_TO_PARALLAX = 0.2725;
    private static final double DIP_PER_SQRT_METRE = 0.0347;

    private final EphemerisProvider ephemeris;
    private final AyanamshaEngine ayanamshaEngine;
    private final RiseSetSolver riseSetSolver;
    private final KaranaCycle karanaCycle;
    private final ResultCache cache;
    private final TimeScale timeScale;

    private record SolarKey(String provider, LocalDate date, Location location) {
    }

    private record MoonKey(String provider, LocalDate date, Location location) {
    }

    private record ReportKey(String provider, AyanamshaSystem system, Instant utc, Location location) {
    }

    public PanchangElements elements(final double sunSidereal, final double moonSidereal) {
        return PanchangElements.compute(sunSidereal, moonSidereal, karanaCycle);
    }

    /**
     * Elements at an instant, reading only the Sun and Moon from the ephemeris.
     */
    public PanchangElements elementsAt(final TimePoint time, final AyanamshaSystem system) {
        return elements(sidereal(Body.SUN, time, system), sidereal(Body.MOON, time, system));
    }

    /**
     * Full panchang from sidereal Sun and Moon longitudes.
     *
     * @throws io.github.jakubt4.kaal.error.NoRiseOrSetException           if the Sun or Moon does not cross the horizon
     * @throws io.github.jakubt4.kaal.error.EphemerisUnavailableException if a longitude is not finite
     */
    public PanchangResult derive(final double sunSidereal, final double moonSidereal,
                                 final TimePoint time, final Location location) {
        final var elements = elements(sunSidereal, moonSidereal);
        final var date = localDate(time.utc(), location);
        final var solarDay = solarDay(date, location);
        final var localMeanTime = time.utc().atOffset(location.meanTimeOffset()).toLocalDateTime();
        return new PanchangResult(time, location, date, localMeanTime,
                time.localSiderealHours(location.longitude()), solarDay.vara(), elements, solarDay,
                moonRiseSet(date, location));
    }

    /**
     * Reads the ephemeris, applies the ayanamsha and derives the panchang.
     */
    public PanchangReport compute(final Location location, final TimePoint time, final AyanamshaSystem system) {
        final var key = new ReportKey(ephemeris.name(), system, time.utc(), location);
        return cache.get(CacheRegion.PANCHANG, key, () -> {
            log.debug("Computing panchang for {} at {} [{}]", location, time.utc(), system);
            final var grahas = grahaPositions(time, system);
            final var panchang = derive(siderealOf(grahas, Body.SUN), siderealOf(grahas, Body.MOON),
                    time, location);
            return new PanchangReport(panchang, ayanamshaEngine.ayanamsha(system, time), grahas,
                    transitions(time, system));
        });
    }

    /**
     * When the tithi, nakshatra, yoga and karana in force at {@code time} end.
     * Each end is the next instant the governing angle reaches the element's
     * upper boundary.
     *
     * @throws io.github.jakubt4.kaal.error.NoRiseOrSetException if a boundary is not reached within the search window
     */
    public ElementTransitions transitions(final TimePoint time, final AyanamshaSystem system) {
        final var ayanamsha = ayanamshaEngine.ayanamsha(system, time).degrees();
        final var elements = elementsAt(time, system);
        final var start = time.utc();
        final ToDoubleFunction<Instant> elongation = t ->
                Angles.normalize(tropical(Body.MOON, t) - tropical(Body.SUN, t));
        final ToDoubleFunction<Instant> moon = t -> tropical(Body.MOON, t) - ayanamsha;
        final ToDoubleFunction<Instant> yogaSum = t ->
                tropical(Body.SUN, t) + tropical(Body.MOON, t) - 2.0 * ayanamsha;
        final var karanaSpan = Tithi.SPAN_DEGREES / 2.0;
        return new ElementTransitions(
                boundary(start, "tithi", elongation, (elements.tithiIndex() + 1) * Tithi.SPAN_DEGREES),
                boundary(start, "nakshatra", moon, (elements.nakshatraIndex() + 1) * Nakshatra.SPAN_DEGREES),
                boundary(start, "yoga", yogaSum, (elements.yogaIndex() + 1) * Yoga.SPAN_DEGREES),
                boundary(start, "karana", elongation, (Math.floor(elements.tithiValue() * 2.0) + 1) * karanaSpan));
    }

    /**
     * Sidereal positions of every body the provider supports. Sun and Moon are
     * always present; their absence is an ephemeris failure.
     */
    public List<GrahaPosition> grahaPositions(final TimePoint time, final AyanamshaSystem system) {
        final var positions = new ArrayList<GrahaPosition>();
        for (final var body : Body.values()) {
            if (body == Body.SUN || body == Body.MOON || ephemeris.supports(body)) {
                final var tropical = ephemeris.longitude(body, time).degrees();
                positions.add(GrahaPosition.of(body, tropical,
                        ayanamshaEngine.toSidereal(tropical, system, time)));
            }
        }
        return Collections.unmodifiableList(positions);
    }

    public SolarDay solarDay(final LocalDate date, final Location location) {
        return cache.get(CacheRegion.RISE_SET, new SolarKey(ephemeris.name(), date, location), () -> {
            final var midnight = date.atStartOfDay().toInstant(location.meanTimeOffset());
            final var context = Map.of("body", Body.SUN, "date", date, "location", location);
            final var h0 = -(SUN_H0 + dip(location));
            final var sunrise = riseSetSolver.solve(midnight, DAY, Crossing.RISE,
                    t -> altitude(Body.SUN, t, location) - h0, context);
            final var sunset = riseSetSolver.solve(sunrise, DAY, Crossing.SET,
                    t -> altitude(Body.SUN, t, location) - h0, context);
            log.debug("Solar day {} at {} — sunrise={}, sunset={}", date, location, sunrise, sunset);
            return SolarDay.of(date, location, sunrise, sunset);
        });
    }

    public MoonRiseSet moonRiseSet(final LocalDate date, final Location location) {
        return cache.get(CacheRegion.RISE_SET, new MoonKey(ephemeris.name(), date, location), () -> {
            final var midnight = date.atStartOfDay().toInstant(location.meanTimeOffset());
            final var context = Map.of("body", Body.MOON, "date", date, "location", location);
            final var dip = dip(location);
            final var moonrise = riseSetSolver.solve(midnight, DAY, Crossing.RISE,
                    t -> moonHeight(t, location, dip), context);
            final var moonset = riseSetSolver.solve(midnight, DAY, Crossing.SET,
                    t -> moonHeight(t, location, dip), context);
            return new MoonRiseSet(moonrise, moonset);
        });
    }

    /**
     * Local-mean-time calendar date of an instant at a location.
     */
    public static LocalDate localDate(final Instant utc, final Location location) {
        return utc.atOffset(location.meanTimeOffset()).toLocalDate();
    }

    private Instant boundary(final Instant start, final String element, final ToDoubleFunction<Instant> angle,
                             final double target) {
        final var context = Map.of("element", element, "from", start, "boundary", target);
        return riseSetSolver.solve(start, TRANSITION_WINDOW, Crossing.RISE,
                t -> Angles.normalize(angle.applyAsDouble(t) - target + 180.0) - 180.0, context);
    }

    private double tropical(final Body body, final Instant instant) {
        return ephemeris.longitude(body, timeScale.at(instant)).degrees();
    }

    private double sidereal(final Body body, final TimePoint time, final AyanamshaSystem system) {
        return ayanamshaEngine.toSidereal(ephemeris.longitude(body, time).degrees(), system, time);
    }

    private double moonHeight(final Instant instant, final Location location, final double dip) {
        final var time = timeScale.at(instant);
        final var h0 = -(MOON_H0 + MOON_RADIUS_TO_PARALLAX * ephemeris.horizontalParallax(Body.MOON, time) + dip);
        return ephemeris.altitude(Body.MOON, time, location) - h0;
    }

    private double altitude(final Body body, final Instant instant, final Location location) {
        return ephemeris.altitude(body, timeScale.at(instant), location);
    }

    private static double dip(final Location location) {
        return DIP_PER_SQRT_METRE * Math.sqrt(Math.max(0.0, location.elevation()));
    }

    private static double siderealOf(final List<GrahaPosition> grahas, final Body body) {
        return grahas.stream()
                .filter(g -> g.body() == body)
                .findFirst()
                .orElseThrow()
                .siderealLongitude();
    }
}
