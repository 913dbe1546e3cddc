package io.github.jakubt4.kaal.ayanamsha;

import io.github.jakubt4.kaal.cache.CacheRegion;
import io.github.jakubt4.kaal.cache.ResultCache;
import io.github.jakubt4.kaal.model.Angles;
import io.github.jakubt4.kaal.time.TimePoint;
import io.github.jakubt4.kaal.time.TimeScale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Precession offset between the tropical zodiac and each sidereal system.
 *
 * <p>Values are pure functions of (system, instant) and are kept in the
 * {@link CacheRegion#AYANAMSHA} region without expiry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AyanamshaEngine {

    private final AyanamshaCatalog catalog;
    private final ResultCache cache;
    private final TimeScale timeScale;

    private record Key(AyanamshaSystem system, TimePoint time) {
    }

    public AyanamshaValue ayanamsha(final AyanamshaSystem system, final TimePoint time) {
        return cache.get(CacheRegion.AYANAMSHA, new Key(system, time), () -> compute(system, time));
    }

    public Map<AyanamshaSystem, AyanamshaValue> compareAll(final TimePoint time) {
        final var values = new EnumMap<AyanamshaSystem, AyanamshaValue>(AyanamshaSystem.class);
        for (final var system : AyanamshaSystem.values()) {
            values.put(system, ayanamsha(system, time));
        }
        return Collections.unmodifiableMap(values);
    }

    /**
     * Tropical to sidereal longitude, normalised to [0, 360).
     */
    public double toSidereal(final double tropicalDegrees, final AyanamshaSystem system, final TimePoint time) {
        return Angles.normalize(tropicalDegrees - ayanamsha(system, time).degrees());
    }

    /**
     * Inverse of {@link #toSidereal}.
     */
    public double toTropical(final double siderealDegrees, final AyanamshaSystem system, final TimePoint time) {
        return Angles.normalize(siderealDegrees + ayanamsha(system, time).degrees());
    }

    /**
     * Signed offset {@code a - b} in degrees.
     */
    public double difference(final AyanamshaSystem a, final AyanamshaSystem b, final TimePoint time) {
        return ayanamsha(a, time).degrees() - ayanamsha(b, time).degrees();
    }

    public AyanamshaDescription describe(final AyanamshaSystem system) {
        final var model = catalog.model(system);
        return new AyanamshaDescription(system, system.description(), model.epochJd(), model.baseDegrees(),
                model.rateArcsecPerYear(), model.isPolynomial(), model.validFromYear(), model.validToYear());
    }

    /**
     * Values at 1 January 00:00 UTC of every {@code step}-th year in
     * [{@code fromYear}, {@code toYear}].
     */
    public List<AyanamshaValue> history(final AyanamshaSystem system, final int fromYear, final int toYear,
                                        final int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        if (toYear < fromYear) {
            throw new IllegalArgumentException("toYear " + toYear + " precedes fromYear " + fromYear);
        }
        final var values = new ArrayList<AyanamshaValue>();
        for (var year = fromYear; year <= toYear; year += step) {
            final var instant = LocalDate.of(year, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC);
            values.add(ayanamsha(system, timeScale.at(instant)));
        }
        return values;
    }

    public String catalogVersion() {
        return catalog.version();
    }

    private AyanamshaValue compute(final AyanamshaSystem system, final TimePoint time) {
        final var result = catalog.model(system).evaluate(time.julianDayTt());
        final var extrapolated = result[1] != 0.0;
        if (extrapolated) {
            log.debug("Ayanamsha {} extrapolated for {}", system, time.utc());
        }
        return new AyanamshaValue(system, time, result[0], extrapolated);
    }
}
