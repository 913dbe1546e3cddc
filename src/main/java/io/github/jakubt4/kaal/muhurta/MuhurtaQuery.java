package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.ayanamsha.AyanamshaSystem;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.model.TimeInterval;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one muhurta search.
 *
 * @param start           first sample, inclusive
 * @param end             end of the searched range; the last sample starts at least one step before it
 * @param windowDuration  length of each candidate window, defaults to {@code step}
 * @param minimumTier     worst tier kept in the result, defaults to {@link QualityTier#AVOID}
 * @param maxResults      defaults to {@value #DEFAULT_MAX_RESULTS}
 * @param system          defaults to {@link AyanamshaSystem#LAHIRI}
 * @param excludedPeriods caller-supplied periods; samples whose window overlaps one are skipped
 * @param timeBudget      optional; when it expires the search returns what it has, marked partial
 */
@Builder(toBuilder = true)
public record MuhurtaQuery(Location location,
                           Instant start,
                           Instant end,
                           Duration step,
                           Duration windowDuration,
                           QualityTier minimumTier,
                           int maxResults,
                           AyanamshaSystem system,
                           List<TimeInterval> excludedPeriods,
                           Duration timeBudget) {

    public static final int DEFAULT_MAX_RESULTS = 10;

    public MuhurtaQuery {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(step, "step");
        if (windowDuration == null) {
            windowDuration = step;
        }
        if (minimumTier == null) {
            minimumTier = QualityTier.AVOID;
        }
        if (maxResults <= 0) {
            maxResults = DEFAULT_MAX_RESULTS;
        }
        if (system == null) {
            system = AyanamshaSystem.LAHIRI;
        }
        excludedPeriods = excludedPeriods == null ? List.of() : List.copyOf(excludedPeriods);
    }

    public Duration range() {
        return Duration.between(start, end);
    }
}
