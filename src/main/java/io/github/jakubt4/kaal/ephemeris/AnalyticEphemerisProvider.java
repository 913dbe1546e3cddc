package io.github.jakubt4.kaal.ephemeris;

import io.github.jakubt4.kaal.error.EphemerisUnavailableException;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.BodyLongitude;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.time.TimePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static io.github.jakubt4.kaal.model.Angles.cosDeg;
import static io.github.jakubt4.kaal.model.Angles.sinDeg;

/**
 * Self-contained provider built on truncated Meeus series. Needs no data files,
 * which makes it the default; covers the Sun, the Moon and the lunar nodes.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "kaal.ephemeris.provider", havingValue = "analytic", matchIfMissing = true)
public class AnalyticEphemerisProvider implements EphemerisProvider {

    static final int MIN_YEAR = -1000;
    static final int MAX_YEAR = 3000;

    private static final Set<Body> SUPPORTED = EnumSet.of(Body.SUN, Body.MOON, Body.RAHU, Body.KETU);

    @Override
    public BodyLongitude longitude(final Body body, final TimePoint time) {
        checkSupported(body, time);
        final var t = time.centuriesTt();
        final var degrees = switch (body) {
            case SUN -> LowPrecisionTheory.sunLongitude(t);
            case MOON -> LowPrecisionTheory.moonLongitude(t);
            default -> MeanLunarNode.longitude(body, time);
        };
        return new BodyLongitude(body, degrees);
    }

    @Override
    public double altitude(final Body body, final TimePoint time, final Location location) {
        checkSupported(body, time);
        if (body.isNode()) {
            throw new EphemerisUnavailableException("Lunar nodes have no altitude", Map.of("body", body));
        }
        final var t = time.centuriesTt();
        final var lambda = longitude(body, time).degrees();
        final var beta = body == Body.MOON ? LowPrecisionTheory.moonLatitude(t) : 0.0;
        final var equatorial = LowPrecisionTheory.toEquatorial(lambda, beta, LowPrecisionTheory.obliquity(t));

        final var localSidereal = time.greenwichSiderealTime() + location.longitude();
        final var hourAngle = localSidereal - equatorial[0];
        final var sinAlt = sinDeg(location.latitude()) * sinDeg(equatorial[1])
                + cosDeg(location.latitude()) * cosDeg(equatorial[1]) * cosDeg(hourAngle);
        final var geocentric = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, sinAlt))));

        // parallax in altitude: the observer sits one Earth radius above the centre
        return geocentric - horizontalParallax(body, time) * cosDeg(geocentric);
    }

    @Override
    public double horizontalParallax(final Body body, final TimePoint time) {
        checkSupported(body, time);
        final var t = time.centuriesTt();
        final var distance = switch (body) {
            case SUN -> LowPrecisionTheory.sunDistanceKm(t);
            case MOON -> LowPrecisionTheory.moonDistanceKm(t);
            default -> throw new EphemerisUnavailableException("Lunar nodes have no parallax", Map.of("body", body));
        };
        return Math.toDegrees(Math.asin(LowPrecisionTheory.EARTH_RADIUS_KM / distance));
    }

    @Override
    public boolean supports(final Body body) {
        return SUPPORTED.contains(body);
    }

    @Override
    public String name() {
        return "analytic";
    }

    private void checkSupported(final Body body, final TimePoint time) {
        if (!supports(body)) {
            throw new EphemerisUnavailableException("Body not covered by the analytic theory",
                    Map.of("body", body, "provider", name()));
        }
        final var year = time.utc().atOffset(ZoneOffset.UTC).getYear();
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new EphemerisUnavailableException("Instant outside the analytic theory range",
                    Map.of("body", body, "instant", time.utc(), "range", MIN_YEAR + ".." + MAX_YEAR));
        }
        log.trace("Analytic position request body={} jdTt={}", body, time.julianDayTt());
    }
}
