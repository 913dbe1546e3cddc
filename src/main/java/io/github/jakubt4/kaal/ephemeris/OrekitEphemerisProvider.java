package io.github.jakubt4.kaal.ephemeris;

import io.github.jakubt4.kaal.config.OrekitConfig;
import io.github.jakubt4.kaal.error.EphemerisUnavailableException;
import io.github.jakubt4.kaal.model.Body;
import io.github.jakubt4.kaal.model.BodyLongitude;
import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.time.TimePoint;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.CelestialBody;
import org.orekit.bodies.CelestialBodyFactory;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.frames.TopocentricFrame;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Date;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * High-precision provider backed by Orekit and the JPL ephemerides shipped in
 * {@code orekit-data.zip}.
 *
 * <p>Longitudes are taken in the ecliptic-of-date frame centred on the Earth.
 * Orekit converts UTC to TT itself from its leap-second tables, so the ΔT of the
 * {@link TimePoint} is informational here. Lunar nodes use the mean-node formula.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kaal.ephemeris.provider", havingValue = "orekit")
public class OrekitEphemerisProvider implements EphemerisProvider {

    // annual aberration constant over the Sun's distance in AU, applied to the Sun only
    private static final double ABERRATION_DEG = 20.4898 / 3600.0;

    @SuppressWarnings("unused") // injected to guarantee Orekit data is loaded before @PostConstruct
    private final OrekitConfig orekitConfig;

    private final Map<Body, Supplier<CelestialBody>> bodies = new EnumMap<>(Body.class);

    private OneAxisEllipsoid earth;
    private Frame ecliptic;

    @PostConstruct
    void init() {
        final var itrf = FramesFactory.getITRF(IERSConventions.IERS_2010, true);
        earth = new OneAxisEllipsoid(
                Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
                Constants.WGS84_EARTH_FLATTENING,
                itrf
        );
        ecliptic = FramesFactory.getEcliptic(IERSConventions.IERS_2010);

        bodies.put(Body.SUN, CelestialBodyFactory::getSun);
        bodies.put(Body.MOON, CelestialBodyFactory::getMoon);
        bodies.put(Body.MERCURY, CelestialBodyFactory::getMercury);
        bodies.put(Body.VENUS, CelestialBodyFactory::getVenus);
        bodies.put(Body.MARS, CelestialBodyFactory::getMars);
        bodies.put(Body.JUPITER, CelestialBodyFactory::getJupiter);
        bodies.put(Body.SATURN, CelestialBodyFactory::getSaturn);
        log.info("Orekit ephemeris ready — WGS84 ellipsoid, ITRF/IERS-2010, ecliptic of date");
    }

    @Override
    public BodyLongitude longitude(final Body body, final TimePoint time) {
        if (body.isNode()) {
            return new BodyLongitude(body, MeanLunarNode.longitude(body, time));
        }
        return call(body, time, () -> {
            final var date = toDate(time);
            final var position = celestial(body).getPVCoordinates(date, ecliptic).getPosition();
            var degrees = FastMath.toDegrees(FastMath.atan2(position.getY(), position.getX()));
            if (body == Body.SUN) {
                degrees -= ABERRATION_DEG * Constants.IAU_2012_ASTRONOMICAL_UNIT / position.getNorm();
            }
            return new BodyLongitude(body, degrees);
        });
    }

    @Override
    public double altitude(final Body body, final TimePoint time, final Location location) {
        if (body.isNode()) {
            throw new EphemerisUnavailableException("Lunar nodes have no altitude", Map.of("body", body));
        }
        return call(body, time, () -> {
            final var date = toDate(time);
            final var observer = new TopocentricFrame(earth, new GeodeticPoint(
                    FastMath.toRadians(location.latitude()),
                    FastMath.toRadians(location.longitude()),
                    location.elevation()), "observer");
            final Vector3D position = celestial(body).getPVCoordinates(date, earth.getBodyFrame()).getPosition();
            return FastMath.toDegrees(observer.getElevation(position, earth.getBodyFrame(), date));
        });
    }

    @Override
    public double horizontalParallax(final Body body, final TimePoint time) {
        if (body.isNode()) {
            throw new EphemerisUnavailableException("Lunar nodes have no parallax", Map.of("body", body));
        }
        return call(body, time, () -> {
            final var distance = celestial(body).getPVCoordinates(toDate(time), ecliptic).getPosition().getNorm();
            return FastMath.toDegrees(FastMath.asin(Constants.WGS84_EARTH_EQUATORIAL_RADIUS / distance));
        });
    }

    @Override
    public boolean supports(final Body body) {
        return true;
    }

    @Override
    public String name() {
        return "orekit";
    }

    private CelestialBody celestial(final Body body) {
        return bodies.get(body).get();
    }

    private static AbsoluteDate toDate(final TimePoint time) {
        return new AbsoluteDate(Date.from(time.utc()), TimeScalesFactory.getUTC());
    }

    private <T> T call(final Body body, final TimePoint time, final Supplier<T> computation) {
        try {
            return computation.get();
        } catch (final OrekitException e) {
            log.warn("Orekit failed for [{}] at {}: {}", body, time.utc(), e.getMessage());
            throw new EphemerisUnavailableException("Orekit could not provide a position",
                    Map.of("body", body, "instant", time.utc(), "provider", name()), e);
        }
    }
}
