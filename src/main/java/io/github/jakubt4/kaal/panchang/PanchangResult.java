package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.model.Location;
import io.github.jakubt4.kaal.model.Vara;
import io.github.jakubt4.kaal.time.TimePoint;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Panchang for one instant and location, derived from sidereal Sun and Moon
 * longitudes. Always fully populated.
 *
 * @param localMeanTime      wall-clock time at the location's mean solar offset
 * @param localSiderealHours local mean sidereal time in hours, [0, 24)
 */
public record PanchangResult(TimePoint time,
                             Location location,
                             LocalDate localDate,
                             LocalDateTime localMeanTime,
                             double localSiderealHours,
                             Vara vara,
                             PanchangElements elements,
                             SolarDay solarDay,
                             MoonRiseSet moon) {

    public Optional<Panchaka> panchaka() {
        return Panchaka.of(elements.nakshatra(), vara);
    }
}
