package io.github.jakubt4.kaal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Kaal: Panchang derivation and Muhurta scoring core.
 *
 * <p>Converts tropical Sun and Moon longitudes from an ephemeris provider into
 * sidereal calendrical elements under a chosen ayanamsha, derives the day's
 * rise/set timings and inauspicious periods, and scores candidate windows for
 * auspiciousness per event type.
 *
 * @see io.github.jakubt4.kaal.service.KaalService
 */
@SpringBootApplication
@EnableScheduling
public class KaalApplication {

    public static void main(String[] args) {
        SpringApplication.run(KaalApplication.class, args);
    }
}
