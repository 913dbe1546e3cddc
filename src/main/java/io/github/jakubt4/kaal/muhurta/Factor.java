package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.model.Vara;
import io.github.jakubt4.kaal.panchang.Karana;
import io.github.jakubt4.kaal.panchang.MoonPhase;
import io.github.jakubt4.kaal.panchang.Nakshatra;
import io.github.jakubt4.kaal.panchang.Tithi;
import io.github.jakubt4.kaal.panchang.Yoga;

import java.time.Month;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Weighted inputs of the muhurta score. Each factor owns the vocabulary its
 * favourable and unfavourable sets are written in; tithis are given by their
 * 1-based number, everything else by enum constant name. The month is the
 * civil month of the local-mean-time date.
 */
public enum Factor {
    TITHI(IntStream.rangeClosed(1, Tithi.COUNT).mapToObj(Integer::toString).collect(Collectors.toUnmodifiableSet())),
    NAKSHATRA(names(Nakshatra.values())),
    YOGA(names(Yoga.values())),
    KARANA(names(Karana.values())),
    VARA(names(Vara.values())),
    MOON_PHASE(names(MoonPhase.values())),
    /** Computed from planetary dignity; accepts no value sets. */
    PLANETARY_STRENGTH(Set.of()),
    MONTH(names(Month.values()));

    private final Set<String> vocabulary;

    Factor(final Set<String> vocabulary) {
        this.vocabulary = vocabulary;
    }

    public Set<String> vocabulary() {
        return vocabulary;
    }

    private static Set<String> names(final Enum<?>[] constants) {
        return Arrays.stream(constants).map(Enum::name).collect(Collectors.toUnmodifiableSet());
    }
}
