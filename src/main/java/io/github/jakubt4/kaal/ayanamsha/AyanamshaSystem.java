package io.github.jakubt4.kaal.ayanamsha;

import io.github.jakubt4.kaal.error.UnknownAyanamshaSystemException;

import java.util.Locale;
import java.util.Map;

/**
 * Supported sidereal reference systems. String tags coming from callers are
 * resolved here once; everything downstream works with the enum.
 */
public enum AyanamshaSystem {
    LAHIRI("Chitrapaksha ayanamsha, official Indian standard"),
    RAMAN("B.V. Raman ayanamsha"),
    KRISHNAMURTI("Krishnamurti Paddhati (KP)"),
    YUKTESHWAR("Sri Yukteshwar ayanamsha"),
    SURYA_SIDDHANTA("Traditional Surya Siddhanta"),
    FAGAN_BRADLEY("Fagan-Bradley, western sidereal"),
    DELUCE("DeLuce ayanamsha"),
    PUSHYA_PAKSHA("Pushya Paksha ayanamsha"),
    GALACTIC_CENTER("Galactic Center at 0 Sagittarius"),
    TRUE_CITRA("True Chitrapaksha, Spica fixed at 180 degrees");

    private final String description;

    AyanamshaSystem(final String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Parses a tag case-insensitively; hyphens, spaces and missing underscores
     * are tolerated ({@code "fagan-bradley"}, {@code "SURYASIDDHANTA"}).
     *
     * @throws UnknownAyanamshaSystemException for any other tag
     */
    public static AyanamshaSystem fromTag(final String tag) {
        if (tag != null) {
            final var canonical = canonical(tag);
            for (final var system : values()) {
                if (canonical(system.name()).equals(canonical)) {
                    return system;
                }
            }
        }
        throw new UnknownAyanamshaSystemException("Unknown ayanamsha system",
                Map.of("tag", String.valueOf(tag)));
    }

    private static String canonical(final String tag) {
        return tag.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
    }
}
