package io.github.jakubt4.kaal.cache;

import java.time.Duration;

/**
 * Size bound and time-to-live per region. A {@code null} TTL means entries only
 * leave through size eviction.
 */
public record CacheSettings(long maximumSize,
                            Duration ayanamshaTtl,
                            Duration riseSetTtl,
                            Duration panchangTtl,
                            Duration muhurtaTtl) {

    public static CacheSettings defaults() {
        return new CacheSettings(10_000, null, Duration.ofHours(6), Duration.ofMinutes(30), Duration.ofHours(2));
    }

    Duration ttl(final CacheRegion region) {
        return switch (region) {
            case AYANAMSHA -> ayanamshaTtl;
            case RISE_SET -> riseSetTtl;
            case PANCHANG -> panchangTtl;
            case MUHURTA -> muhurtaTtl;
        };
    }
}
