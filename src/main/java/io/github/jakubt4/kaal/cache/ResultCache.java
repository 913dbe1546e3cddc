package io.github.jakubt4.kaal.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Memoises deterministic results of the calculation layers.
 *
 * <p>Backed by one size-bounded Caffeine cache per {@link CacheRegion}. Loading
 * goes through {@link Cache#get}, so concurrent requests for the same key wait
 * for the single in-flight computation instead of repeating it. A loader that
 * throws leaves no entry behind.
 *
 * <p>Created once per application context (see
 * {@link io.github.jakubt4.kaal.config.CacheConfig}) and torn down with it.
 */
@Slf4j
public class ResultCache implements AutoCloseable {

    private final Map<CacheRegion, Cache<Object, Object>> regions = new EnumMap<>(CacheRegion.class);

    public ResultCache(final CacheSettings settings) {
        this(settings, Ticker.systemTicker());
    }

    public ResultCache(final CacheSettings settings, final Ticker ticker) {
        for (final var region : CacheRegion.values()) {
            final var builder = Caffeine.newBuilder()
                    .maximumSize(settings.maximumSize())
                    .ticker(ticker)
                    .recordStats();
            final var ttl = settings.ttl(region);
            if (ttl != null) {
                builder.expireAfterWrite(ttl);
            }
            regions.put(region, builder.build());
        }
        log.info("Result cache initialized — maximumSize={} per region, ttl rise-set={} panchang={} muhurta={}",
                settings.maximumSize(), settings.riseSetTtl(), settings.panchangTtl(), settings.muhurtaTtl());
    }

    /**
     * Returns the cached value for {@code key}, computing it with {@code loader}
     * at most once per key across concurrent callers.
     *
     * @param loader must not return {@code null}
     */
    @SuppressWarnings("unchecked")
    public <V> V get(final CacheRegion region, final Object key, final Supplier<V> loader) {
        return (V) regions.get(region).get(key, k -> Objects.requireNonNull(loader.get(),
                () -> "Loader returned null for " + region + " key " + k));
    }

    public void invalidate(final CacheRegion region) {
        regions.get(region).invalidateAll();
    }

    public long size(final CacheRegion region) {
        final var cache = regions.get(region);
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats(final CacheRegion region) {
        return regions.get(region).stats();
    }

    @Scheduled(fixedRateString = "${kaal.cache.stats-interval-ms:300000}",
               initialDelayString = "${kaal.cache.stats-interval-ms:300000}")
    public void logStats() {
        regions.forEach((region, cache) -> {
            final var stats = cache.stats();
            log.info("Cache [{}] size={} hits={} misses={} hitRate={} evictions={}",
                    region, cache.estimatedSize(), stats.hitCount(), stats.missCount(),
                    String.format("%.2f", stats.hitRate()), stats.evictionCount());
        });
    }

    @PreDestroy
    @Override
    public void close() {
        regions.values().forEach(cache -> {
            cache.invalidateAll();
            cache.cleanUp();
        });
        log.info("Result cache closed");
    }
}
