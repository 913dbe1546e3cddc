package io.github.jakubt4.kaal.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final ResultCache cache = new ResultCache(CacheSettings.defaults(), nanos::get);

    @Test
    void concurrentRequestsShareOneComputation() throws Exception {
        final var computations = new AtomicInteger();
        final var started = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final var results = new ArrayList<Future<String>>();
            results.add(executor.submit(() -> cache.get(CacheRegion.PANCHANG, "key", () -> {
                computations.incrementAndGet();
                started.countDown();
                await(release);
                return "value";
            })));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            for (var i = 0; i < 7; i++) {
                results.add(executor.submit(() -> cache.get(CacheRegion.PANCHANG, "key", () -> {
                    computations.incrementAndGet();
                    return "other";
                })));
            }
            release.countDown();

            for (final var result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            }
            assertThat(computations.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void entriesExpireAfterRegionTtl() {
        final var computations = new AtomicInteger();

        cache.get(CacheRegion.PANCHANG, "key", computations::incrementAndGet);
        nanos.addAndGet(Duration.ofMinutes(29).toNanos());
        cache.get(CacheRegion.PANCHANG, "key", computations::incrementAndGet);
        assertThat(computations.get()).isEqualTo(1);

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        cache.get(CacheRegion.PANCHANG, "key", computations::incrementAndGet);
        assertThat(computations.get()).isEqualTo(2);
    }

    @Test
    void ayanamshaEntriesNeverExpire() {
        final var computations = new AtomicInteger();

        cache.get(CacheRegion.AYANAMSHA, "key", computations::incrementAndGet);
        nanos.addAndGet(Duration.ofDays(365).toNanos());
        cache.get(CacheRegion.AYANAMSHA, "key", computations::incrementAndGet);

        assertThat(computations.get()).isEqualTo(1);
    }

    @Test
    void regionsAreIndependent() {
        cache.get(CacheRegion.PANCHANG, "key", () -> "panchang");

        assertThat(cache.<String>get(CacheRegion.MUHURTA, "key", () -> "muhurta")).isEqualTo("muhurta");
        assertThat(cache.size(CacheRegion.PANCHANG)).isEqualTo(1);
        assertThat(cache.size(CacheRegion.RISE_SET)).isZero();
    }

    @Test
    void failuresAreNotCached() {
        final var attempts = new AtomicInteger();

        assertThatThrownBy(() -> cache.get(CacheRegion.RISE_SET, "key", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.<String>get(CacheRegion.RISE_SET, "key", () -> {
            attempts.incrementAndGet();
            return "ok";
        })).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void invalidateAndStats() {
        cache.get(CacheRegion.MUHURTA, "a", () -> 1);
        cache.get(CacheRegion.MUHURTA, "a", () -> 2);

        assertThat(cache.stats(CacheRegion.MUHURTA).hitCount()).isEqualTo(1);
        assertThat(cache.stats(CacheRegion.MUHURTA).missCount()).isEqualTo(1);

        cache.invalidate(CacheRegion.MUHURTA);
        assertThat(cache.size(CacheRegion.MUHURTA)).isZero();
    }

    private static void await(final CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
