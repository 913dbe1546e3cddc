package io.github.jakubt4.kaal.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for muhurta sample scoring. Shut down with the application context.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService muhurtaExecutor(@Value("${kaal.muhurta.workers:4}") final int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("kaal.muhurta.workers must be at least 1: " + workers);
        }
        final var counter = new AtomicInteger();
        final ThreadFactory threadFactory = runnable -> {
            final var thread = new Thread(runnable, "muhurta-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Muhurta worker pool initialized — workers={}", workers);
        return Executors.newFixedThreadPool(workers, threadFactory);
    }
}
