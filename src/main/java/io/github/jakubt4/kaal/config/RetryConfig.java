package io.github.jakubt4.kaal.config;

import io.github.jakubt4.kaal.panchang.RiseSetSolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

    /**
     * Retries a rise/set scan that found no bracket; every other failure is
     * final on the first attempt.
     */
    @Bean
    RetryTemplate riseSetRetryTemplate(@Value("${kaal.rise-set.max-attempts:3}") final int maxAttempts) {
        return RiseSetSolver.retryTemplate(maxAttempts);
    }
}
