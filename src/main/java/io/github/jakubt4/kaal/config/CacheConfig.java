package io.github.jakubt4.kaal.config;

import io.github.jakubt4.kaal.cache.CacheSettings;
import io.github.jakubt4.kaal.cache.ResultCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    @Bean
    CacheSettings cacheSettings(@Value("${kaal.cache.maximum-size:10000}") final long maximumSize,
                                @Value("${kaal.cache.rise-set-ttl:PT6H}") final Duration riseSetTtl,
                                @Value("${kaal.cache.panchang-ttl:PT30M}") final Duration panchangTtl,
                                @Value("${kaal.cache.muhurta-ttl:PT2H}") final Duration muhurtaTtl) {
        return new CacheSettings(maximumSize, null, riseSetTtl, panchangTtl, muhurtaTtl);
    }

    @Bean
    ResultCache resultCache(final CacheSettings cacheSettings) {
        return new ResultCache(cacheSettings);
    }
}
