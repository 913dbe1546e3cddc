package io.github.jakubt4.kaal.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.kaal.ayanamsha.AyanamshaCatalog;
import io.github.jakubt4.kaal.muhurta.MuhurtaRuleSet;
import io.github.jakubt4.kaal.panchang.KaranaCycle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Reference tables read once at start-up. Resource locations can be overridden
 * to swap in alternative constants without a rebuild.
 */
@Configuration
public class CatalogConfig {

    @Bean
    AyanamshaCatalog ayanamshaCatalog(final ObjectMapper objectMapper,
                                      @Value("${kaal.ayanamsha.constants:" + AyanamshaCatalog.DEFAULT_RESOURCE + "}")
                                      final String resource) {
        return AyanamshaCatalog.load(objectMapper, resource);
    }

    @Bean
    KaranaCycle karanaCycle(final ObjectMapper objectMapper,
                            @Value("${kaal.panchang.karana-cycle:" + KaranaCycle.DEFAULT_RESOURCE + "}")
                            final String resource) {
        return KaranaCycle.load(objectMapper, resource);
    }

    @Bean
    MuhurtaRuleSet muhurtaRuleSet(final ObjectMapper objectMapper,
                                  @Value("${kaal.muhurta.rules:" + MuhurtaRuleSet.DEFAULT_RESOURCE + "}")
                                  final String resource) {
        return MuhurtaRuleSet.load(objectMapper, resource);
    }
}
