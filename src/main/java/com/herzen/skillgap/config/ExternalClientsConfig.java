package com.herzen.skillgap.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.herzen.skillgap.graph.AccessTokenCache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExternalClientsConfig {

    @Bean
    @Qualifier("enrichmentRestTemplate")
    public RestTemplate enrichmentRestTemplate(RestTemplateBuilder builder, SkillGapProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofMillis(properties.enrichment().timeoutMs()))
                .build();
    }

    @Bean
    @Qualifier("graphRestTemplate")
    public RestTemplate graphRestTemplate(RestTemplateBuilder builder, SkillGapProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofMillis(properties.graph().timeoutMs()))
                .build();
    }

    @Bean
    public AccessTokenCache accessTokenCache() {
        return new AccessTokenCache(Ticker.systemTicker());
    }

    /** Runs enrichment calls so callers can bound them with a timeout. */
    @Bean(destroyMethod = "shutdown")
    @Qualifier("enrichmentExecutor")
    public ExecutorService enrichmentExecutor() {
        return Executors.newFixedThreadPool(2);
    }
}
