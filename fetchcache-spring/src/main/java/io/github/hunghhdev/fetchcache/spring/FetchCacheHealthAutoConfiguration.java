package io.github.hunghhdev.fetchcache.spring;

import io.github.hunghhdev.fetchcache.fetch.FetchOrchestrator;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link FetchCacheHealthIndicator} when Spring Boot Actuator is on the classpath.
 */
@AutoConfiguration(after = FetchCacheAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(FetchOrchestrator.class)
public class FetchCacheHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "fetchCacheHealthIndicator")
    public FetchCacheHealthIndicator fetchCacheHealthIndicator(FetchOrchestrator orchestrator) {
        return new FetchCacheHealthIndicator(orchestrator);
    }
}
