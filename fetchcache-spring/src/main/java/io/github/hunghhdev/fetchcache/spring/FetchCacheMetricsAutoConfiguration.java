package io.github.hunghhdev.fetchcache.spring;

import io.github.hunghhdev.fetchcache.fetch.FetchOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for fetch cache Micrometer metrics.
 * Binds cache metrics when Micrometer is on the classpath.
 */
@AutoConfiguration(after = {FetchCacheAutoConfiguration.class, CompositeMeterRegistryAutoConfiguration.class})
@ConditionalOnClass({MeterRegistry.class, FetchCacheMetrics.class})
@ConditionalOnBean(FetchOrchestrator.class)
public class FetchCacheMetricsAutoConfiguration {

    static final String CACHE_NAME = "fetch";

    private static final Logger logger = LoggerFactory.getLogger(FetchCacheMetricsAutoConfiguration.class);

    @Bean
    public MeterBinder fetchCacheMetricsBinder(FetchOrchestrator orchestrator) {
        return registry -> {
            new FetchCacheMetrics(orchestrator.getCache(), CACHE_NAME).bindTo(registry);
            logger.info("Fetch cache metrics enabled for cache '{}'", CACHE_NAME);
        };
    }
}
