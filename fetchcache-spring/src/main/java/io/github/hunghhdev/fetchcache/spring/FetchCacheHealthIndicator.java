package io.github.hunghhdev.fetchcache.spring;

import io.github.hunghhdev.fetchcache.core.CacheClient;
import io.github.hunghhdev.fetchcache.core.CacheStatistics;
import io.github.hunghhdev.fetchcache.core.InMemoryCacheStore;
import io.github.hunghhdev.fetchcache.fetch.FetchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the fetch cache.
 * Reports cache occupancy and statistics to Spring Boot Actuator.
 */
public class FetchCacheHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(FetchCacheHealthIndicator.class);

    private final FetchOrchestrator orchestrator;

    public FetchCacheHealthIndicator(FetchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        try {
            CacheStatistics stats = orchestrator.getStats();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sources", orchestrator.getRegisteredTypes());
            details.put("cache.size", stats.getSize());
            CacheClient cache = orchestrator.getCache();
            if (cache instanceof InMemoryCacheStore) {
                details.put("cache.maxEntries", ((InMemoryCacheStore) cache).getMaxEntries());
            }
            details.put("cache.memoryBytes", stats.getMemoryUsageBytes());
            details.put("stats.hits", stats.getHitCount());
            details.put("stats.misses", stats.getMissCount());
            details.put("stats.hitRate", String.format("%.2f%%", stats.getHitRate() * 100));
            details.put("stats.puts", stats.getPutCount());
            details.put("stats.evictions", stats.getEvictionCount());
            details.put("stats.expirations", stats.getExpiredCount());

            return Health.up().withDetails(details).build();

        } catch (Exception e) {
            logger.error("Fetch cache health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
