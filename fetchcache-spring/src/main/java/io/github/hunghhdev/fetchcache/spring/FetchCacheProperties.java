package io.github.hunghhdev.fetchcache.spring;

import io.github.hunghhdev.fetchcache.core.InMemoryCacheStore;
import io.github.hunghhdev.fetchcache.fetch.EntityType;
import io.github.hunghhdev.fetchcache.fetch.FetchOrchestrator;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for the fetch cache.
 * Supports YAML/Properties configuration via application.yml or application.properties.
 */
@ConfigurationProperties(prefix = "fetchcache")
public class FetchCacheProperties {

    /**
     * Whether the fetch cache is enabled.
     */
    private boolean enabled = true;

    /**
     * Largest number of fetches in flight at once within a batch.
     */
    private int maxConcurrency = FetchOrchestrator.DEFAULT_MAX_CONCURRENCY;

    /**
     * How long a single data-source call may run before it is cancelled.
     */
    private Duration operationTimeout = FetchOrchestrator.DEFAULT_OPERATION_TIMEOUT;

    /**
     * TTL for entity types without a TTL of their own.
     */
    private Duration defaultTtl = FetchOrchestrator.DEFAULT_TTL;

    /**
     * Maximum number of cached values.
     */
    private int maxCacheEntries = InMemoryCacheStore.DEFAULT_MAX_ENTRIES;

    /**
     * Background cleanup configuration.
     */
    private BackgroundCleanup backgroundCleanup = new BackgroundCleanup();

    /**
     * Per-entity TTL overrides, e.g. {@code fetchcache.ttl.appointments=2m}.
     */
    private Map<EntityType, Duration> ttl = new EnumMap<>(EntityType.class);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public int getMaxCacheEntries() {
        return maxCacheEntries;
    }

    public void setMaxCacheEntries(int maxCacheEntries) {
        this.maxCacheEntries = maxCacheEntries;
    }

    public BackgroundCleanup getBackgroundCleanup() {
        return backgroundCleanup;
    }

    public void setBackgroundCleanup(BackgroundCleanup backgroundCleanup) {
        this.backgroundCleanup = backgroundCleanup;
    }

    public Map<EntityType, Duration> getTtl() {
        return ttl;
    }

    public void setTtl(Map<EntityType, Duration> ttl) {
        this.ttl = ttl;
    }

    /**
     * Copies these settings onto an orchestrator builder.
     *
     * @param builder the builder to configure
     * @return the same builder
     */
    public FetchOrchestrator.Builder applyTo(FetchOrchestrator.Builder builder) {
        builder.maxConcurrency(maxConcurrency)
            .operationTimeout(operationTimeout)
            .defaultTtl(defaultTtl)
            .maxCacheEntries(maxCacheEntries)
            .backgroundCleanup(backgroundCleanup.isEnabled())
            .cleanupInterval(backgroundCleanup.getInterval());
        ttl.forEach(builder::ttl);
        return builder;
    }

    /**
     * Background cleanup configuration.
     */
    public static class BackgroundCleanup {

        /**
         * Whether expired entries are swept periodically.
         */
        private boolean enabled = true;

        /**
         * Interval between background cleanup runs.
         */
        private Duration interval = InMemoryCacheStore.DEFAULT_CLEANUP_INTERVAL;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
