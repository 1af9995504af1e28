package io.github.hunghhdev.fetchcache.spring;

import io.github.hunghhdev.fetchcache.core.CacheClient;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer metrics binder for a fetch cache.
 *
 * <p>Metrics exposed:</p>
 * <ul>
 *   <li>{@code fetchcache.gets} - Counter for cache lookups (tagged by result: hit/miss)</li>
 *   <li>{@code fetchcache.puts} - Counter for cache writes</li>
 *   <li>{@code fetchcache.evictions} - Counter for size-based evictions</li>
 *   <li>{@code fetchcache.expirations} - Counter for entries removed after their TTL</li>
 *   <li>{@code fetchcache.size} - Gauge for current number of entries</li>
 *   <li>{@code fetchcache.hit.rate} - Gauge for the hit rate (0.0 - 1.0)</li>
 *   <li>{@code fetchcache.memory.usage} - Gauge for the estimated footprint in bytes</li>
 * </ul>
 *
 * <p>Counters are reset by {@code clearCache()}, so rates should be read over short windows.
 * Only {@code fetchcache.memory.usage} serializes the cached values; the other meters read
 * {@link CacheClient#getCounters()}.</p>
 */
public class FetchCacheMetrics implements MeterBinder {

    private final CacheClient cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    public FetchCacheMetrics(CacheClient cache, String cacheName) {
        this(cache, cacheName, Collections.emptyList());
    }

    /**
     * Create metrics for a cache with additional tags.
     *
     * @param cache the cache to monitor
     * @param cacheName value of the {@code cache} tag
     * @param tags additional tags to apply to all metrics
     */
    public FetchCacheMetrics(CacheClient cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("fetchcache.gets", cache, c -> c.getCounters().getHitCount())
                .tags(tags)
                .tag("cache", cacheName)
                .tag("result", "hit")
                .description("The number of cache hits")
                .register(registry);

        FunctionCounter.builder("fetchcache.gets", cache, c -> c.getCounters().getMissCount())
                .tags(tags)
                .tag("cache", cacheName)
                .tag("result", "miss")
                .description("The number of cache misses")
                .register(registry);

        FunctionCounter.builder("fetchcache.puts", cache, c -> c.getCounters().getPutCount())
                .tags(tags)
                .tag("cache", cacheName)
                .description("The number of cache puts")
                .register(registry);

        FunctionCounter.builder("fetchcache.evictions", cache, c -> c.getCounters().getEvictionCount())
                .tags(tags)
                .tag("cache", cacheName)
                .description("The number of entries evicted to respect the size limit")
                .register(registry);

        FunctionCounter.builder("fetchcache.expirations", cache, c -> c.getCounters().getExpiredCount())
                .tags(tags)
                .tag("cache", cacheName)
                .description("The number of entries removed after their TTL elapsed")
                .register(registry);

        Gauge.builder("fetchcache.size", cache, CacheClient::size)
                .tags(tags)
                .tag("cache", cacheName)
                .description("The current number of entries in the cache")
                .register(registry);

        Gauge.builder("fetchcache.hit.rate", cache, c -> c.getCounters().getHitRate())
                .tags(tags)
                .tag("cache", cacheName)
                .description("The cache hit rate (0.0 - 1.0)")
                .register(registry);

        Gauge.builder("fetchcache.memory.usage", cache, c -> c.getStatistics().getMemoryUsageBytes())
                .tags(tags)
                .tag("cache", cacheName)
                .description("The estimated memory footprint of the cached values")
                .baseUnit("bytes")
                .register(registry);
    }

    /**
     * Binds metrics for a cache to a registry.
     *
     * @param cache the cache to monitor
     * @param cacheName value of the {@code cache} tag
     * @param registry the meter registry
     * @return the cache (for chaining)
     */
    public static <C extends CacheClient> C monitor(C cache, String cacheName, MeterRegistry registry) {
        new FetchCacheMetrics(cache, cacheName).bindTo(registry);
        return cache;
    }
}
