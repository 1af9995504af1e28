package io.github.hunghhdev.fetchcache.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Main client for interacting with a key/value cache whose entries expire after a TTL.
 */
public interface CacheClient {

    /**
     * Gets a value from the cache. An entry whose TTL has elapsed is removed and reported as absent.
     * @param key the cache key
     * @return optional containing the cached value if found and not expired
     */
    Optional<Object> get(String key);

    /**
     * Gets a value from the cache, cast to the requested type.
     * @param key the cache key
     * @param clazz the class type of the cached value
     * @return optional containing the cached value if found and not expired
     * @throws FetchCacheException if the cached value is not an instance of {@code clazz}
     */
    <T> Optional<T> get(String key, Class<T> clazz);

    /**
     * Puts a value in the cache with specified TTL, replacing any previous entry for the key.
     * @param key the cache key
     * @param value the value to cache
     * @param ttl time to live duration
     */
    void put(String key, Object value, Duration ttl);

    /**
     * Removes a single entry.
     * @param key the cache key
     * @return true if an entry was removed
     */
    boolean evict(String key);

    /**
     * Removes all entries and resets the statistics counters.
     */
    void clear();

    /**
     * Removes all expired entries.
     * @return the number of entries removed
     */
    int cleanupExpired();

    int size();

    /**
     * Returns cache statistics including hit/miss counts, size and approximate memory usage.
     * Taking a snapshot does not change the cache.
     * @return current cache statistics
     */
    CacheStatistics getStatistics();

    /**
     * Returns the counters and the current size without estimating memory usage, so the
     * cost does not grow with the size of the cached values.
     * {@link CacheStatistics#getMemoryUsageBytes()} is always 0 in the returned snapshot.
     * @return current counters
     */
    CacheStatistics getCounters();
}
