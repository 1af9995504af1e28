package io.github.hunghhdev.fetchcache.core;

/**
 * Reason an entry left the cache.
 */
public enum RemovalCause {

    /**
     * Removed through {@link CacheClient#evict(String)}.
     */
    EXPLICIT,

    /**
     * Removed to make room for a new key while the store was full.
     */
    SIZE,

    /**
     * Removed because its TTL had elapsed, either on lookup or by the cleanup sweep.
     */
    EXPIRED
}
