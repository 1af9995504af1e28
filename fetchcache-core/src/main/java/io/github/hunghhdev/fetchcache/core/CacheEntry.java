package io.github.hunghhdev.fetchcache.core;

import java.time.Duration;

/**
 * A cached value with its bookkeeping. Instances are owned by {@link InMemoryCacheStore};
 * only the access fields change after creation, and only while the store lock is held.
 */
public final class CacheEntry {

    private final Object value;
    private final long createdAt;
    private final Duration ttl;
    private long accessCount;
    private long lastAccessedAt;

    CacheEntry(Object value, long createdAt, Duration ttl) {
        this.value = value;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.accessCount = 1;
        this.lastAccessedAt = createdAt;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Epoch millis at which the value was stored.
     */
    public long getCreatedAt() {
        return createdAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    public long getAccessCount() {
        return accessCount;
    }

    /**
     * Epoch millis of the most recent hit, or {@link #getCreatedAt()} if never hit.
     */
    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    boolean isExpired(long now) {
        return now - createdAt > ttl.toMillis();
    }

    void recordAccess(long now) {
        accessCount++;
        lastAccessedAt = Math.max(now, createdAt);
    }

    CacheEntry copy() {
        CacheEntry copy = new CacheEntry(value, createdAt, ttl);
        copy.accessCount = accessCount;
        copy.lastAccessedAt = lastAccessedAt;
        return copy;
    }

    @Override
    public String toString() {
        return "CacheEntry{createdAt=" + createdAt + ", ttl=" + ttl
            + ", accessCount=" + accessCount + ", lastAccessedAt=" + lastAccessedAt + "}";
    }
}
