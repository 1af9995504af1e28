package io.github.hunghhdev.fetchcache.core;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * InMemoryCacheStore: process-local implementation of CacheClient with per-entry TTL
 * and least-recently-used eviction under a maximum entry count.
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>get, put, evict, clear and the expiry sweep share a single lock</li>
 *   <li>Statistics copy the entries under the lock and serialize them outside it</li>
 *   <li>The background sweep runs on its own daemon thread</li>
 * </ul>
 *
 * <p><strong>Eviction:</strong> when a new key is written to a full store, the entry with the
 * oldest last-access time is removed first. Ties go to the entry inserted earliest.</p>
 */
public class InMemoryCacheStore implements CacheClient, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheStore.class);

    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofSeconds(30);

    private final ReentrantLock lock = new ReentrantLock();

    // insertion-ordered so that equal access times evict the oldest insertion
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();

    private final int maxEntries;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final boolean enableBackgroundCleanup;
    private final Duration cleanupInterval;
    private final CacheEventDispatcher eventDispatcher;
    private volatile ScheduledExecutorService cleanupExecutor;

    private long hitCount;
    private long missCount;
    private long putCount;
    private long evictionCount;
    private long expiredCount;

    /**
     * Creates a store with the given capacity, no background cleanup and the system clock.
     *
     * @param maxEntries maximum number of entries held at once
     */
    public InMemoryCacheStore(int maxEntries) {
        this(maxEntries, Clock.systemUTC(), new ObjectMapper(), false, DEFAULT_CLEANUP_INTERVAL, null);
    }

    private InMemoryCacheStore(int maxEntries, Clock clock, ObjectMapper objectMapper,
                               boolean enableBackgroundCleanup, Duration cleanupInterval,
                               List<CacheEventListener> listeners) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.enableBackgroundCleanup = enableBackgroundCleanup;
        this.cleanupInterval = cleanupInterval;
        this.eventDispatcher = new CacheEventDispatcher(listeners);

        if (enableBackgroundCleanup) {
            startBackgroundCleanup();
        }
    }

    @Override
    public Optional<Object> get(String key) {
        validateKey(key);

        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                missCount++;
                return Optional.empty();
            }

            long now = clock.millis();
            if (entry.isExpired(now)) {
                entries.remove(key);
                expiredCount++;
                missCount++;
                logger.debug("Cache entry '{}' expired on lookup", key);
                eventDispatcher.fireOnRemoval(key, RemovalCause.EXPIRED);
                return Optional.empty();
            }

            entry.recordAccess(now);
            hitCount++;
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> clazz) {
        Optional<Object> value = get(key);
        if (value.isPresent() && !clazz.isInstance(value.get())) {
            throw new FetchCacheException("Cached value for key '" + key + "' is a "
                + value.get().getClass().getName() + ", not a " + clazz.getName());
        }
        return value.map(clazz::cast);
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        validateKey(key);
        if (value == null) {
            throw new FetchCacheException("Cache value cannot be null");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new FetchCacheException("TTL cannot be null or negative");
        }

        lock.lock();
        try {
            if (entries.size() >= maxEntries && !entries.containsKey(key)) {
                evictLeastRecentlyUsed();
            }
            entries.put(key, new CacheEntry(value, clock.millis(), ttl));
            putCount++;
            eventDispatcher.fireOnPut(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry with the smallest last-access time. Must be called with the lock held.
     */
    private void evictLeastRecentlyUsed() {
        String oldestKey = null;
        long oldestAccess = Long.MAX_VALUE;

        for (Map.Entry<String, CacheEntry> candidate : entries.entrySet()) {
            long lastAccessedAt = candidate.getValue().getLastAccessedAt();
            if (lastAccessedAt < oldestAccess) {
                oldestAccess = lastAccessedAt;
                oldestKey = candidate.getKey();
            }
        }

        if (oldestKey != null) {
            entries.remove(oldestKey);
            evictionCount++;
            logger.debug("Evicted least recently used key '{}' (capacity {})", oldestKey, maxEntries);
            eventDispatcher.fireOnRemoval(oldestKey, RemovalCause.SIZE);
        }
    }

    @Override
    public boolean evict(String key) {
        validateKey(key);

        lock.lock();
        try {
            boolean removed = entries.remove(key) != null;
            if (removed) {
                eventDispatcher.fireOnRemoval(key, RemovalCause.EXPLICIT);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hitCount = 0;
            missCount = 0;
            putCount = 0;
            evictionCount = 0;
            expiredCount = 0;
            eventDispatcher.fireOnClear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries whose TTL has elapsed, regardless of access order.
     *
     * @return the number of expired entries that were removed
     */
    @Override
    public int cleanupExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int deletedCount = 0;

            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> candidate = it.next();
                if (candidate.getValue().isExpired(now)) {
                    it.remove();
                    deletedCount++;
                    eventDispatcher.fireOnRemoval(candidate.getKey(), RemovalCause.EXPIRED);
                }
            }
            expiredCount += deletedCount;

            if (deletedCount > 0) {
                logger.info("Cleaned up {} expired cache entries", deletedCount);
            } else {
                logger.debug("No expired cache entries found during cleanup");
            }
            return deletedCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStatistics getStatistics() {
        Map<String, Object> snapshot;
        long hits;
        long misses;
        long puts;
        long evictions;
        long expired;

        lock.lock();
        try {
            snapshot = new LinkedHashMap<>(entries.size());
            for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
                snapshot.put(entry.getKey(), entry.getValue().getValue());
            }
            hits = hitCount;
            misses = missCount;
            puts = putCount;
            evictions = evictionCount;
            expired = expiredCount;
        } finally {
            lock.unlock();
        }

        long memoryUsage = 0;
        for (Map.Entry<String, Object> entry : snapshot.entrySet()) {
            memoryUsage += entry.getKey().length() * 2L;
            memoryUsage += serializedLength(entry.getValue()) * 2L;
            memoryUsage += CacheStatistics.ENTRY_OVERHEAD_BYTES;
        }

        return new CacheStatistics(hits, misses, puts, evictions, expired, snapshot.size(), memoryUsage);
    }

    @Override
    public CacheStatistics getCounters() {
        lock.lock();
        try {
            return new CacheStatistics(hitCount, missCount, putCount, evictionCount, expiredCount,
                                       entries.size(), 0);
        } finally {
            lock.unlock();
        }
    }

    private long serializedLength(Object value) {
        try {
            return objectMapper.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            logger.debug("Value of type {} is not JSON serializable, using toString() for size estimate",
                value.getClass().getName());
            return String.valueOf(value).length();
        }
    }

    /**
     * Returns a copy of the entry for a key without recording an access.
     * Expired entries are returned as they are.
     *
     * @param key the cache key
     * @return a detached copy of the entry, if present
     */
    public Optional<CacheEntry> peekEntry(String key) {
        validateKey(key);

        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.copy());
        } finally {
            lock.unlock();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new FetchCacheException("Cache key cannot be null or empty");
        }
    }

    /**
     * Creates a builder for InMemoryCacheStore.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for InMemoryCacheStore.
     */
    public static class Builder {
        private int maxEntries = DEFAULT_MAX_ENTRIES;
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper;
        private boolean enableBackgroundCleanup = false;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private final List<CacheEventListener> listeners = new ArrayList<>();

        private Builder() {
            this.objectMapper = new ObjectMapper();
        }

        /**
         * Sets the maximum number of entries.
         *
         * @param maxEntries capacity, must be positive
         * @return this builder
         */
        public Builder maxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        /**
         * Sets the clock used for creation, access and expiry timestamps.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the object mapper used to estimate the serialized size of values.
         *
         * @param objectMapper the object mapper
         * @return this builder
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Enables background cleanup of expired entries.
         *
         * @param enableBackgroundCleanup true to enable background cleanup
         * @return this builder
         */
        public Builder enableBackgroundCleanup(boolean enableBackgroundCleanup) {
            this.enableBackgroundCleanup = enableBackgroundCleanup;
            return this;
        }

        /**
         * Sets the interval for background cleanup.
         *
         * @param cleanupInterval time between two sweeps
         * @return this builder
         */
        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        /**
         * Registers a listener for put, removal and clear events.
         *
         * @param listener the listener
         * @return this builder
         */
        public Builder eventListener(CacheEventListener listener) {
            this.listeners.add(listener);
            return this;
        }

        /**
         * Builds a new InMemoryCacheStore instance.
         *
         * @return a new InMemoryCacheStore instance
         * @throws IllegalArgumentException if the capacity or the cleanup interval is invalid
         */
        public InMemoryCacheStore build() {
            if (clock == null) {
                throw new IllegalArgumentException("Clock must be set");
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            if (enableBackgroundCleanup
                && (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero())) {
                throw new IllegalArgumentException("Cleanup interval must be positive");
            }
            return new InMemoryCacheStore(maxEntries, clock, objectMapper,
                                          enableBackgroundCleanup, cleanupInterval, listeners);
        }
    }

    /**
     * Implementation of AutoCloseable for try-with-resources support.
     */
    @Override
    public void close() {
        shutdown();
    }

    /**
     * Starts the background cleanup task.
     */
    private void startBackgroundCleanup() {
        if (cleanupExecutor == null || cleanupExecutor.isShutdown()) {
            cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "fetchcache-cleanup");
                t.setDaemon(true);
                return t;
            });

            long intervalMillis = cleanupInterval.toMillis();
            cleanupExecutor.scheduleWithFixedDelay(() -> {
                try {
                    cleanupExpired();
                } catch (Exception e) {
                    logger.warn("Background cleanup failed", e);
                }
            }, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

            logger.info("Started background cleanup with interval: {}", cleanupInterval);
        }
    }

    /**
     * Stops the background cleanup task. Entries are kept.
     */
    public void shutdown() {
        if (cleanupExecutor != null && !cleanupExecutor.isShutdown()) {
            cleanupExecutor.shutdown();
            try {
                if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    cleanupExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cleanupExecutor.shutdownNow();
            }
            logger.info("Background cleanup shutdown completed");
        }
    }

    /**
     * Returns whether the background sweep is scheduled and running.
     */
    public boolean isBackgroundCleanupRunning() {
        return enableBackgroundCleanup && cleanupExecutor != null && !cleanupExecutor.isShutdown();
    }
}
