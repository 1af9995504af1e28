package io.github.hunghhdev.fetchcache.core;

/**
 * Point-in-time cache statistics for monitoring cache performance.
 *
 * <p>{@code memoryUsageBytes} is an estimate: for each entry, two bytes per key character,
 * two bytes per character of the value's JSON form, plus a fixed per-entry overhead.</p>
 */
public class CacheStatistics {

    /**
     * Fixed per-entry overhead added to the memory estimate.
     */
    public static final long ENTRY_OVERHEAD_BYTES = 32;

    private final long hitCount;
    private final long missCount;
    private final long putCount;
    private final long evictionCount;
    private final long expiredCount;
    private final int size;
    private final long memoryUsageBytes;

    public CacheStatistics(long hitCount, long missCount, long putCount, long evictionCount,
                           long expiredCount, int size, long memoryUsageBytes) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.putCount = putCount;
        this.evictionCount = evictionCount;
        this.expiredCount = expiredCount;
        this.size = size;
        this.memoryUsageBytes = memoryUsageBytes;
    }

    /**
     * Returns the number of cache hits.
     */
    public long getHitCount() {
        return hitCount;
    }

    /**
     * Returns the number of cache misses, expired lookups included.
     */
    public long getMissCount() {
        return missCount;
    }

    /**
     * Returns the number of put operations.
     */
    public long getPutCount() {
        return putCount;
    }

    /**
     * Returns the number of entries removed to respect the size limit.
     */
    public long getEvictionCount() {
        return evictionCount;
    }

    /**
     * Returns the number of entries removed because their TTL elapsed.
     */
    public long getExpiredCount() {
        return expiredCount;
    }

    /**
     * Returns the number of entries held when the snapshot was taken.
     */
    public int getSize() {
        return size;
    }

    /**
     * Returns the approximate memory footprint of the entries in bytes.
     */
    public long getMemoryUsageBytes() {
        return memoryUsageBytes;
    }

    /**
     * Returns the total number of requests (hits + misses).
     */
    public long getRequestCount() {
        return hitCount + missCount;
    }

    /**
     * Returns the hit rate as a value between 0.0 and 1.0.
     * Returns 0.0 if there are no requests.
     */
    public double getHitRate() {
        long total = getRequestCount();
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns the miss rate as a value between 0.0 and 1.0.
     * Returns 0.0 if there are no requests.
     */
    public double getMissRate() {
        long total = getRequestCount();
        return total == 0 ? 0.0 : (double) missCount / total;
    }

    @Override
    public String toString() {
        return String.format(
            "CacheStatistics{hits=%d, misses=%d, hitRate=%.2f%%, puts=%d, evictions=%d, expired=%d, size=%d, memory=%dB}",
            hitCount, missCount, getHitRate() * 100, putCount, evictionCount, expiredCount, size, memoryUsageBytes
        );
    }
}
