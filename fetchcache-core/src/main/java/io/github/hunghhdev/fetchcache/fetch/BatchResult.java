package io.github.hunghhdev.fetchcache.fetch;

import java.util.Collections;
import java.util.List;

/**
 * Results of several fetches, in the order the requests were given, with aggregate counts.
 *
 * @param <T> the value type
 */
public final class BatchResult<T> {

    private final List<AsyncResult<T>> results;
    private final long totalElapsedMs;
    private final int successCount;
    private final int errorCount;
    private final double cacheHitRate;

    BatchResult(List<AsyncResult<T>> results, long totalElapsedMs) {
        this.results = Collections.unmodifiableList(results);
        this.totalElapsedMs = totalElapsedMs;

        int successes = 0;
        int hits = 0;
        for (AsyncResult<T> result : results) {
            if (result.isSuccess()) {
                successes++;
            }
            if (result.isFromCache()) {
                hits++;
            }
        }
        this.successCount = successes;
        this.errorCount = results.size() - successes;
        this.cacheHitRate = results.isEmpty() ? 0.0 : (double) hits / results.size();
    }

    public List<AsyncResult<T>> getResults() {
        return results;
    }

    public AsyncResult<T> get(int index) {
        return results.get(index);
    }

    public int size() {
        return results.size();
    }

    /**
     * Wall-clock time from before the first fetch started to after the last one finished.
     */
    public long getTotalElapsedMs() {
        return totalElapsedMs;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    /**
     * Fraction of results served from the cache, whether or not they succeeded.
     */
    public double getCacheHitRate() {
        return cacheHitRate;
    }

    @Override
    public String toString() {
        return String.format("BatchResult{size=%d, success=%d, errors=%d, cacheHitRate=%.2f, elapsedMs=%d}",
            results.size(), successCount, errorCount, cacheHitRate, totalElapsedMs);
    }
}
