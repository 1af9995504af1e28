package io.github.hunghhdev.fetchcache.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named results of a set of heterogeneous fetches issued in parallel.
 * A failed field is still present, as a failure result.
 */
public final class CompositeResult {

    private final Map<String, AsyncResult<?>> fields;
    private final long elapsedMs;
    private final int successCount;
    private final double cacheHitRate;

    CompositeResult(LinkedHashMap<String, AsyncResult<?>> fields, long elapsedMs) {
        this.fields = Collections.unmodifiableMap(fields);
        this.elapsedMs = elapsedMs;

        int successes = 0;
        int hits = 0;
        for (AsyncResult<?> result : fields.values()) {
            if (result.isSuccess()) {
                successes++;
            }
            if (result.isFromCache()) {
                hits++;
            }
        }
        this.successCount = successes;
        this.cacheHitRate = fields.isEmpty() ? 0.0 : (double) hits / fields.size();
    }

    /**
     * Returns the result for a field.
     *
     * @throws IllegalArgumentException if no request was issued under that name
     */
    @SuppressWarnings("unchecked")
    public <T> AsyncResult<T> get(String field) {
        AsyncResult<?> result = fields.get(field);
        if (result == null) {
            throw new IllegalArgumentException("Unknown field: " + field);
        }
        return (AsyncResult<T>) result;
    }

    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    public Map<String, AsyncResult<?>> getFields() {
        return fields;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return fields.size() - successCount;
    }

    public double getCacheHitRate() {
        return cacheHitRate;
    }

    @Override
    public String toString() {
        return String.format("CompositeResult{fields=%s, success=%d, errors=%d, cacheHitRate=%.2f, elapsedMs=%d}",
            fields.keySet(), successCount, getErrorCount(), cacheHitRate, elapsedMs);
    }
}
