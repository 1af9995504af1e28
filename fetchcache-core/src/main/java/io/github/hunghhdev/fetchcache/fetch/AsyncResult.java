package io.github.hunghhdev.fetchcache.fetch;

import java.util.Objects;

/**
 * Outcome of one fetch attempt. Failures are carried as data so that batch and composite
 * operations can report partial success.
 *
 * @param <T> the value type
 */
public final class AsyncResult<T> {

    private final boolean success;
    private final T value;
    private final String errorMessage;
    private final FailureKind failureKind;
    private final long elapsedMs;
    private final boolean fromCache;

    private AsyncResult(boolean success, T value, String errorMessage, FailureKind failureKind,
                        long elapsedMs, boolean fromCache) {
        this.success = success;
        this.value = value;
        this.errorMessage = errorMessage;
        this.failureKind = failureKind;
        this.elapsedMs = elapsedMs;
        this.fromCache = fromCache;
    }

    public static <T> AsyncResult<T> success(T value, long elapsedMs) {
        return new AsyncResult<>(true, Objects.requireNonNull(value, "value"), null, null, elapsedMs, false);
    }

    /**
     * A value served from the cache; elapsed time is reported as zero.
     */
    public static <T> AsyncResult<T> cached(T value) {
        return new AsyncResult<>(true, Objects.requireNonNull(value, "value"), null, null, 0, true);
    }

    public static <T> AsyncResult<T> failure(FailureKind kind, String errorMessage, long elapsedMs) {
        return new AsyncResult<>(false, null, Objects.requireNonNull(errorMessage, "errorMessage"),
            Objects.requireNonNull(kind, "kind"), elapsedMs, false);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Returns the fetched value, or {@code null} for a failure.
     */
    public T getValue() {
        return value;
    }

    /**
     * Returns the failure message, or {@code null} for a success.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Returns the failure kind, or {@code null} for a success.
     */
    public FailureKind getFailureKind() {
        return failureKind;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    @Override
    public String toString() {
        if (success) {
            return "AsyncResult{success, elapsedMs=" + elapsedMs + ", fromCache=" + fromCache + "}";
        }
        return "AsyncResult{" + failureKind + ": " + errorMessage + ", elapsedMs=" + elapsedMs + "}";
    }
}
