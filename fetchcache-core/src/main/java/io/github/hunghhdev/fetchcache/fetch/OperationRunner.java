package io.github.hunghhdev.fetchcache.fetch;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single data-source call on a worker executor, bounded by a timeout, and reports the
 * outcome as an {@link AsyncResult} with the measured elapsed time.
 *
 * <p>When the timeout elapses first, the call is cancelled with interruption and its eventual
 * result, if any, is discarded.</p>
 */
public class OperationRunner {
    private static final Logger logger = LoggerFactory.getLogger(OperationRunner.class);

    static final String TIMEOUT_MESSAGE = "Operation timeout";

    private final ExecutorService executor;
    private final Duration timeout;

    public OperationRunner(ExecutorService executor, Duration timeout) {
        if (executor == null) {
            throw new IllegalArgumentException("Executor must be set");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Operation timeout must be positive");
        }
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Executes the operation and waits at most the configured timeout for it.
     *
     * @param operation the data-source call
     * @return a success carrying the value, or a failure; never {@code fromCache}
     */
    public <T> AsyncResult<T> execute(Callable<T> operation) {
        long start = System.nanoTime();

        Future<T> future;
        try {
            future = executor.submit(operation);
        } catch (RejectedExecutionException e) {
            logger.warn("Operation rejected by worker executor: {}", e.getMessage());
            return AsyncResult.failure(FailureKind.FAILURE, "Operation rejected by worker executor",
                elapsedMs(start));
        }

        try {
            T value = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (value == null) {
                return AsyncResult.failure(FailureKind.FAILURE, "Operation returned no value", elapsedMs(start));
            }
            return AsyncResult.success(value, elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsed = elapsedMs(start);
            logger.debug("Operation timed out after {} ms and was cancelled", elapsed);
            return AsyncResult.failure(FailureKind.TIMEOUT, TIMEOUT_MESSAGE, elapsed);
        } catch (ExecutionException e) {
            return AsyncResult.failure(FailureKind.FAILURE, describe(e.getCause()), elapsedMs(start));
        } catch (CancellationException e) {
            return AsyncResult.failure(FailureKind.FAILURE, "Operation cancelled", elapsedMs(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AsyncResult.failure(FailureKind.FAILURE, "Interrupted while waiting for operation",
                elapsedMs(start));
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    static String describe(Throwable failure) {
        if (failure == null) {
            return "Unknown error";
        }
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getName();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
