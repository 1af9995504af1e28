package io.github.hunghhdev.fetchcache.fetch;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hunghhdev.fetchcache.core.CacheClient;
import io.github.hunghhdev.fetchcache.core.CacheEventListener;
import io.github.hunghhdev.fetchcache.core.CacheStatistics;
import io.github.hunghhdev.fetchcache.core.InMemoryCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FetchOrchestrator: cache-aware, timeout-bounded fetching of clinic data from a set of
 * independent entity sources, one at a time, in concurrency-bounded batches, or as composite
 * requests issued fully in parallel.
 *
 * <p>Individual failures never abort a batch or a composite request; they are reported as
 * failed {@link AsyncResult}s and counted in the aggregate.</p>
 *
 * <p>Instances are created with {@link #builder()} and should be closed when no longer needed,
 * which stops the executors they created and the cache's background cleanup.</p>
 */
public class FetchOrchestrator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

    public static final String FIELD_CUSTOMER = "customer";
    public static final String FIELD_APPOINTMENTS = "appointments";
    public static final String FIELD_TREATMENT_HISTORY = "treatmentHistory";
    public static final String FIELD_SATISFACTION = "satisfaction";

    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final CacheClient cache;
    private final boolean ownsCache;
    private final int maxConcurrency;
    private final Duration defaultTtl;
    private final ExecutorService fetchExecutor;
    private final ExecutorService workerExecutor;
    private final boolean ownsExecutors;
    private final Map<EntityType, CachedFetcher<?>> fetchers = new EnumMap<>(EntityType.class);
    private final Map<EntityType, Duration> ttls = new EnumMap<>(EntityType.class);

    private FetchOrchestrator(Builder builder, CacheClient cache, boolean ownsCache,
                              ExecutorService fetchExecutor, ExecutorService workerExecutor,
                              boolean ownsExecutors) {
        this.cache = cache;
        this.ownsCache = ownsCache;
        this.maxConcurrency = builder.maxConcurrency;
        this.defaultTtl = builder.defaultTtl;
        this.fetchExecutor = fetchExecutor;
        this.workerExecutor = workerExecutor;
        this.ownsExecutors = ownsExecutors;

        OperationRunner runner = new OperationRunner(workerExecutor, builder.operationTimeout);
        for (EntityType type : EntityType.values()) {
            Duration ttl = builder.ttlOverrides.getOrDefault(type, type.ttlOrDefault(defaultTtl));
            ttls.put(type, ttl);
            builder.sources.find(type).ifPresent(source -> fetchers.put(type, newFetcher(type, source, ttl, runner)));
        }

        logger.info("Created FetchOrchestrator: maxConcurrency={}, operationTimeout={}, defaultTtl={}, sources={}",
            maxConcurrency, builder.operationTimeout, defaultTtl, fetchers.keySet());
    }

    private <T> CachedFetcher<T> newFetcher(EntityType type, EntitySource<T> source, Duration ttl,
                                            OperationRunner runner) {
        return new CachedFetcher<>(type, source, ttl, cache, runner);
    }

    // ==================== Single fetches ====================

    /**
     * Fetches one entity, from the cache when a fresh value is held.
     *
     * @param request the entity to fetch
     * @return the outcome; never throws for source failures or timeouts
     */
    @SuppressWarnings("unchecked")
    public <T> AsyncResult<T> fetch(FetchRequest request) {
        Objects.requireNonNull(request, "request");
        CachedFetcher<T> fetcher = (CachedFetcher<T>) fetchers.get(request.getType());
        if (fetcher == null) {
            return AsyncResult.failure(FailureKind.FAILURE, "No source registered for " + request.getType(), 0);
        }
        try {
            return fetcher.fetch(request);
        } catch (RuntimeException e) {
            logger.warn("Unexpected error fetching '{}': {}", request, e.getMessage(), e);
            return AsyncResult.failure(FailureKind.FAILURE, OperationRunner.describe(e), 0);
        }
    }

    public <T> AsyncResult<T> fetchCustomer(String customerId) {
        return fetch(FetchRequest.customer(customerId));
    }

    public <T> AsyncResult<T> fetchAppointments(String customerId) {
        return fetch(FetchRequest.appointments(customerId));
    }

    public <T> AsyncResult<T> fetchTreatmentHistory(String customerId) {
        return fetch(FetchRequest.treatmentHistory(customerId));
    }

    public <T> AsyncResult<T> fetchSatisfaction(String customerId) {
        return fetch(FetchRequest.satisfaction(customerId));
    }

    public <T> AsyncResult<T> fetchTreatmentsByConcern(String concern) {
        return fetch(FetchRequest.treatmentsByConcern(concern));
    }

    public <T> AsyncResult<T> fetchTreatmentsBySkinType(String skinType) {
        return fetch(FetchRequest.treatmentsBySkinType(skinType));
    }

    public <T> AsyncResult<T> fetchTimeSlots(String date, String treatmentId) {
        return fetch(FetchRequest.timeSlots(date, treatmentId));
    }

    public <T> AsyncResult<T> fetchReviews(String treatmentId) {
        return fetch(FetchRequest.reviews(treatmentId));
    }

    public <T> AsyncResult<T> fetchAverageRating(String treatmentId) {
        return fetch(FetchRequest.averageRating(treatmentId));
    }

    // ==================== Batches ====================

    /**
     * Fetches all requests in groups of at most {@code maxConcurrency}.
     *
     * @see #fetchBatch(List, int)
     */
    public <T> BatchResult<T> fetchBatch(List<FetchRequest> requests) {
        return fetchBatch(requests, maxConcurrency);
    }

    /**
     * Fetches all requests in consecutive groups of at most {@code concurrency} items. Each group
     * runs fully in parallel and completes, successes and failures alike, before the next starts.
     *
     * @param requests the entities to fetch
     * @param concurrency the largest number of fetches in flight at once
     * @return one result per request, in request order
     */
    public <T> BatchResult<T> fetchBatch(List<FetchRequest> requests, int concurrency) {
        Objects.requireNonNull(requests, "requests");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }

        long start = System.nanoTime();
        List<AsyncResult<T>> results = new ArrayList<>(requests.size());

        for (int from = 0; from < requests.size(); from += concurrency) {
            List<FetchRequest> group = requests.subList(from, Math.min(from + concurrency, requests.size()));
            List<CompletableFuture<AsyncResult<T>>> futures = new ArrayList<>(group.size());
            for (FetchRequest request : group) {
                futures.add(launch(request, request.toString()));
            }
            for (CompletableFuture<AsyncResult<T>> future : futures) {
                results.add(future.join());
            }
        }

        BatchResult<T> batch = new BatchResult<>(results, elapsedMs(start));
        logger.debug("Batch of {} in groups of {} completed: {}", requests.size(), concurrency, batch);
        return batch;
    }

    /**
     * Fetches all requests at once, without grouping.
     *
     * @param requests the entities to fetch
     * @return one result per request, in request order
     */
    public <T> BatchResult<T> fetchParallel(List<FetchRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        long start = System.nanoTime();

        List<CompletableFuture<AsyncResult<T>>> futures = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            futures.add(launch(requests.get(i), "Query " + i));
        }
        return new BatchResult<>(joinAll(futures), elapsedMs(start));
    }

    /**
     * Fetches heterogeneous entities fully in parallel. A failure in one field does not affect
     * the others.
     *
     * @param requests field name to request, iteration order is kept in the result
     * @return the per-field results with aggregate hit rate and elapsed time
     */
    public CompositeResult fetchCompositeParallel(Map<String, FetchRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        long start = System.nanoTime();

        Map<String, CompletableFuture<AsyncResult<Object>>> futures = new LinkedHashMap<>();
        requests.forEach((field, request) -> futures.put(field, launch(request, field)));

        LinkedHashMap<String, AsyncResult<?>> results = new LinkedHashMap<>();
        futures.forEach((field, future) -> results.put(field, future.join()));

        CompositeResult composite = new CompositeResult(results, elapsedMs(start));
        logger.debug("Composite fetch completed: {}", composite);
        return composite;
    }

    // ==================== Composite operations ====================

    /**
     * Fetches several customer profiles in groups of at most {@code maxConcurrency}.
     */
    public <T> BatchResult<T> fetchCustomers(List<String> customerIds) {
        List<FetchRequest> requests = new ArrayList<>(customerIds.size());
        for (String customerId : customerIds) {
            requests.add(FetchRequest.customer(customerId));
        }
        return fetchBatch(requests);
    }

    /**
     * Fetches a customer's profile, appointments, treatment history and satisfaction records in
     * parallel, under the fields {@link #FIELD_CUSTOMER}, {@link #FIELD_APPOINTMENTS},
     * {@link #FIELD_TREATMENT_HISTORY} and {@link #FIELD_SATISFACTION}.
     */
    public CompositeResult fetchCustomerCompleteData(String customerId) {
        Map<String, FetchRequest> requests = new LinkedHashMap<>();
        requests.put(FIELD_CUSTOMER, FetchRequest.customer(customerId));
        requests.put(FIELD_APPOINTMENTS, FetchRequest.appointments(customerId));
        requests.put(FIELD_TREATMENT_HISTORY, FetchRequest.treatmentHistory(customerId));
        requests.put(FIELD_SATISFACTION, FetchRequest.satisfaction(customerId));
        return fetchCompositeParallel(requests);
    }

    /**
     * Fetches treatments for every concern, then for every skin type, all in parallel.
     * Results are ordered concerns first.
     */
    public <T> BatchResult<T> fetchTreatmentRecommendations(List<String> concerns, List<String> skinTypes) {
        List<FetchRequest> requests = new ArrayList<>(concerns.size() + skinTypes.size());
        for (String concern : concerns) {
            requests.add(FetchRequest.treatmentsByConcern(concern));
        }
        for (String skinType : skinTypes) {
            requests.add(FetchRequest.treatmentsBySkinType(skinType));
        }
        return fetchParallel(requests);
    }

    /**
     * Fetches available time slots for every (date, treatment) pair in parallel, date-major.
     */
    public <T> BatchResult<T> fetchAvailableTimeSlots(List<String> dates, List<String> treatmentIds) {
        List<FetchRequest> requests = new ArrayList<>(dates.size() * treatmentIds.size());
        for (String date : dates) {
            for (String treatmentId : treatmentIds) {
                requests.add(FetchRequest.timeSlots(date, treatmentId));
            }
        }
        return fetchParallel(requests);
    }

    /**
     * Fetches the reviews and the average rating of every treatment, all at once. Each
     * {@link BatchResult} reports the time until its own fetches completed.
     */
    public <R, A> ReviewsAndRatings<R, A> fetchReviewsAndRatings(List<String> treatmentIds) {
        long start = System.nanoTime();

        List<CompletableFuture<AsyncResult<R>>> reviewFutures = new ArrayList<>(treatmentIds.size());
        List<CompletableFuture<AsyncResult<A>>> ratingFutures = new ArrayList<>(treatmentIds.size());
        for (String treatmentId : treatmentIds) {
            FetchRequest reviews = FetchRequest.reviews(treatmentId);
            FetchRequest rating = FetchRequest.averageRating(treatmentId);
            reviewFutures.add(launch(reviews, reviews.toString()));
            ratingFutures.add(launch(rating, rating.toString()));
        }

        CompletableFuture<BatchResult<R>> reviews = whenAllDone(reviewFutures, start);
        CompletableFuture<BatchResult<A>> ratings = whenAllDone(ratingFutures, start);
        return new ReviewsAndRatings<>(reviews.join(), ratings.join(), elapsedMs(start));
    }

    // ==================== Cache management ====================

    /**
     * Drops the cached value for one entity so that the next fetch goes to the source.
     *
     * @return true if a value was cached
     */
    public boolean invalidate(FetchRequest request) {
        return cache.evict(request.cacheKey());
    }

    /**
     * Returns a statistics snapshot of the underlying cache.
     */
    public CacheStatistics getStats() {
        return cache.getStatistics();
    }

    /**
     * Removes every cached value and resets the statistics.
     */
    public void clearCache() {
        cache.clear();
    }

    /**
     * Returns the TTL applied to fetched values of the given type.
     */
    public Duration getTtl(EntityType type) {
        return ttls.get(type);
    }

    /**
     * Returns the entity types that have a source.
     */
    public Set<EntityType> getRegisteredTypes() {
        return Collections.unmodifiableSet(fetchers.keySet());
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public CacheClient getCache() {
        return cache;
    }

    // ==================== Internals ====================

    private <T> CompletableFuture<AsyncResult<T>> launch(FetchRequest request, String identifier) {
        CompletableFuture<AsyncResult<T>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.<T>fetch(request), fetchExecutor);
        } catch (RejectedExecutionException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((result, failure) -> {
            if (failure == null) {
                return result;
            }
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
            logger.warn("Fetch '{}' did not complete: {}", identifier, cause.toString());
            return AsyncResult.failure(FailureKind.FAILURE, identifier + ": " + OperationRunner.describe(cause), 0);
        });
    }

    // elapsed time is taken when the last of these futures completes, not when the caller joins
    private static <T> CompletableFuture<BatchResult<T>> whenAllDone(
            List<CompletableFuture<AsyncResult<T>>> futures, long startNanos) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> new BatchResult<>(joinAll(futures), elapsedMs(startNanos)));
    }

    private static <T> List<AsyncResult<T>> joinAll(List<CompletableFuture<AsyncResult<T>>> futures) {
        List<AsyncResult<T>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<AsyncResult<T>> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Stops the executors created by this orchestrator and the cache it created.
     * Executors and caches passed to the builder are left to their owner.
     */
    @Override
    public void close() {
        if (ownsExecutors) {
            shutdownExecutor(fetchExecutor);
            shutdownExecutor(workerExecutor);
        }
        if (ownsCache && cache instanceof AutoCloseable) {
            try {
                ((AutoCloseable) cache).close();
            } catch (Exception e) {
                logger.warn("Failed to close cache", e);
            }
        }
        logger.info("FetchOrchestrator closed");
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Creates a builder for FetchOrchestrator.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FetchOrchestrator.
     */
    public static class Builder {
        private EntitySources sources = EntitySources.create();
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Duration operationTimeout = DEFAULT_OPERATION_TIMEOUT;
        private Duration defaultTtl = DEFAULT_TTL;
        private int maxCacheEntries = InMemoryCacheStore.DEFAULT_MAX_ENTRIES;
        private boolean backgroundCleanup = true;
        private Duration cleanupInterval = InMemoryCacheStore.DEFAULT_CLEANUP_INTERVAL;
        private final Map<EntityType, Duration> ttlOverrides = new EnumMap<>(EntityType.class);
        private final List<CacheEventListener> eventListeners = new ArrayList<>();
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();
        private CacheClient cache;
        private ExecutorService fetchExecutor;
        private ExecutorService workerExecutor;

        private Builder() {
        }

        /**
         * Sets all entity sources at once, replacing sources registered with {@link #source}.
         * The registry is copied, later calls to {@link #source} do not modify {@code sources}.
         */
        public Builder sources(EntitySources sources) {
            this.sources = EntitySources.copyOf(sources);
            return this;
        }

        /**
         * Registers the source for one entity type.
         */
        public Builder source(EntityType type, EntitySource<?> source) {
            this.sources.register(type, source);
            return this;
        }

        /**
         * Sets the default group size of {@link #fetchBatch(List)}.
         */
        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        /**
         * Sets how long a single source call may run before it is cancelled.
         */
        public Builder operationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        /**
         * Sets the TTL of entity types without a TTL of their own (customer profiles).
         */
        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        /**
         * Overrides the TTL of one entity type.
         */
        public Builder ttl(EntityType type, Duration ttl) {
            this.ttlOverrides.put(Objects.requireNonNull(type, "type"), ttl);
            return this;
        }

        /**
         * Sets the capacity of the cache created by this builder.
         */
        public Builder maxCacheEntries(int maxCacheEntries) {
            this.maxCacheEntries = maxCacheEntries;
            return this;
        }

        /**
         * Enables or disables the periodic expiry sweep of the cache created by this builder.
         */
        public Builder backgroundCleanup(boolean backgroundCleanup) {
            this.backgroundCleanup = backgroundCleanup;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder eventListener(CacheEventListener listener) {
            this.eventListeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Uses an existing cache instead of creating one. The cache settings of this builder
         * (capacity, cleanup, clock, object mapper, listeners) are then ignored, and
         * {@link FetchOrchestrator#close()} leaves the cache open.
         */
        public Builder cache(CacheClient cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Uses caller-owned executors: {@code fetchExecutor} coordinates parallel fetches and
         * {@code workerExecutor} runs the source calls. They must be distinct, since
         * coordinating tasks block while waiting on worker tasks.
         */
        public Builder executors(ExecutorService fetchExecutor, ExecutorService workerExecutor) {
            this.fetchExecutor = fetchExecutor;
            this.workerExecutor = workerExecutor;
            return this;
        }

        /**
         * Builds a new FetchOrchestrator instance.
         *
         * @return a new FetchOrchestrator instance
         * @throws IllegalArgumentException if a setting is out of range
         */
        public FetchOrchestrator build() {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
            }
            if (operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()) {
                throw new IllegalArgumentException("operationTimeout must be positive");
            }
            if (defaultTtl == null || defaultTtl.isNegative()) {
                throw new IllegalArgumentException("defaultTtl cannot be null or negative");
            }
            if (maxCacheEntries <= 0) {
                throw new IllegalArgumentException("maxCacheEntries must be positive: " + maxCacheEntries);
            }
            ttlOverrides.forEach((type, ttl) -> {
                if (ttl == null || ttl.isNegative()) {
                    throw new IllegalArgumentException("TTL for " + type + " cannot be null or negative");
                }
            });
            if ((fetchExecutor == null) != (workerExecutor == null)) {
                throw new IllegalArgumentException("Both executors must be set, or neither");
            }
            if (fetchExecutor != null && fetchExecutor == workerExecutor) {
                throw new IllegalArgumentException("fetchExecutor and workerExecutor must be distinct");
            }

            boolean ownsCache = cache == null;
            CacheClient effectiveCache = cache;
            if (ownsCache) {
                InMemoryCacheStore.Builder storeBuilder = InMemoryCacheStore.builder()
                    .maxEntries(maxCacheEntries)
                    .clock(clock)
                    .enableBackgroundCleanup(backgroundCleanup)
                    .cleanupInterval(cleanupInterval);
                if (objectMapper != null) {
                    storeBuilder.objectMapper(objectMapper);
                }
                eventListeners.forEach(storeBuilder::eventListener);
                effectiveCache = storeBuilder.build();
            }

            boolean ownsExecutors = fetchExecutor == null;
            ExecutorService effectiveFetchExecutor = ownsExecutors
                ? Executors.newCachedThreadPool(daemonThreads("fetchcache-fetch")) : fetchExecutor;
            ExecutorService effectiveWorkerExecutor = ownsExecutors
                ? Executors.newCachedThreadPool(daemonThreads("fetchcache-worker")) : workerExecutor;

            return new FetchOrchestrator(this, effectiveCache, ownsCache,
                effectiveFetchExecutor, effectiveWorkerExecutor, ownsExecutors);
        }
    }
}
