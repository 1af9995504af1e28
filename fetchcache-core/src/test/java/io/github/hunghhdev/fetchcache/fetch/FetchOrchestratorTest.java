package io.github.hunghhdev.fetchcache.fetch;

import io.github.hunghhdev.fetchcache.core.CacheEventListener;
import io.github.hunghhdev.fetchcache.core.CacheStatistics;
import io.github.hunghhdev.fetchcache.core.InMemoryCacheStore;
import io.github.hunghhdev.fetchcache.core.MutableClock;
import io.github.hunghhdev.fetchcache.core.RemovalCause;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FetchOrchestratorTest {

    @Mock
    private EntitySource<String> customerSource;

    private MutableClock clock;
    private FetchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private FetchOrchestrator.Builder baseBuilder() {
        return FetchOrchestrator.builder()
                .clock(clock)
                .backgroundCleanup(false)
                .operationTimeout(Duration.ofSeconds(5));
    }

    private static EntitySource<String> echo() {
        return FetchRequest::cacheKey;
    }

    @Test
    void testFetch_CachesUntilTtlElapses() throws Exception {
        when(customerSource.load(any())).thenReturn("Kim");
        orchestrator = baseBuilder()
                .maxCacheEntries(100)
                .defaultTtl(Duration.ofMillis(5000))
                .source(EntityType.CUSTOMER, customerSource)
                .build();

        AsyncResult<String> first = orchestrator.fetchCustomer("c1");
        assertTrue(first.isSuccess());
        assertFalse(first.isFromCache());
        assertEquals("Kim", first.getValue());

        AsyncResult<String> second = orchestrator.fetchCustomer("c1");
        assertTrue(second.isSuccess());
        assertTrue(second.isFromCache());
        assertEquals(0, second.getElapsedMs());
        assertEquals("Kim", second.getValue());

        clock.advance(Duration.ofMillis(6000));

        AsyncResult<String> third = orchestrator.fetchCustomer("c1");
        assertTrue(third.isSuccess());
        assertFalse(third.isFromCache());

        verify(customerSource, times(2)).load(FetchRequest.customer("c1"));
    }

    @Test
    void testFetch_HitRateIncreasesOnRepeat() throws Exception {
        when(customerSource.load(any())).thenReturn("Kim");
        orchestrator = baseBuilder().source(EntityType.CUSTOMER, customerSource).build();

        orchestrator.fetchCustomer("c1");
        double afterMiss = orchestrator.getStats().getHitRate();
        orchestrator.fetchCustomer("c1");
        double afterHit = orchestrator.getStats().getHitRate();

        assertEquals(0.0, afterMiss);
        assertEquals(0.5, afterHit, 0.0001);
    }

    @Test
    void testFetch_FailureIsNotCached() throws Exception {
        when(customerSource.load(any()))
                .thenThrow(new IOException("Customer service unavailable"))
                .thenReturn("Kim");
        orchestrator = baseBuilder().source(EntityType.CUSTOMER, customerSource).build();

        AsyncResult<String> failed = orchestrator.fetchCustomer("c1");
        assertFalse(failed.isSuccess());
        assertFalse(failed.isFromCache());
        assertEquals(FailureKind.FAILURE, failed.getFailureKind());
        assertEquals("Customer service unavailable", failed.getErrorMessage());
        assertEquals(0, orchestrator.getStats().getSize());

        AsyncResult<String> retried = orchestrator.fetchCustomer("c1");
        assertTrue(retried.isSuccess());
        assertFalse(retried.isFromCache());
        assertEquals(1, orchestrator.getStats().getSize());
    }

    @Test
    void testFetch_NullValueIsFailure() throws Exception {
        when(customerSource.load(any())).thenReturn(null);
        orchestrator = baseBuilder().source(EntityType.CUSTOMER, customerSource).build();

        AsyncResult<String> result = orchestrator.fetchCustomer("c1");

        assertFalse(result.isSuccess());
        assertEquals("Operation returned no value", result.getErrorMessage());
        assertEquals(0, orchestrator.getStats().getSize());
    }

    @Test
    void testFetch_Timeout() {
        orchestrator = baseBuilder()
                .operationTimeout(Duration.ofMillis(100))
                .source(EntityType.APPOINTMENTS, request -> {
                    Thread.sleep(5000);
                    return "late";
                })
                .build();

        AsyncResult<String> result = orchestrator.fetchAppointments("c1");

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.TIMEOUT, result.getFailureKind());
        assertEquals("Operation timeout", result.getErrorMessage());
        assertTrue(result.getElapsedMs() >= 100);
        assertEquals(0, orchestrator.getStats().getSize());
    }

    @Test
    void testFetch_WithoutSource() {
        orchestrator = baseBuilder().build();

        AsyncResult<String> result = orchestrator.fetchAppointments("c1");

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.FAILURE, result.getFailureKind());
        assertEquals("No source registered for APPOINTMENTS", result.getErrorMessage());
    }

    @Test
    void testFetch_UsesTtlOfEntityType() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        orchestrator = baseBuilder()
                .source(EntityType.APPOINTMENTS, request -> "appointments-" + calls.incrementAndGet())
                .build();

        assertEquals("appointments-1", orchestrator.<String>fetchAppointments("c1").getValue());
        clock.advance(Duration.ofSeconds(59));
        assertTrue(orchestrator.fetchAppointments("c1").isFromCache());
        clock.advance(Duration.ofSeconds(2));
        assertEquals("appointments-2", orchestrator.<String>fetchAppointments("c1").getValue());
    }

    @Test
    void testTtlResolution() {
        orchestrator = baseBuilder()
                .defaultTtl(Duration.ofSeconds(5))
                .ttl(EntityType.REVIEWS, Duration.ofMinutes(2))
                .build();

        assertEquals(Duration.ofSeconds(5), orchestrator.getTtl(EntityType.CUSTOMER));
        assertEquals(Duration.ofMinutes(1), orchestrator.getTtl(EntityType.APPOINTMENTS));
        assertEquals(Duration.ofMinutes(10), orchestrator.getTtl(EntityType.TREATMENT_HISTORY));
        assertEquals(Duration.ofMinutes(30), orchestrator.getTtl(EntityType.TREATMENTS_BY_CONCERN));
        assertEquals(Duration.ofSeconds(30), orchestrator.getTtl(EntityType.TIME_SLOTS));
        assertEquals(Duration.ofMinutes(2), orchestrator.getTtl(EntityType.REVIEWS));
        assertEquals(Duration.ofMinutes(10), orchestrator.getTtl(EntityType.AVERAGE_RATING));
    }

    @Test
    void testFetchBatch_KeepsInputOrder() {
        orchestrator = baseBuilder()
                .source(EntityType.CUSTOMER, request -> {
                    // "a" finishes last
                    if ("a".equals(request.getDiscriminator())) {
                        Thread.sleep(150);
                    }
                    return request.getDiscriminator();
                })
                .build();

        BatchResult<String> batch = orchestrator.fetchBatch(Arrays.asList(
                FetchRequest.customer("a"), FetchRequest.customer("b"), FetchRequest.customer("c")), 3);

        assertEquals(3, batch.size());
        assertEquals("a", batch.get(0).getValue());
        assertEquals("b", batch.get(1).getValue());
        assertEquals("c", batch.get(2).getValue());
        assertEquals(3, batch.getSuccessCount());
        assertEquals(0, batch.getErrorCount());
        assertEquals(0.0, batch.getCacheHitRate());
    }

    @Test
    void testFetchCustomers_GroupsRunSequentially() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        orchestrator = baseBuilder()
                .maxConcurrency(2)
                .source(EntityType.CUSTOMER, request -> {
                    int current = inFlight.incrementAndGet();
                    maxInFlight.accumulateAndGet(current, Math::max);
                    try {
                        Thread.sleep(50);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                    return "profile-" + request.getDiscriminator();
                })
                .build();

        BatchResult<String> batch = orchestrator.fetchCustomers(List.of("c1", "c2", "c3", "c4", "c5"));

        assertEquals(5, batch.size());
        assertEquals(5, batch.getSuccessCount());
        for (int i = 0; i < 5; i++) {
            assertEquals("profile-c" + (i + 1), batch.get(i).getValue());
        }
        assertTrue(maxInFlight.get() <= 2, "max in flight was " + maxInFlight.get());
        // three groups of at most two, each waiting ~50ms
        assertTrue(batch.getTotalElapsedMs() >= 150, "elapsed was " + batch.getTotalElapsedMs());
    }

    @Test
    void testFetchBatch_FailureDoesNotAbortLaterGroups() {
        orchestrator = baseBuilder()
                .source(EntityType.CUSTOMER, request -> {
                    if ("c2".equals(request.getDiscriminator())) {
                        throw new IllegalStateException("c2 not found");
                    }
                    return request.getDiscriminator();
                })
                .build();

        BatchResult<String> batch = orchestrator.fetchBatch(Arrays.asList(
                FetchRequest.customer("c1"), FetchRequest.customer("c2"),
                FetchRequest.customer("c3"), FetchRequest.customer("c4")), 2);

        assertEquals(3, batch.getSuccessCount());
        assertEquals(1, batch.getErrorCount());
        assertEquals("c2 not found", batch.get(1).getErrorMessage());
        assertEquals("c4", batch.get(3).getValue());
    }

    @Test
    void testFetchBatch_CacheHitRate() {
        orchestrator = baseBuilder().source(EntityType.CUSTOMER, echo()).build();
        orchestrator.fetchCustomer("c1");

        BatchResult<String> batch = orchestrator.fetchCustomers(List.of("c1", "c2"));

        assertTrue(batch.get(0).isFromCache());
        assertFalse(batch.get(1).isFromCache());
        assertEquals(0.5, batch.getCacheHitRate(), 0.0001);
    }

    @Test
    void testFetchBatch_InvalidConcurrency() {
        orchestrator = baseBuilder().build();

        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.fetchBatch(List.of(FetchRequest.customer("c1")), 0));
    }

    @Test
    void testFetchBatch_Empty() {
        orchestrator = baseBuilder().build();

        BatchResult<Object> batch = orchestrator.fetchBatch(List.of());

        assertEquals(0, batch.size());
        assertEquals(0.0, batch.getCacheHitRate());
    }

    @Test
    void testFetchCompositeParallel_IsolatesFailures() {
        orchestrator = baseBuilder()
                .source(EntityType.CUSTOMER, echo())
                .source(EntityType.APPOINTMENTS, echo())
                .source(EntityType.TREATMENT_HISTORY, echo())
                .source(EntityType.SATISFACTION, request -> {
                    throw new IOException("Survey service down");
                })
                .source(EntityType.REVIEWS, echo())
                .build();

        Map<String, FetchRequest> requests = new LinkedHashMap<>();
        requests.put("profile", FetchRequest.customer("c1"));
        requests.put("upcoming", FetchRequest.appointments("c1"));
        requests.put("history", FetchRequest.treatmentHistory("c1"));
        requests.put("surveys", FetchRequest.satisfaction("c1"));
        requests.put("reviews", FetchRequest.reviews("t1"));

        CompositeResult composite = orchestrator.fetchCompositeParallel(requests);

        assertEquals(4, composite.getSuccessCount());
        assertEquals(1, composite.getErrorCount());
        assertEquals(List.of("profile", "upcoming", "history", "surveys", "reviews"),
                List.copyOf(composite.getFieldNames()));
        assertEquals("customer:c1", composite.<String>get("profile").getValue());
        assertEquals("Survey service down", composite.get("surveys").getErrorMessage());
        assertThrows(IllegalArgumentException.class, () -> composite.get("unknown"));
    }

    @Test
    void testFetchCustomerCompleteData() {
        orchestrator = baseBuilder()
                .source(EntityType.CUSTOMER, echo())
                .source(EntityType.APPOINTMENTS, echo())
                .source(EntityType.TREATMENT_HISTORY, echo())
                .source(EntityType.SATISFACTION, echo())
                .build();

        CompositeResult first = orchestrator.fetchCustomerCompleteData("c1");
        CompositeResult second = orchestrator.fetchCustomerCompleteData("c1");

        assertEquals(4, first.getSuccessCount());
        assertEquals(0.0, first.getCacheHitRate());
        assertEquals("appointments:c1", first.<String>get(FetchOrchestrator.FIELD_APPOINTMENTS).getValue());
        assertEquals("treatment-history:c1",
                first.<String>get(FetchOrchestrator.FIELD_TREATMENT_HISTORY).getValue());
        assertEquals(1.0, second.getCacheHitRate());
        assertEquals(4, orchestrator.getStats().getSize());
    }

    @Test
    void testFetchTreatmentRecommendations() {
        orchestrator = baseBuilder()
                .source(EntityType.TREATMENTS_BY_CONCERN, echo())
                .source(EntityType.TREATMENTS_BY_SKIN_TYPE, echo())
                .build();

        BatchResult<String> batch = orchestrator.fetchTreatmentRecommendations(
                List.of("acne", "aging"), List.of("oily"));

        assertEquals(3, batch.size());
        assertEquals("treatments:concern:acne", batch.get(0).getValue());
        assertEquals("treatments:concern:aging", batch.get(1).getValue());
        assertEquals("treatments:skin-type:oily", batch.get(2).getValue());
    }

    @Test
    void testFetchAvailableTimeSlots() {
        orchestrator = baseBuilder().source(EntityType.TIME_SLOTS, echo()).build();

        BatchResult<String> batch = orchestrator.fetchAvailableTimeSlots(
                List.of("2024-07-29", "2024-07-30"), List.of("t1", "t2"));

        assertEquals(4, batch.size());
        assertEquals("time-slots:2024-07-29:t1", batch.get(0).getValue());
        assertEquals("time-slots:2024-07-29:t2", batch.get(1).getValue());
        assertEquals("time-slots:2024-07-30:t1", batch.get(2).getValue());
        assertEquals("time-slots:2024-07-30:t2", batch.get(3).getValue());

        clock.advance(Duration.ofSeconds(31));
        assertFalse(orchestrator.fetchTimeSlots("2024-07-29", "t1").isFromCache());
    }

    @Test
    void testFetchReviewsAndRatings() {
        orchestrator = baseBuilder()
                .source(EntityType.REVIEWS, request -> List.of("Great", "Relaxing"))
                .source(EntityType.AVERAGE_RATING, request -> {
                    if ("t2".equals(request.getDiscriminator())) {
                        throw new IOException("Rating service down");
                    }
                    return 4.5;
                })
                .build();

        ReviewsAndRatings<List<String>, Double> result = orchestrator.fetchReviewsAndRatings(List.of("t1", "t2"));

        assertEquals(2, result.getReviews().getSuccessCount());
        assertEquals(List.of("Great", "Relaxing"), result.getReviews().get(1).getValue());
        assertEquals(1, result.getAverageRatings().getSuccessCount());
        assertEquals(1, result.getAverageRatings().getErrorCount());
        assertEquals(4.5, result.getAverageRatings().get(0).getValue());
        assertTrue(result.getElapsedMs() >= result.getReviews().getTotalElapsedMs());
    }

    @Test
    void testFetchReviewsAndRatings_EachBatchTimedSeparately() {
        orchestrator = baseBuilder()
                .source(EntityType.REVIEWS, request -> {
                    Thread.sleep(400);
                    return List.of("Great");
                })
                .source(EntityType.AVERAGE_RATING, request -> 4.5)
                .build();

        ReviewsAndRatings<List<String>, Double> result = orchestrator.fetchReviewsAndRatings(List.of("t1"));

        assertTrue(result.getReviews().getTotalElapsedMs() >= 400);
        assertTrue(result.getAverageRatings().getTotalElapsedMs() < result.getReviews().getTotalElapsedMs());
    }

    @Test
    void testInvalidateAndClearCache() throws Exception {
        when(customerSource.load(any())).thenReturn("Kim");
        orchestrator = baseBuilder().source(EntityType.CUSTOMER, customerSource).build();

        orchestrator.fetchCustomer("c1");
        assertTrue(orchestrator.invalidate(FetchRequest.customer("c1")));
        assertFalse(orchestrator.fetchCustomer("c1").isFromCache());

        orchestrator.clearCache();
        CacheStatistics stats = orchestrator.getStats();
        assertEquals(0, stats.getSize());
        assertEquals(0, stats.getRequestCount());
        assertFalse(orchestrator.fetchCustomer("c1").isFromCache());

        verify(customerSource, times(3)).load(any());
    }

    @Test
    void testEventListenerReceivesStoreEvents() {
        CacheEventListener listener = mock(CacheEventListener.class);
        orchestrator = baseBuilder()
                .eventListener(listener)
                .source(EntityType.CUSTOMER, echo())
                .build();

        orchestrator.fetchCustomer("c1");
        orchestrator.invalidate(FetchRequest.customer("c1"));

        verify(listener).onPut("customer:c1", "customer:c1");
        verify(listener).onRemoval("customer:c1", RemovalCause.EXPLICIT);
    }

    @Test
    void testClose_LeavesCallerOwnedResourcesOpen() {
        ExecutorService fetchExecutor = Executors.newCachedThreadPool();
        ExecutorService workerExecutor = Executors.newCachedThreadPool();
        InMemoryCacheStore cache = InMemoryCacheStore.builder()
                .enableBackgroundCleanup(true)
                .cleanupInterval(Duration.ofMinutes(1))
                .build();
        try {
            FetchOrchestrator shared = FetchOrchestrator.builder()
                    .cache(cache)
                    .executors(fetchExecutor, workerExecutor)
                    .source(EntityType.CUSTOMER, echo())
                    .build();
            assertTrue(shared.fetchCustomer("c1").isSuccess());
            assertSame(cache, shared.getCache());

            shared.close();

            assertFalse(fetchExecutor.isShutdown());
            assertFalse(workerExecutor.isShutdown());
            assertTrue(cache.isBackgroundCleanupRunning());
            assertEquals(1, cache.size());
        } finally {
            fetchExecutor.shutdownNow();
            workerExecutor.shutdownNow();
            cache.close();
        }
    }

    @Test
    void testFetchAfterClose_ReportsFailure() {
        FetchOrchestrator closed = baseBuilder().source(EntityType.CUSTOMER, echo()).build();
        closed.close();

        AsyncResult<String> single = closed.fetchCustomer("c1");
        BatchResult<String> batch = closed.fetchCustomers(List.of("c2"));

        assertFalse(single.isSuccess());
        assertFalse(batch.get(0).isSuccess());
        assertTrue(batch.get(0).getErrorMessage().startsWith("customer:c2: "));
    }

    @Test
    void testBuilderCopiesSourceRegistry() {
        EntitySources shared = EntitySources.create().register(EntityType.CUSTOMER, echo());

        orchestrator = baseBuilder()
                .sources(shared)
                .source(EntityType.APPOINTMENTS, echo())
                .build();

        assertEquals(Set.of(EntityType.CUSTOMER), shared.registeredTypes());
        assertEquals(Set.of(EntityType.CUSTOMER, EntityType.APPOINTMENTS), orchestrator.getRegisteredTypes());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> FetchOrchestrator.builder().maxConcurrency(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> FetchOrchestrator.builder().operationTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> FetchOrchestrator.builder().defaultTtl(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class, () -> FetchOrchestrator.builder().maxCacheEntries(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> FetchOrchestrator.builder().ttl(EntityType.REVIEWS, Duration.ofSeconds(-1)).build());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertThrows(IllegalArgumentException.class,
                    () -> FetchOrchestrator.builder().executors(executor, executor).build());
            assertThrows(IllegalArgumentException.class,
                    () -> FetchOrchestrator.builder().executors(executor, null).build());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testDefaults() {
        orchestrator = FetchOrchestrator.builder().backgroundCleanup(false).build();

        assertEquals(10, orchestrator.getMaxConcurrency());
        assertEquals(FetchOrchestrator.DEFAULT_TTL, orchestrator.getTtl(EntityType.CUSTOMER));
        assertEquals(1000, ((InMemoryCacheStore) orchestrator.getCache()).getMaxEntries());
    }
}
