package io.github.hunghhdev.fetchcache.fetch;

import java.time.Duration;
import java.util.Optional;

import io.github.hunghhdev.fetchcache.core.CacheClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache-aware fetch for one entity type: serves fresh cached values, otherwise calls the
 * entity source through the {@link OperationRunner} and caches successful values with the
 * type's TTL. Failures are returned as they are and never cached.
 *
 * @param <T> the value type
 */
final class CachedFetcher<T> {
    private static final Logger logger = LoggerFactory.getLogger(CachedFetcher.class);

    private final EntityType type;
    private final EntitySource<T> source;
    private final Duration ttl;
    private final CacheClient cache;
    private final OperationRunner runner;

    CachedFetcher(EntityType type, EntitySource<T> source, Duration ttl, CacheClient cache, OperationRunner runner) {
        this.type = type;
        this.source = source;
        this.ttl = ttl;
        this.cache = cache;
        this.runner = runner;
    }

    // each fetcher is the only writer of its key prefix, so the cast matches what it stored
    @SuppressWarnings("unchecked")
    AsyncResult<T> fetch(FetchRequest request) {
        String cacheKey = request.cacheKey();
        Optional<Object> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Cache hit for '{}'", cacheKey);
            return AsyncResult.cached((T) cached.get());
        }

        AsyncResult<T> result = runner.execute(() -> source.load(request));
        if (result.isSuccess()) {
            cache.put(cacheKey, result.getValue(), ttl);
        } else {
            logger.debug("{} fetch for '{}' failed ({}): {}", type, cacheKey, result.getFailureKind(),
                result.getErrorMessage());
        }
        return result;
    }
}
