package io.github.hunghhdev.fetchcache.core;

/**
 * Custom exception for fetchcache errors.
 */
public class FetchCacheException extends RuntimeException {
    public FetchCacheException(String message) {
        super(message);
    }

    public FetchCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
