package io.github.hunghhdev.fetchcache.core;

/**
 * Listener for cache events. Implementations receive callbacks when cache entries
 * are written, removed, or cleared.
 *
 * <p>Callbacks run on the thread performing the operation while the store lock is held,
 * so they must be quick and must not call back into the store.</p>
 */
public interface CacheEventListener {

    default void onPut(String key, Object value) {}

    default void onRemoval(String key, RemovalCause cause) {}

    default void onClear() {}
}
