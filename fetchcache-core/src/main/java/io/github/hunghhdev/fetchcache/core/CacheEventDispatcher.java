package io.github.hunghhdev.fetchcache.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

final class CacheEventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CacheEventDispatcher.class);

    private final List<CacheEventListener> listeners;

    CacheEventDispatcher(List<CacheEventListener> listeners) {
        this.listeners = listeners != null ? new ArrayList<>(listeners) : new ArrayList<>();
    }

    void fireOnPut(String key, Object value) {
        for (CacheEventListener listener : listeners) {
            try {
                listener.onPut(key, value);
            } catch (Exception e) {
                logger.warn("CacheEventListener.onPut failed for key '{}': {}", key, e.getMessage());
            }
        }
    }

    void fireOnRemoval(String key, RemovalCause cause) {
        for (CacheEventListener listener : listeners) {
            try {
                listener.onRemoval(key, cause);
            } catch (Exception e) {
                logger.warn("CacheEventListener.onRemoval failed for key '{}' ({}): {}", key, cause, e.getMessage());
            }
        }
    }

    void fireOnClear() {
        for (CacheEventListener listener : listeners) {
            try {
                listener.onClear();
            } catch (Exception e) {
                logger.warn("CacheEventListener.onClear failed: {}", e.getMessage());
            }
        }
    }
}
