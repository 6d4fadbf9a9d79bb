package com.pulsewire.core.cache;

import java.util.Optional;

/**
 * Cache of raw source responses shared by all collectors of a run.
 * Implementations must be safe for concurrent use.
 */
public interface ResponseCache {

    /** Cached body if present and fresh. */
    Optional<String> get(CacheKey key);

    /** Store a body. Failures are the cache's problem, never the caller's. */
    void put(CacheKey key, String body);

    /** A cache that stores nothing. */
    static ResponseCache disabled() {
        return DisabledCache.INSTANCE;
    }

    enum DisabledCache implements ResponseCache {
        INSTANCE;

        @Override
        public Optional<String> get(CacheKey key) {
            return Optional.empty();
        }

        @Override
        public void put(CacheKey key, String body) {
        }
    }
}
