package com.pulsewire.core.collector;

import java.util.List;

/**
 * Fetches items from exactly one external source.
 *
 * <p>Implementations report ordinary failures (network errors, missing or malformed data)
 * through {@link CollectorResult#error()} and keep whatever items they salvaged. Only
 * programming defects may escape {@link #collect}.
 */
public interface Collector {

    /** Registration id, unique within a run. */
    String id();

    /** Display name for previews and traces. */
    String name();

    /** Source category: news, financial, social, rss, awards, deals, web. */
    String type();

    /** Credential keys in preference order. Empty means always available. */
    default List<String> requiredCredentials() {
        return List.of();
    }

    /** True when any one of {@link #requiredCredentials()} is enough, false when all are needed. */
    default boolean requiresAny() {
        return false;
    }

    /** Fetch items for the request's window and depth. */
    CollectorResult collect(CollectRequest request);
}
