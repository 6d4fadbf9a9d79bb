package com.pulsewire.core.trace;

import java.time.Instant;
import java.util.List;

/**
 * Trace entry for one registered collector. Created once its task settles.
 */
public record CollectorTrace(
    String id,
    String name,
    String type,
    CollectorStatus status,
    Instant startedAt,
    Instant endedAt,
    long durationMs,
    int attempts,
    int itemsCollected,
    Integer itemsAfterFilter,   // null until the pipeline has filtered
    String credentialUsed,
    List<ApiCall> apiCalls,
    boolean success,
    String error
) {
    public CollectorTrace {
        apiCalls = apiCalls != null ? List.copyOf(apiCalls) : List.of();
    }

    /** Entry for a collector that never ran. */
    public static CollectorTrace skipped(String id, String name, String type, CollectorStatus status, String reason) {
        if (!status.isSkipped()) {
            throw new IllegalArgumentException("Not a skip status: " + status);
        }
        return new CollectorTrace(id, name, type, status, null, null, 0, 0, 0, null, null,
            List.of(), false, reason);
    }

    public CollectorTrace withItemsAfterFilter(int count) {
        return new CollectorTrace(id, name, type, status, startedAt, endedAt, durationMs, attempts,
            itemsCollected, count, credentialUsed, apiCalls, success, error);
    }
}
