package com.pulsewire.core.trace;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, serializable view of a {@link RunTrace}.
 */
public record TraceDocument(
    String runId,
    String domain,
    String profile,
    String reportType,
    String depth,
    Instant startedAt,
    Instant endedAt,
    Long durationMs,
    List<CollectorTrace> collectors,
    ProcessingSummary processing,
    DeliveryTrace delivery
) {
    public TraceDocument {
        collectors = collectors != null ? List.copyOf(collectors) : List.of();
    }

    public int totalItemsCollected() {
        return collectors.stream().mapToInt(CollectorTrace::itemsCollected).sum();
    }

    public int totalApiCalls() {
        return collectors.stream().mapToInt(c -> c.apiCalls().size()).sum();
    }

    public long successfulCollectors() {
        return collectors.stream().filter(CollectorTrace::success).count();
    }

    /** Collectors that ran and did not succeed. Skipped collectors are not failures. */
    public long failedCollectors() {
        return collectors.stream()
            .filter(c -> !c.success() && !c.status().isSkipped())
            .count();
    }
}
