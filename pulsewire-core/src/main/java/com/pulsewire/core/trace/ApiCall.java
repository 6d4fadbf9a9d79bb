package com.pulsewire.core.trace;

import java.time.Instant;

/**
 * One outbound request made by a collector, or a cache hit standing in for one.
 */
public record ApiCall(
    String endpoint,
    String method,
    int status,             // 0 when no response was received
    long latencyMs,
    boolean cached,
    String error,
    int attempt,            // coordinator attempt the call belongs to
    Instant timestamp
) {
}
