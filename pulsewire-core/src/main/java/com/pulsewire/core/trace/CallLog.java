package com.pulsewire.core.trace;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects the API calls of one collector across its attempts. Safe for concurrent writers.
 */
public final class CallLog {

    private final List<ApiCall> calls = new CopyOnWriteArrayList<>();
    private volatile int attempt = 1;

    /** Tag subsequent calls with the given attempt number. */
    public void startAttempt(int attempt) {
        this.attempt = attempt;
    }

    public int currentAttempt() {
        return attempt;
    }

    public void record(String endpoint, String method, int status, long latencyMs, boolean cached, String error) {
        calls.add(new ApiCall(endpoint, method, status, latencyMs, cached, error, attempt, Instant.now()));
    }

    public void recordCacheHit(String endpoint, String method) {
        record(endpoint, method, 200, 0, true, null);
    }

    /** Snapshot of the calls recorded so far. */
    public List<ApiCall> calls() {
        return List.copyOf(calls);
    }

    public int size() {
        return calls.size();
    }
}
