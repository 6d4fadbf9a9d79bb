package com.pulsewire.core.coordinator;

import com.pulsewire.core.availability.Availability;
import com.pulsewire.core.collector.CancellationToken;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.config.DepthProfile;
import com.pulsewire.core.trace.CallLog;
import com.pulsewire.core.trace.CollectorTrace;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run state of one selected collector. Settled exactly once, either by its supervisor
 * or by the coordinator when the global deadline abandons it.
 */
final class CollectorSlot {

    record Settlement(CollectorResult result, CollectorTrace trace) {
    }

    private final Availability availability;
    private final DepthProfile depth;
    private final CancellationToken token = new CancellationToken();
    private final CallLog calls = new CallLog();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicReference<Settlement> settlement = new AtomicReference<>();

    private volatile Instant startedAt;
    private volatile long startNanos;
    private volatile Future<?> future;

    CollectorSlot(Availability availability, DepthProfile depth) {
        this.availability = availability;
        this.depth = depth;
    }

    Collector collector() {
        return availability.collector();
    }

    String id() {
        return availability.collectorId();
    }

    String credentialKey() {
        return availability.credentialKey();
    }

    DepthProfile depth() {
        return depth;
    }

    CancellationToken token() {
        return token;
    }

    CallLog calls() {
        return calls;
    }

    int nextAttempt() {
        int attempt = attempts.incrementAndGet();
        calls.startAttempt(attempt);
        return attempt;
    }

    int attemptCount() {
        return attempts.get();
    }

    void markStarted(Instant at) {
        startedAt = at;
        startNanos = System.nanoTime();
    }

    Instant startedAt() {
        return startedAt;
    }

    /** Milliseconds since the supervisor started, 0 if it never did. */
    long elapsedMs() {
        return startedAt != null ? (System.nanoTime() - startNanos) / 1_000_000 : 0;
    }

    long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    void setFuture(Future<?> future) {
        this.future = future;
    }

    Future<?> future() {
        return future;
    }

    /** @return true if this call settled the slot */
    boolean settle(CollectorResult result, CollectorTrace trace) {
        return settlement.compareAndSet(null, new Settlement(result, trace));
    }

    boolean isSettled() {
        return settlement.get() != null;
    }

    Settlement settlement() {
        return settlement.get();
    }
}
