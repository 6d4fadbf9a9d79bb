package com.pulsewire.core.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to a collector. Collectors poll it at I/O
 * boundaries; HTTP plumbing registers callbacks to abort in-flight calls.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }

    /**
     * Signal cancellation. Only the first call has an effect.
     */
    public void cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        this.reason = reason;
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
    }

    /**
     * Run the callback on cancellation, or immediately if already cancelled.
     * Closing the returned handle deregisters it.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /** Throw if cancelled. */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason != null ? reason : "Cancelled");
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
