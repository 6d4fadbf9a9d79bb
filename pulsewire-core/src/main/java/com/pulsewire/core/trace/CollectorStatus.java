package com.pulsewire.core.trace;

/**
 * Final state of one registered collector in a run.
 */
public enum CollectorStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    SKIPPED_UNAVAILABLE,
    SKIPPED_EXCLUDED;

    public boolean isSkipped() {
        return this == SKIPPED_UNAVAILABLE || this == SKIPPED_EXCLUDED;
    }
}
