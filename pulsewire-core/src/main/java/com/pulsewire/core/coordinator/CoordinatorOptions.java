package com.pulsewire.core.coordinator;

import com.pulsewire.core.config.Depth;
import com.pulsewire.core.config.RunSettings;

import java.time.Duration;

/**
 * Scheduling knobs for one run.
 */
public record CoordinatorOptions(
    Depth depth,
    int retries,                // extra attempts after a reported error
    Duration timeoutOverride,   // replaces the depth timeout when set
    Duration globalDeadline,
    Duration retryBackoff,      // sleep is backoff x attempt number
    int maxWorkers,
    boolean noCache
) {
    public CoordinatorOptions {
        depth = depth != null ? depth : Depth.DEFAULT;
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative: " + retries);
        }
        if (globalDeadline == null || globalDeadline.isNegative() || globalDeadline.isZero()) {
            throw new IllegalArgumentException("globalDeadline must be positive: " + globalDeadline);
        }
        retryBackoff = retryBackoff != null ? retryBackoff : Duration.ZERO;
        maxWorkers = Math.max(1, maxWorkers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Depth depth = Depth.DEFAULT;
        private int retries;
        private Duration timeoutOverride;
        private Duration globalDeadline = RunSettings.defaults().globalDeadline();
        private Duration retryBackoff = RunSettings.defaults().retryBackoff();
        private int maxWorkers = RunSettings.defaults().maxWorkers();
        private boolean noCache;

        public Builder depth(Depth depth) { this.depth = depth; return this; }
        public Builder retries(int retries) { this.retries = retries; return this; }
        public Builder timeoutOverride(Duration timeoutOverride) { this.timeoutOverride = timeoutOverride; return this; }
        public Builder globalDeadline(Duration globalDeadline) { this.globalDeadline = globalDeadline; return this; }
        public Builder retryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; return this; }
        public Builder maxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; return this; }
        public Builder noCache(boolean noCache) { this.noCache = noCache; return this; }

        /** Take deadline, worker count and backoff from run settings. */
        public Builder settings(RunSettings settings) {
            this.globalDeadline = settings.globalDeadline();
            this.retryBackoff = settings.retryBackoff();
            this.maxWorkers = settings.maxWorkers();
            return this;
        }

        public CoordinatorOptions build() {
            return new CoordinatorOptions(depth, retries, timeoutOverride, globalDeadline, retryBackoff,
                maxWorkers, noCache);
        }
    }
}
