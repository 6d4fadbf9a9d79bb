package com.pulsewire.core.config;

import java.time.Duration;

/**
 * Resolved limits for one collector at one depth.
 */
public record DepthProfile(Depth depth, int maxItems, Duration timeout, int targetItems) {

    public DepthProfile {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        targetItems = Math.min(Math.max(1, targetItems), maxItems);
    }

    public DepthProfile withTimeout(Duration timeout) {
        return new DepthProfile(depth, maxItems, timeout, targetItems);
    }
}
