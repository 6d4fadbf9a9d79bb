package com.pulsewire.core.config;

import java.time.Duration;

/**
 * Partial depth override from configuration. Null fields keep the underlying value.
 */
public record DepthSpec(Integer maxItems, Integer timeoutSeconds, Integer targetItems) {

    public DepthProfile applyTo(DepthProfile base) {
        return new DepthProfile(
            base.depth(),
            maxItems != null ? maxItems : base.maxItems(),
            timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : base.timeout(),
            targetItems != null ? targetItems : base.targetItems());
    }
}
