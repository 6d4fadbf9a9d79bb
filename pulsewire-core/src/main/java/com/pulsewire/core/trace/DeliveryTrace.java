package com.pulsewire.core.trace;

import java.time.Instant;

public record DeliveryTrace(
    String channel,
    Instant startedAt,
    Instant endedAt,
    long durationMs,
    boolean success,
    String error
) {
}
