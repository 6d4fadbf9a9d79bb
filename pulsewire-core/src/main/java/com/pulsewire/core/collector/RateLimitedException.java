package com.pulsewire.core.collector;

public class RateLimitedException extends SourceException {

    private final long retryAfterMs;

    public RateLimitedException(String message, long retryAfterMs) {
        super(message, 429);
        this.retryAfterMs = retryAfterMs;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
