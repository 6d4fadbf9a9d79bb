package com.pulsewire.core.collector;

import com.pulsewire.core.cache.ResponseCache;
import com.pulsewire.core.config.DepthProfile;
import com.pulsewire.core.config.ProfileConfig;
import com.pulsewire.core.trace.CallLog;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Everything a collector needs for one attempt.
 */
public record CollectRequest(
    ProfileConfig profile,
    LocalDate fromDate,
    LocalDate toDate,
    DepthProfile depth,
    String credentialKey,       // null when the collector needs none
    String credential,
    CancellationToken cancellation,
    ResponseCache cache,
    boolean noCache,            // skip cache reads, still write through
    CallLog calls
) {
    public CollectRequest {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(fromDate, "fromDate");
        Objects.requireNonNull(toDate, "toDate");
        Objects.requireNonNull(depth, "depth");
        if (fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
        cancellation = cancellation != null ? cancellation : new CancellationToken();
        cache = cache != null ? cache : ResponseCache.disabled();
        calls = calls != null ? calls : new CallLog();
    }

    public int maxItems() {
        return depth.maxItems();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
