package com.pulsewire.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Coordinator limits and the time zone used for date windows.
 */
public record RunSettings(
    Duration globalDeadline,
    int maxWorkers,
    Duration retryBackoff,      // multiplied by the attempt number
    ZoneId zone
) {
    public RunSettings {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
    }

    public static RunSettings defaults() {
        return new RunSettings(Duration.ofMinutes(5), 8, Duration.ofSeconds(1), ZoneId.of("UTC"));
    }

    @JsonCreator
    static RunSettings fromConfig(
            @JsonProperty("global_deadline_seconds") Integer deadlineSeconds,
            @JsonProperty("max_workers") Integer maxWorkers,
            @JsonProperty("retry_backoff_ms") Long retryBackoffMs,
            @JsonProperty("time_zone") String zone) {
        RunSettings d = defaults();
        return new RunSettings(
            deadlineSeconds != null ? Duration.ofSeconds(deadlineSeconds) : d.globalDeadline,
            maxWorkers != null ? maxWorkers : d.maxWorkers,
            retryBackoffMs != null ? Duration.ofMillis(retryBackoffMs) : d.retryBackoff,
            zone != null ? ZoneId.of(zone) : d.zone);
    }
}
