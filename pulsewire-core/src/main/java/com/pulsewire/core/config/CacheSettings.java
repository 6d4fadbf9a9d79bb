package com.pulsewire.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Response cache location and expiry.
 */
public record CacheSettings(boolean enabled, String directory, int ttlHours) {

    public static final String TTL_ENV = "PULSEWIRE_CACHE_TTL_HOURS";

    public static CacheSettings defaults() {
        return new CacheSettings(true, null, 24);
    }

    @JsonCreator
    static CacheSettings fromConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("directory") String directory,
            @JsonProperty("ttl_hours") Integer ttlHours) {
        return new CacheSettings(
            enabled == null || enabled,
            directory,
            ttlHours != null ? ttlHours : 24);
    }

    /** Configured directory with ~ expanded, or the given default. */
    public Path resolveDirectory(Path fallback) {
        if (directory == null || directory.isBlank()) {
            return fallback;
        }
        if (directory.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(directory.substring(2));
        }
        return Path.of(directory);
    }

    /** TTL, where a valid {@value #TTL_ENV} setting takes precedence. */
    public Duration resolveTtl(Map<String, String> environment) {
        String value = environment.get(TTL_ENV);
        if (value != null && !value.isBlank()) {
            try {
                return Duration.ofHours(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(TTL_ENV + " is not a number: " + value, e);
            }
        }
        return Duration.ofHours(ttlHours);
    }
}
