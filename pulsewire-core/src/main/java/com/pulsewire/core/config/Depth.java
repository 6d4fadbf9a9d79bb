package com.pulsewire.core.config;

import java.util.Locale;

/**
 * Named research depth presets.
 */
public enum Depth {
    QUICK,
    DEFAULT,
    DEEP;

    /** Lower-case name as used in configuration and traces. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Depth parse(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        for (Depth depth : values()) {
            if (depth.key().equalsIgnoreCase(name.trim())) {
                return depth;
            }
        }
        throw new IllegalArgumentException("Unknown depth: " + name);
    }
}
