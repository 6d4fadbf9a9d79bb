package com.pulsewire.core.availability;

import com.pulsewire.core.collector.Collector;

import java.util.List;

/**
 * Whether one collector can run with the configured credentials, and with which key.
 */
public record Availability(
    Collector collector,
    boolean available,
    String credentialKey,       // key the collector will use, null when none is needed
    List<String> missingKeys,
    String reason               // why it is unavailable, null when available
) {
    public Availability {
        missingKeys = missingKeys != null ? List.copyOf(missingKeys) : List.of();
    }

    public String collectorId() {
        return collector.id();
    }

    /** One-line status for previews, e.g. {@code ✗ News Search (needs one of: A, B)}. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(available ? "✓ " : "✗ ")
            .append(collector.name())
            .append(" [").append(collector.id()).append(", ").append(collector.type()).append(']');
        if (available && credentialKey != null) {
            sb.append(" using ").append(credentialKey);
        } else if (!available) {
            sb.append(" (").append(reason).append(')');
        }
        return sb.toString();
    }
}
