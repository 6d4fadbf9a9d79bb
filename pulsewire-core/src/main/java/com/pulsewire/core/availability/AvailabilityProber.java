package com.pulsewire.core.availability;

import com.pulsewire.core.collector.Collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which collectors can run, using only the set of configured credential keys.
 * Performs no I/O.
 */
public class AvailabilityProber {

    /** Probe collectors in registration order. */
    public List<Availability> probe(List<? extends Collector> collectors, Set<String> configuredKeys) {
        List<Availability> result = new ArrayList<>(collectors.size());
        for (Collector collector : collectors) {
            result.add(probe(collector, configuredKeys));
        }
        return result;
    }

    public Availability probe(Collector collector, Set<String> configuredKeys) {
        List<String> required = collector.requiredCredentials();
        if (required == null || required.isEmpty()) {
            return new Availability(collector, true, null, List.of(), null);
        }

        List<String> present = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String key : required) {
            if (configuredKeys.contains(key)) {
                present.add(key);
            } else {
                missing.add(key);
            }
        }

        if (collector.requiresAny()) {
            if (!present.isEmpty()) {
                // declaration order is preference order
                return new Availability(collector, true, present.get(0), missing, null);
            }
            return new Availability(collector, false, null, missing,
                "needs one of: " + String.join(", ", required));
        }

        if (missing.isEmpty()) {
            return new Availability(collector, true, present.get(0), List.of(), null);
        }
        return new Availability(collector, false, null, missing,
            "missing: " + String.join(", ", missing));
    }

    /** Human-readable warnings for the unavailable entries. */
    public static List<String> warnings(List<Availability> availability) {
        List<String> warnings = new ArrayList<>();
        for (Availability a : availability) {
            if (!a.available()) {
                warnings.add(a.collector().name() + " unavailable: " + a.reason());
            }
        }
        return warnings;
    }
}
