package com.pulsewire.core.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Depth presets plus per-collector overrides. Immutable once built.
 */
public final class DepthTable {

    private final Map<Depth, DepthProfile> presets;
    private final Map<String, Map<Depth, DepthSpec>> overrides;

    private DepthTable(Map<Depth, DepthProfile> presets, Map<String, Map<Depth, DepthSpec>> overrides) {
        this.presets = presets;
        this.overrides = overrides;
    }

    public static DepthTable defaults() {
        Map<Depth, DepthProfile> presets = new EnumMap<>(Depth.class);
        presets.put(Depth.QUICK, new DepthProfile(Depth.QUICK, 10, Duration.ofSeconds(30), 5));
        presets.put(Depth.DEFAULT, new DepthProfile(Depth.DEFAULT, 25, Duration.ofSeconds(60), 15));
        presets.put(Depth.DEEP, new DepthProfile(Depth.DEEP, 50, Duration.ofSeconds(120), 30));
        return new DepthTable(presets, Map.of());
    }

    /** Defaults overlaid with the config's depth section and each collector's own overrides. */
    public static DepthTable from(PulseConfig config) {
        DepthTable base = defaults();
        Map<Depth, DepthProfile> presets = new EnumMap<>(base.presets);
        config.depth().forEach((name, spec) -> {
            Depth depth = Depth.parse(name);
            presets.put(depth, spec.applyTo(presets.get(depth)));
        });

        Map<String, Map<Depth, DepthSpec>> overrides = new HashMap<>();
        for (CollectorRegistration registration : config.collectors()) {
            if (registration.depth().isEmpty()) continue;
            Map<Depth, DepthSpec> specs = new EnumMap<>(Depth.class);
            registration.depth().forEach((name, spec) -> specs.put(Depth.parse(name), spec));
            overrides.put(registration.id(), specs);
        }
        return new DepthTable(presets, overrides);
    }

    public DepthProfile preset(Depth depth) {
        return presets.get(depth);
    }

    /** Limits for a collector at a depth. */
    public DepthProfile resolve(Depth depth, String collectorId) {
        DepthProfile profile = presets.get(depth);
        Map<Depth, DepthSpec> specs = overrides.get(collectorId);
        if (specs != null && specs.containsKey(depth)) {
            profile = specs.get(depth).applyTo(profile);
        }
        return profile;
    }
}
