package com.pulsewire.core.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level run configuration as read from YAML.
 */
public record PulseConfig(
    String domain,
    ProfileConfig profile,
    List<CollectorRegistration> collectors,
    Map<String, DepthSpec> depth,
    ScoringSettings scoring,
    CacheSettings cache,
    RunSettings run
) {
    public PulseConfig {
        domain = domain != null && !domain.isBlank() ? domain : "default";
        profile = profile != null ? profile : ProfileConfig.named("default");
        collectors = collectors != null ? List.copyOf(collectors) : List.of();
        depth = depth != null ? Map.copyOf(depth) : Map.of();
        scoring = scoring != null ? scoring : ScoringSettings.defaults();
        cache = cache != null ? cache : CacheSettings.defaults();
        run = run != null ? run : RunSettings.defaults();
    }

    public Optional<CollectorRegistration> collector(String id) {
        return collectors.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public int priorityOf(String collectorId) {
        return collector(collectorId)
            .map(CollectorRegistration::priority)
            .orElse(CollectorRegistration.DEFAULT_PRIORITY);
    }
}
