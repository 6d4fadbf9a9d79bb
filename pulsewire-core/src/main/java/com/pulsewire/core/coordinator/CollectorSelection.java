package com.pulsewire.core.coordinator;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-run allow-list and deny-list of collector ids. An empty allow-list admits everything.
 */
public record CollectorSelection(Set<String> include, Set<String> exclude) {

    public CollectorSelection {
        include = include != null ? Set.copyOf(include) : Set.of();
        exclude = exclude != null ? Set.copyOf(exclude) : Set.of();
    }

    public static CollectorSelection all() {
        return new CollectorSelection(Set.of(), Set.of());
    }

    /** From comma-separated lists such as {@code --collectors=rss,news}. Null means not given. */
    public static CollectorSelection parse(String include, String exclude) {
        return new CollectorSelection(split(include), split(exclude));
    }

    public boolean admits(String collectorId) {
        if (exclude.contains(collectorId)) {
            return false;
        }
        return include.isEmpty() || include.contains(collectorId);
    }

    private static Set<String> split(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
