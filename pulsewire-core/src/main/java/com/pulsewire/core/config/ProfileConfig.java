package com.pulsewire.core.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a run looks for: focus entities, keywords, feeds and people to follow.
 * Read-only input; profile inheritance is resolved before this point.
 */
public record ProfileConfig(
    String name,
    List<FocusEntity> entities,
    List<String> boostKeywords,
    List<String> filterKeywords,
    List<FeedSource> publications,
    List<ThoughtLeader> thoughtLeaders,
    boolean dropUndated
) {
    public ProfileConfig {
        name = name != null && !name.isBlank() ? name : "default";
        entities = entities != null ? List.copyOf(entities) : List.of();
        boostKeywords = clean(boostKeywords);
        filterKeywords = clean(filterKeywords);
        publications = publications != null ? List.copyOf(publications) : List.of();
        thoughtLeaders = thoughtLeaders != null ? List.copyOf(thoughtLeaders) : List.of();
    }

    public static ProfileConfig named(String name) {
        return new ProfileConfig(name, null, null, null, null, null, false);
    }

    /** Entity names followed by boost keywords, without duplicates. */
    public List<String> searchTerms(int max) {
        Set<String> terms = new LinkedHashSet<>();
        entities.forEach(e -> terms.add(e.name()));
        terms.addAll(boostKeywords);
        return new ArrayList<>(terms).subList(0, Math.min(max, terms.size()));
    }

    public List<FocusEntity> listedEntities() {
        return entities.stream().filter(e -> e.symbol() != null).toList();
    }

    public List<String> handles() {
        return thoughtLeaders.stream()
            .map(ThoughtLeader::handle)
            .filter(h -> !h.isEmpty())
            .toList();
    }

    private static List<String> clean(List<String> keywords) {
        if (keywords == null) return List.of();
        return keywords.stream()
            .filter(k -> k != null && !k.isBlank())
            .map(String::trim)
            .toList();
    }
}
