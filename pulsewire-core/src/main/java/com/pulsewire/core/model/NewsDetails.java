package com.pulsewire.core.model;

import java.util.List;

public record NewsDetails(
    String author,
    List<String> categories,
    List<String> entitiesMentioned
) implements ItemDetails {

    public NewsDetails {
        categories = categories != null ? List.copyOf(categories) : List.of();
        entitiesMentioned = entitiesMentioned != null ? List.copyOf(entitiesMentioned) : List.of();
    }

    public static NewsDetails empty() {
        return new NewsDetails(null, List.of(), List.of());
    }

    @Override
    public ItemKind kind() {
        return ItemKind.NEWS;
    }

    @Override
    public String matchText() {
        return String.join(" ", entitiesMentioned);
    }
}
