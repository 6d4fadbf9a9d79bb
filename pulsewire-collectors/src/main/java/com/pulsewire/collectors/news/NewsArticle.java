package com.pulsewire.collectors.news;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * An article as returned by a news search API, before it becomes an item.
 */
public record NewsArticle(
    String title,
    String url,
    String description,
    Instant publishedAt,
    String sourceName,
    String author,
    List<String> categories
) {
    public NewsArticle {
        title = title != null ? title.trim() : "";
        url = url != null ? url.trim() : "";
        description = description != null ? description.trim() : "";
        sourceName = sourceName != null && !sourceName.isBlank() ? sourceName.trim() : "Unknown";
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    public boolean isUsable() {
        return !title.isEmpty() && !url.isEmpty() && !"[Removed]".equals(title);
    }

    /** Lower-cased title and description for keyword matching. */
    public String matchText() {
        return (title + " " + description).toLowerCase(Locale.ROOT);
    }
}
