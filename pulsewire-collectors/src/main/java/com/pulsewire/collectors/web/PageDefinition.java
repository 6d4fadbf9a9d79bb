package com.pulsewire.collectors.web;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * How to read items off one listing page. Selectors are CSS, evaluated inside each item element.
 *
 * <pre>
 * pages:
 *   - name: Cannes Lions
 *     url: https://example.org/winners
 *     item: article.winner
 *     title: h3
 *     link: a
 *     kind: award
 *     medal: .medal
 *     winner: .agency
 *     next: a.next
 *     max_pages: 3
 * </pre>
 */
public record PageDefinition(
    String name,
    String url,
    String item,
    String title,
    String link,        // defaults to the first anchor
    String date,
    String snippet,
    String kind,        // "news" or "award"
    String medal,
    String winner,
    String category,
    Integer year,       // award year, defaults to the window's end year
    String next,        // pagination link, optional
    Integer maxPages
) {
    public static final int DEFAULT_MAX_PAGES = 5;

    public PageDefinition {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Page definition needs a url");
        }
        if (item == null || item.isBlank()) {
            throw new IllegalArgumentException("Page definition for " + url + " needs an item selector");
        }
        name = name != null && !name.isBlank() ? name.trim() : url.trim();
        title = title != null && !title.isBlank() ? title : "h1, h2, h3, h4, a";
        link = link != null && !link.isBlank() ? link : "a[href]";
        kind = kind != null && !kind.isBlank() ? kind.trim().toLowerCase(Locale.ROOT) : "news";
        if (!kind.equals("news") && !kind.equals("award")) {
            throw new IllegalArgumentException("Page kind must be news or award: " + kind);
        }
        maxPages = maxPages != null && maxPages > 0 ? maxPages : DEFAULT_MAX_PAGES;
    }

    /** Every CSS selector the definition sets. */
    public List<String> selectors() {
        return Stream.of(item, title, link, date, snippet, medal, winner, category, next)
            .filter(s -> s != null && !s.isBlank())
            .toList();
    }

    public boolean isAward() {
        return "award".equals(kind);
    }
}
