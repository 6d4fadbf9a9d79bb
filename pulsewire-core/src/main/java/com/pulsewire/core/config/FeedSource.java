package com.pulsewire.core.config;

/**
 * A publication with an RSS or Atom feed.
 */
public record FeedSource(String name, String url) {

    public FeedSource {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Feed source needs a url");
        }
        name = name != null && !name.isBlank() ? name.trim() : url.trim();
        url = url.trim();
    }
}
