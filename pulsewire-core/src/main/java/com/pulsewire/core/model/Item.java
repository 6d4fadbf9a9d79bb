package com.pulsewire.core.model;

import java.time.Instant;

/**
 * Normalised unit of collected information. Immutable; scores live on {@link ScoredItem}.
 */
public record Item(
    String id,                  // see ItemIds, empty when the source gives nothing stable
    ItemKind kind,
    String collectorId,         // registered collector that produced it
    String title,
    String url,                 // canonical URL, or a symbol for quotes without a page
    String sourceName,          // "Reuters", "X/@handle", "Alpha Vantage"
    Instant publishedAt,        // null when the source has no usable timestamp
    String snippet,
    Engagement engagement,      // null means no engagement signal
    double relevanceHint,       // collector prior in [0, 1]
    ItemDetails details
) {
    public static final double DEFAULT_RELEVANCE_HINT = 0.5;

    public Item {
        if (details == null) {
            details = kind == null || kind == ItemKind.NEWS ? NewsDetails.empty() : null;
        }
        if (details == null) {
            throw new IllegalArgumentException("Item of kind " + kind + " needs details");
        }
        if (kind == null) {
            kind = details.kind();
        } else if (kind != details.kind()) {
            throw new IllegalArgumentException("Item kind " + kind + " does not match details " + details.kind());
        }
        id = id != null ? id.trim() : "";
        collectorId = collectorId != null ? collectorId : "";
        title = title != null ? title.trim() : "";
        url = url != null ? url.trim() : "";
        sourceName = sourceName != null ? sourceName.trim() : "";
        snippet = snippet != null ? snippet.trim() : "";
        if (Double.isNaN(relevanceHint)) {
            relevanceHint = DEFAULT_RELEVANCE_HINT;
        }
        relevanceHint = Math.max(0.0, Math.min(1.0, relevanceHint));
    }

    public boolean hasId() {
        return !id.isEmpty();
    }

    public boolean hasTimestamp() {
        return publishedAt != null;
    }

    /** Copy attributed to a different collector. */
    public Item withCollectorId(String collectorId) {
        return new Item(id, kind, collectorId, title, url, sourceName, publishedAt, snippet,
            engagement, relevanceHint, details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ItemKind kind;
        private String collectorId;
        private String title;
        private String url;
        private String sourceName;
        private Instant publishedAt;
        private String snippet;
        private Engagement engagement;
        private double relevanceHint = DEFAULT_RELEVANCE_HINT;
        private ItemDetails details;

        public Builder id(String id) { this.id = id; return this; }
        public Builder kind(ItemKind kind) { this.kind = kind; return this; }
        public Builder collectorId(String collectorId) { this.collectorId = collectorId; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder sourceName(String sourceName) { this.sourceName = sourceName; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder snippet(String snippet) { this.snippet = snippet; return this; }
        public Builder engagement(Engagement engagement) { this.engagement = engagement; return this; }
        public Builder relevanceHint(double relevanceHint) { this.relevanceHint = relevanceHint; return this; }
        public Builder details(ItemDetails details) { this.details = details; return this; }

        public Item build() {
            return new Item(id, kind, collectorId, title, url, sourceName, publishedAt, snippet,
                engagement, relevanceHint, details);
        }
    }
}
