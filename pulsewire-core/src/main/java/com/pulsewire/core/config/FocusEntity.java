package com.pulsewire.core.config;

/**
 * A company, brand or person the profile tracks.
 */
public record FocusEntity(
    String name,
    String symbol,      // ticker, if listed
    String type,        // "holding_company", "competitor", ...
    Double weight       // relevance added on a match, null for the scoring default
) {
    public FocusEntity {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Focus entity needs a name");
        }
        name = name.trim();
        symbol = symbol != null && !symbol.isBlank() ? symbol.trim() : null;
    }
}
