package com.pulsewire.core.trace;

/**
 * Counts and score range of one pipeline pass.
 */
public record ProcessingSummary(
    int itemsBeforeFilter,
    int itemsAfterFilter,
    int itemsAfterDedup,
    int itemsReturned,
    Double minScore,        // null when nothing was scored
    Double maxScore,
    long durationMs
) {
}
