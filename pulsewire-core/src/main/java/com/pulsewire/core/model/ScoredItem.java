package com.pulsewire.core.model;

/**
 * An item after the score stage. Scores are assigned once and never change.
 */
public record ScoredItem(Item item, SubScores subs, double score) {
}
