package com.pulsewire.core.model;

/**
 * Per-item score components, each in [0, 1].
 */
public record SubScores(double relevance, double recency, double engagement) {

    public SubScores {
        relevance = clamp(relevance);
        recency = clamp(recency);
        engagement = clamp(engagement);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
