package com.pulsewire.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights and constants of the score stage.
 */
public record ScoringSettings(
    double relevanceWeight,
    double recencyWeight,
    double engagementWeight,
    double halfLifeDays,        // recency halves every this many days
    double recencyWindowDays,   // older items get the floor
    double recencyFloor,        // also used for undated items
    double neutralEngagement,   // for items with no engagement signal
    double boostStep,           // per matched boost keyword
    double filterPenalty,       // per matched filter keyword
    double entityWeight         // for focus entities without their own weight
) {
    private static final double WEIGHT_TOLERANCE = 1e-6;

    public ScoringSettings {
        if (relevanceWeight < 0 || recencyWeight < 0 || engagementWeight < 0) {
            throw new IllegalArgumentException("Score weights must not be negative");
        }
        double sum = relevanceWeight + recencyWeight + engagementWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Score weights must sum to 1, got " + sum);
        }
        if (halfLifeDays <= 0) {
            throw new IllegalArgumentException("halfLifeDays must be positive");
        }
        if (recencyFloor <= 0 || recencyFloor >= 1) {
            throw new IllegalArgumentException("recencyFloor must be in (0, 1)");
        }
        if (neutralEngagement < 0 || neutralEngagement > 1) {
            throw new IllegalArgumentException("neutralEngagement must be in [0, 1]");
        }
    }

    public static ScoringSettings defaults() {
        return new ScoringSettings(0.45, 0.25, 0.30, 30, 30, 0.05, 0.35, 0.1, 0.3, 0.15);
    }

    @JsonCreator
    static ScoringSettings fromConfig(
            @JsonProperty("relevance_weight") Double relevanceWeight,
            @JsonProperty("recency_weight") Double recencyWeight,
            @JsonProperty("engagement_weight") Double engagementWeight,
            @JsonProperty("half_life_days") Double halfLifeDays,
            @JsonProperty("recency_window_days") Double recencyWindowDays,
            @JsonProperty("recency_floor") Double recencyFloor,
            @JsonProperty("neutral_engagement") Double neutralEngagement,
            @JsonProperty("boost_step") Double boostStep,
            @JsonProperty("filter_penalty") Double filterPenalty,
            @JsonProperty("entity_weight") Double entityWeight) {
        ScoringSettings d = defaults();
        return new ScoringSettings(
            or(relevanceWeight, d.relevanceWeight),
            or(recencyWeight, d.recencyWeight),
            or(engagementWeight, d.engagementWeight),
            or(halfLifeDays, d.halfLifeDays),
            or(recencyWindowDays, d.recencyWindowDays),
            or(recencyFloor, d.recencyFloor),
            or(neutralEngagement, d.neutralEngagement),
            or(boostStep, d.boostStep),
            or(filterPenalty, d.filterPenalty),
            or(entityWeight, d.entityWeight));
    }

    private static double or(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
