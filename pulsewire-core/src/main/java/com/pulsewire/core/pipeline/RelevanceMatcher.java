package com.pulsewire.core.pipeline;

import com.pulsewire.core.config.FocusEntity;
import com.pulsewire.core.config.ProfileConfig;
import com.pulsewire.core.config.ScoringSettings;
import com.pulsewire.core.model.Item;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Matches items against a profile's focus terms. Terms match as whole words, case-insensitively.
 */
public class RelevanceMatcher {

    private record WeightedTerm(Pattern pattern, double weight) {
    }

    private final List<Pattern> boosts = new ArrayList<>();
    private final List<Pattern> filters = new ArrayList<>();
    private final List<WeightedTerm> entities = new ArrayList<>();
    private final ScoringSettings settings;

    public RelevanceMatcher(ProfileConfig profile, ScoringSettings settings) {
        this.settings = settings;
        profile.boostKeywords().forEach(k -> boosts.add(wordPattern(k)));
        profile.filterKeywords().forEach(k -> filters.add(wordPattern(k)));
        for (FocusEntity entity : profile.entities()) {
            double weight = entity.weight() != null ? entity.weight() : settings.entityWeight();
            Pattern pattern = entity.symbol() != null
                ? Pattern.compile(wordRegex(entity.name()) + "|" + wordRegex(entity.symbol()),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                : wordPattern(entity.name());
            entities.add(new WeightedTerm(pattern, weight));
        }
    }

    /**
     * Relevance hint plus boosts and entity weights, minus filter penalties, clamped to [0, 1].
     */
    public double relevance(Item item) {
        String text = item.title() + "\n" + item.snippet() + "\n" + item.details().matchText();
        double score = item.relevanceHint();
        score += settings.boostStep() * count(boosts, text);
        for (WeightedTerm entity : entities) {
            if (entity.pattern().matcher(text).find()) {
                score += entity.weight();
            }
        }
        score -= settings.filterPenalty() * count(filters, text);
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static int count(List<Pattern> patterns, String text) {
        int matches = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                matches++;
            }
        }
        return matches;
    }

    private static Pattern wordPattern(String term) {
        return Pattern.compile(wordRegex(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String wordRegex(String term) {
        return "(?<![\\p{L}\\p{N}])" + Pattern.quote(term.trim()) + "(?![\\p{L}\\p{N}])";
    }
}
