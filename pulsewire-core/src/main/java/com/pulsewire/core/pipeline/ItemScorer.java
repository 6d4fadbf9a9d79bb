package com.pulsewire.core.pipeline;

import com.pulsewire.core.config.ScoringSettings;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.ScoredItem;
import com.pulsewire.core.model.SubScores;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Assigns relevance, recency and engagement sub-scores and the weighted composite.
 */
public class ItemScorer {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final ScoringSettings settings;
    private final RelevanceMatcher matcher;

    public ItemScorer(ScoringSettings settings, RelevanceMatcher matcher) {
        this.settings = settings;
        this.matcher = matcher;
    }

    public List<ScoredItem> score(List<Item> items, DateWindow window) {
        double[] engagement = engagement(items);
        Instant reference = window.end();
        List<ScoredItem> scored = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            SubScores subs = new SubScores(matcher.relevance(item), recency(item, reference), engagement[i]);
            double score = settings.relevanceWeight() * subs.relevance()
                + settings.recencyWeight() * subs.recency()
                + settings.engagementWeight() * subs.engagement();
            scored.add(new ScoredItem(item, subs, score));
        }
        return scored;
    }

    /**
     * Exponential decay from the end of the window. Undated items and items older than the
     * recency window get the floor; items dated after the reference count as brand new.
     */
    double recency(Item item, Instant reference) {
        if (!item.hasTimestamp()) {
            return settings.recencyFloor();
        }
        double ageDays = Duration.between(item.publishedAt(), reference).toMillis() / MILLIS_PER_DAY;
        if (ageDays <= 0) {
            return 1.0;
        }
        if (ageDays > settings.recencyWindowDays()) {
            return settings.recencyFloor();
        }
        double decayed = Math.pow(0.5, ageDays / settings.halfLifeDays());
        return Math.max(settings.recencyFloor(), Math.min(1.0, decayed));
    }

    /**
     * Min-max normalise raw signals within each kind. No signal gets the neutral value;
     * a kind whose signals are all equal gets 0.5.
     */
    double[] engagement(List<Item> items) {
        double[] raw = new double[items.size()];
        boolean[] present = new boolean[items.size()];
        Map<ItemKind, double[]> ranges = new EnumMap<>(ItemKind.class);

        for (int i = 0; i < items.size(); i++) {
            OptionalDouble signal = EngagementSignals.raw(items.get(i));
            if (signal.isEmpty() || !Double.isFinite(signal.getAsDouble())) continue;
            raw[i] = signal.getAsDouble();
            present[i] = true;
            double[] range = ranges.computeIfAbsent(items.get(i).kind(),
                k -> new double[]{Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY});
            range[0] = Math.min(range[0], raw[i]);
            range[1] = Math.max(range[1], raw[i]);
        }

        double[] normalized = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            if (!present[i]) {
                normalized[i] = settings.neutralEngagement();
                continue;
            }
            double[] range = ranges.get(items.get(i).kind());
            double span = range[1] - range[0];
            normalized[i] = span == 0 ? 0.5 : (raw[i] - range[0]) / span;
        }
        return normalized;
    }
}
