package com.pulsewire.core.pipeline;

import com.pulsewire.core.model.AwardDetails;
import com.pulsewire.core.model.DealDetails;
import com.pulsewire.core.model.Engagement;
import com.pulsewire.core.model.FinancialDetails;
import com.pulsewire.core.model.Item;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Raw, unnormalised engagement signal per item kind. Empty means the item carries no signal.
 */
final class EngagementSignals {

    private static final Map<String, Double> MEDAL_PRESTIGE = Map.of(
        "grand prix", 100.0,
        "titanium", 95.0,
        "gold", 80.0,
        "silver", 60.0,
        "bronze", 40.0,
        "shortlist", 20.0
    );

    private EngagementSignals() {
    }

    static OptionalDouble raw(Item item) {
        return switch (item.kind()) {
            case NEWS -> discussion(item.engagement());
            case SOCIAL -> social(item.engagement());
            case FINANCIAL -> materiality((FinancialDetails) item.details());
            case DEAL -> dealSize((DealDetails) item.details());
            case AWARD -> prestige((AwardDetails) item.details());
        };
    }

    /** 0.5 * log(points or likes) + 0.5 * log(comments). */
    private static OptionalDouble discussion(Engagement e) {
        if (e == null || e.score() == null && e.likes() == null && e.comments() == null) {
            return OptionalDouble.empty();
        }
        long points = Math.max(e.scoreOrZero(), e.likesOrZero());
        long comments = e.commentsOrZero();
        return OptionalDouble.of(0.5 * Math.log1p(points) + 0.5 * Math.log1p(comments));
    }

    /** Weighted log counts, likes dominating. */
    private static OptionalDouble social(Engagement e) {
        if (e == null || e.likes() == null && e.reposts() == null && e.replies() == null && e.quotes() == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(0.55 * Math.log1p(e.likesOrZero())
            + 0.25 * Math.log1p(e.repostsOrZero())
            + 0.15 * Math.log1p(e.repliesOrZero())
            + 0.05 * Math.log1p(e.quotesOrZero()));
    }

    /** Larger moves matter more. */
    private static OptionalDouble materiality(FinancialDetails d) {
        if (d.changePct() == null || d.changePct().isNaN()) return OptionalDouble.empty();
        return OptionalDouble.of(Math.abs(d.changePct()) * 10);
    }

    /** Log of the deal value in millions. */
    private static OptionalDouble dealSize(DealDetails d) {
        if (d.dealValue() == null || d.dealValue() <= 0) return OptionalDouble.empty();
        return OptionalDouble.of(Math.log1p(d.dealValue() / 1_000_000.0));
    }

    private static OptionalDouble prestige(AwardDetails d) {
        if (d.medal() == null) return OptionalDouble.empty();
        Double value = MEDAL_PRESTIGE.get(d.medal().trim().toLowerCase(Locale.ROOT));
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
