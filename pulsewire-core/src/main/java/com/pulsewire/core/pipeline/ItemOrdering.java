package com.pulsewire.core.pipeline;

import com.pulsewire.core.model.ScoredItem;

import java.util.Comparator;
import java.util.function.ToIntFunction;

/**
 * Final ranking order: score desc, recency desc, source priority asc, identity key asc.
 * Identity keys are unique after deduplication, so no two survivors compare equal.
 */
public final class ItemOrdering {

    private ItemOrdering() {
    }

    public static Comparator<ScoredItem> byRank(ToIntFunction<String> priorityOfCollector) {
        return Comparator.comparingDouble(ScoredItem::score).reversed()
            .thenComparing(Comparator.comparingDouble((ScoredItem s) -> s.subs().recency()).reversed())
            .thenComparingInt(s -> priorityOfCollector.applyAsInt(s.item().collectorId()))
            .thenComparing(s -> Deduplicator.keyOf(s.item()));
    }
}
