package com.pulsewire.core.coordinator;

import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.Source;

import java.util.List;

/**
 * Merged output of all collectors that finished in time.
 *
 * @param items         items in collector selection order, then collector output order
 * @param sources       all reported sources, not yet deduplicated
 * @param collectorOrder ids of the collectors that were run, in selection order
 */
public record CollectionResult(List<Item> items, List<Source> sources, List<String> collectorOrder) {

    public CollectionResult {
        items = List.copyOf(items);
        sources = List.copyOf(sources);
        collectorOrder = List.copyOf(collectorOrder);
    }
}
