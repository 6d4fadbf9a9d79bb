package com.pulsewire.core.pipeline;

import com.pulsewire.core.model.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops items dated outside the window. Undated items stay unless told otherwise.
 */
public class DateWindowFilter {

    public List<Item> apply(List<Item> items, DateWindow window, boolean dropUndated) {
        List<Item> kept = new ArrayList<>(items.size());
        for (Item item : items) {
            if (!item.hasTimestamp()) {
                if (!dropUndated) {
                    kept.add(item);
                }
            } else if (window.contains(item.publishedAt())) {
                kept.add(item);
            }
        }
        return kept;
    }
}
