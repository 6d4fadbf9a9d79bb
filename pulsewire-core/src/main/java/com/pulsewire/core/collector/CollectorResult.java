package com.pulsewire.core.collector;

import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.Source;

import java.util.List;

/**
 * Output of one collector invocation. With an error the items may be partial but are never null.
 */
public record CollectorResult(List<Item> items, List<Source> sources, String error) {

    public CollectorResult {
        items = items != null ? List.copyOf(items) : List.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
        if (error != null && error.isBlank()) {
            error = null;
        }
    }

    public static CollectorResult of(List<Item> items, List<Source> sources) {
        return new CollectorResult(items, sources, null);
    }

    public static CollectorResult empty() {
        return new CollectorResult(List.of(), List.of(), null);
    }

    public static CollectorResult failed(String error) {
        return new CollectorResult(List.of(), List.of(), error);
    }

    public static CollectorResult partial(List<Item> items, List<Source> sources, String error) {
        return new CollectorResult(items, sources, error);
    }

    public boolean success() {
        return error == null;
    }
}
