package com.pulsewire.core.pipeline;

import com.pulsewire.core.model.Item;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collapses duplicates to one survivor per identity key.
 *
 * <p>Key: the item id, or the title/source fingerprint when there is no id. Survivor: longest
 * snippet, then earliest timestamp (undated last), then earlier collector in selection order,
 * then earlier input position. Groups keep the order in which their key first appeared.
 */
public class Deduplicator {

    private record Candidate(Item item, int position, int collectorRank) {
    }

    public List<Item> deduplicate(List<Item> items, List<String> collectorOrder) {
        Map<String, Integer> ranks = new HashMap<>();
        for (int i = 0; i < collectorOrder.size(); i++) {
            ranks.putIfAbsent(collectorOrder.get(i), i);
        }

        Comparator<Candidate> preference = Comparator
            .comparingInt((Candidate c) -> c.item().snippet().length()).reversed()
            .thenComparing(c -> c.item().publishedAt(), Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparingInt(Candidate::collectorRank)
            .thenComparingInt(Candidate::position);

        Map<String, Candidate> best = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            Candidate candidate = new Candidate(item, i, ranks.getOrDefault(item.collectorId(), Integer.MAX_VALUE));
            best.merge(keyOf(item), candidate, (current, next) ->
                preference.compare(next, current) < 0 ? next : current);
        }

        List<Item> survivors = new ArrayList<>(best.size());
        best.values().forEach(c -> survivors.add(c.item()));
        return survivors;
    }

    /** Identity key of an item, unique among survivors. */
    public static String keyOf(Item item) {
        return item.hasId() ? "id:" + item.id() : "fp:" + fingerprint(item.title(), item.sourceName());
    }

    /** Lower-cased, whitespace-collapsed title and source name. */
    public static String fingerprint(String title, String sourceName) {
        return normalize(title) + "|" + normalize(sourceName);
    }

    private static String normalize(String text) {
        if (text == null) return "";
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
