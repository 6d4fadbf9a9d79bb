package com.pulsewire.core.pipeline;

import com.pulsewire.core.TestItems;
import com.pulsewire.core.model.Item;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Deduplicator.
 */
class DeduplicatorTest {

    private static final Instant T1 = Instant.parse("2024-01-03T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-04T10:00:00Z");

    private final Deduplicator deduplicator = new Deduplicator();

    @Nested
    @DisplayName("Survivor selection")
    class SurvivorTests {

        @Test
        @DisplayName("Should keep the item with the longest snippet")
        void longestSnippetWins() {
            // Given
            Item shortOne = TestItems.newsBuilder("same", "Title").snippet("short").publishedAt(T1).build();
            Item longOne = TestItems.newsBuilder("same", "Title").snippet("a much longer body").publishedAt(T2).build();

            // When
            List<Item> result = deduplicator.deduplicate(List.of(shortOne, longOne), List.of("test"));

            // Then
            assertEquals(1, result.size());
            assertEquals("a much longer body", result.get(0).snippet());
        }

        @Test
        @DisplayName("Should fall back to the title and source fingerprint without an id")
        void fingerprintFallback() {
            // Given
            Item a = TestItems.newsBuilder(null, "WPP  Wins   Account").snippet("brief").build();
            Item b = TestItems.newsBuilder(null, "wpp wins account").snippet("the longer of the two").build();
            Item other = TestItems.newsBuilder(null, "wpp wins account").sourceName("Other Wire").build();

            // When
            List<Item> result = deduplicator.deduplicate(List.of(a, b, other), List.of("test"));

            // Then
            assertEquals(2, result.size());
            assertEquals("the longer of the two", result.get(0).snippet());
            assertEquals("Other Wire", result.get(1).sourceName());
        }

        @Test
        @DisplayName("Should prefer the earliest timestamp, undated last, on equal snippets")
        void earliestTimestampBreaksTies() {
            Item undated = TestItems.newsBuilder("same", "Title").snippet("body").build();
            Item later = TestItems.newsBuilder("same", "Title").snippet("body").publishedAt(T2).build();
            Item earlier = TestItems.newsBuilder("same", "Title").snippet("body").publishedAt(T1).build();

            List<Item> result = deduplicator.deduplicate(List.of(undated, later, earlier), List.of("test"));

            assertEquals(T1, result.get(0).publishedAt());
        }

        @Test
        @DisplayName("Should prefer the earlier collector, then the earlier position")
        void collectorOrderThenPosition() {
            // Given
            Item fromB = TestItems.newsBuilder("same", "Title").collectorId("b").snippet("body").publishedAt(T1).build();
            Item fromA = TestItems.newsBuilder("same", "Title").collectorId("a").snippet("body").publishedAt(T1).build();

            // Then
            assertEquals("a", deduplicator.deduplicate(List.of(fromB, fromA), List.of("a", "b")).get(0).collectorId());
            assertEquals("b", deduplicator.deduplicate(List.of(fromB, fromA), List.of("b", "a")).get(0).collectorId());
            assertEquals("b", deduplicator.deduplicate(List.of(fromB, fromA), List.of()).get(0).collectorId());
        }
    }

    @Test
    @DisplayName("Should choose the same survivors regardless of input order")
    void deterministicAcrossPermutations() {
        // Given
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            items.add(TestItems.newsBuilder("g" + (i % 2), "Group " + (i % 2))
                .collectorId(i < 2 ? "a" : "b")
                .snippet("x".repeat(i % 3))
                .publishedAt(T1.plusSeconds(i))
                .build());
        }
        List<Item> expected = deduplicator.deduplicate(items, List.of("a", "b"));

        // When/Then
        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            List<Item> shuffled = new ArrayList<>(items);
            Collections.shuffle(shuffled, random);
            List<Item> result = deduplicator.deduplicate(shuffled, List.of("a", "b"));
            assertEquals(expected.size(), result.size());
            assertTrue(result.containsAll(expected), "same survivors for every input order");
        }
    }

    @Test
    @DisplayName("Should keep groups in first-appearance order")
    void firstAppearanceOrder() {
        Item x = TestItems.news("x", "X", T1);
        Item y = TestItems.news("y", "Y", T1);

        List<Item> result = deduplicator.deduplicate(List.of(y, x, y), List.of("test"));

        assertEquals(List.of("y", "x"), result.stream().map(Item::id).toList());
    }
}
