package com.pulsewire.core.pipeline;

import com.pulsewire.core.TestItems;
import com.pulsewire.core.model.Item;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DateWindowFilter.
 */
class DateWindowFilterTest {

    private final DateWindowFilter filter = new DateWindowFilter();
    private final DateWindow window = new DateWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7), ZoneId.of("UTC"));

    @Test
    @DisplayName("Should include the whole last day and exclude the day before the window")
    void inclusiveUpperBound() {
        // Given
        Item before = TestItems.news("before", "Before", Instant.parse("2023-12-31T12:00:00Z"));
        Item first = TestItems.news("first", "First", Instant.parse("2024-01-01T00:00:00Z"));
        Item last = TestItems.news("last", "Last", Instant.parse("2024-01-07T23:59:00Z"));
        Item after = TestItems.news("after", "After", Instant.parse("2024-01-08T00:00:00Z"));

        // When
        List<Item> kept = filter.apply(List.of(before, first, last, after), window, false);

        // Then
        assertEquals(List.of("first", "last"), kept.stream().map(Item::id).toList());
    }

    @Test
    @DisplayName("Should keep undated items unless the profile drops them")
    void undatedItems() {
        Item undated = TestItems.news("undated", "No date", null);

        assertEquals(1, filter.apply(List.of(undated), window, false).size());
        assertTrue(filter.apply(List.of(undated), window, true).isEmpty());
    }

    @Test
    @DisplayName("Should evaluate day boundaries in the configured zone")
    void usesConfiguredZone() {
        // Given
        DateWindow tokyo = new DateWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7), ZoneId.of("Asia/Tokyo"));
        // 2024-01-08 08:00 in Tokyo
        Item item = TestItems.news("late", "Late", Instant.parse("2024-01-07T23:00:00Z"));

        // Then
        assertTrue(filter.apply(List.of(item), tokyo, false).isEmpty());
        assertEquals(1, filter.apply(List.of(item), window, false).size());
    }

    @Test
    @DisplayName("Should reject an inverted window")
    void rejectsInvertedWindow() {
        assertThrows(IllegalArgumentException.class,
            () -> new DateWindow(LocalDate.of(2024, 1, 7), LocalDate.of(2024, 1, 1), null));
    }
}
