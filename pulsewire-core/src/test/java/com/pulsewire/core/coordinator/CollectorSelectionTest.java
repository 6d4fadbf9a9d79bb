package com.pulsewire.core.coordinator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CollectorSelectionTest {

    @Test
    @DisplayName("Should admit everything without lists")
    void admitsEverythingByDefault() {
        CollectorSelection selection = CollectorSelection.parse(null, "");

        assertTrue(selection.admits("rss"));
        assertTrue(selection.admits("news"));
    }

    @Test
    @DisplayName("Should apply deny-list over allow-list")
    void denyWinsOverAllow() {
        // Given
        CollectorSelection selection = CollectorSelection.parse("rss, news ,", "news");

        // Then
        assertEquals(Set.of("rss", "news"), selection.include());
        assertTrue(selection.admits("rss"));
        assertFalse(selection.admits("news"));
        assertFalse(selection.admits("x_search"));
    }
}
