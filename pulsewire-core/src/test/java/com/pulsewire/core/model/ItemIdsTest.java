package com.pulsewire.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ItemIds and Item construction rules.
 */
class ItemIdsTest {

    @Test
    @DisplayName("Should give the same article the same id across sources")
    void urlNormalisation() {
        String id = ItemIds.forUrl("https://www.Reuters.com/business/wpp-results/");

        assertEquals(id, ItemIds.forUrl("http://reuters.com/business/wpp-results"));
        assertEquals(id, ItemIds.forUrl("  https://reuters.com/business/wpp-results#comments "));
        assertNotEquals(id, ItemIds.forUrl("https://reuters.com/business/WPP-results"));
        assertEquals("reuters.com/business/wpp-results", ItemIds.normalizeUrl("HTTPS://WWW.REUTERS.COM/business/wpp-results//"));
    }

    @Test
    @DisplayName("Should produce 16 lowercase hex characters")
    void format() {
        String id = ItemIds.forContent("WPP", "2024-01-05");

        assertEquals(16, id.length());
        assertTrue(id.matches("[0-9a-f]{16}"));
        assertEquals(id, ItemIds.forContent("WPP", "2024-01-05"));
        assertNotEquals(id, ItemIds.forContent("WPP", "2024-01-06"));
        assertThrows(IllegalArgumentException.class, () -> ItemIds.forUrl(" "));
    }

    @Test
    @DisplayName("Should reject details of another kind")
    void kindMismatch() {
        assertThrows(IllegalArgumentException.class, () -> Item.builder()
            .kind(ItemKind.NEWS)
            .details(new SocialDetails("x", "Someone", "someone"))
            .build());
        assertThrows(IllegalArgumentException.class, () -> Item.builder().kind(ItemKind.FINANCIAL).build());
    }

    @Test
    @DisplayName("Should normalise optional fields")
    void defaults() {
        Item item = Item.builder()
            .details(new FinancialDetails("WPP", "WPP plc", "quote", 812.4, -1.2))
            .title("  WPP quote ")
            .relevanceHint(Double.NaN)
            .publishedAt(Instant.parse("2024-01-05T16:30:00Z"))
            .build();

        assertEquals(ItemKind.FINANCIAL, item.kind());
        assertEquals("WPP quote", item.title());
        assertEquals("", item.id());
        assertFalse(item.hasId());
        assertEquals(Item.DEFAULT_RELEVANCE_HINT, item.relevanceHint());
        assertEquals(1.0, Item.builder().relevanceHint(7).build().relevanceHint());
        assertEquals(ItemKind.NEWS, Item.builder().build().kind());
    }
}
