package com.pulsewire.collectors.web;

import com.pulsewire.collectors.CollectorCatalog;
import com.pulsewire.collectors.TestRequests;
import com.pulsewire.collectors.http.HttpClientFactory;
import com.pulsewire.core.availability.Availability;
import com.pulsewire.core.availability.AvailabilityProber;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.Credentials;
import com.pulsewire.core.config.ProfileConfig;
import com.pulsewire.core.model.AwardDetails;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemKind;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebPageCollectorTest {

    private static final String NEWS_PAGE_1 = """
        <html><body>
          <div class="post"><h2>Agency of the year named</h2><a href="/posts/1">Read</a>
            <time datetime="2024-03-02T08:00:00Z">2 March</time><p class="intro">Shortlist revealed.</p></div>
          <div class="post"><h2>Archive piece</h2><a href="/posts/0"></a><span class="date">January 5, 2023</span></div>
          <a class="next" href="/news?page=2">Older</a>
        </body></html>
        """;

    private static final String NEWS_PAGE_2 = """
        <html><body>
          <div class="post"><h2>Undated interview</h2><a href="https://other.example.com/interview">Read</a></div>
        </body></html>
        """;

    private static final String AWARDS_PAGE = """
        <html><body>
          <article class="winner"><h3>Fearless Girl</h3><span class="medal">Grand Prix</span>
            <span class="agency">McCann New York</span><span class="cat">Outdoor</span></article>
          <article class="winner"><h3></h3></article>
        </body></html>
        """;

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private WebPageCollector collector(Map<String, Object> page) {
        return new WebPageCollector(CollectorRegistration.of("web",
            Map.of("pages", List.of(page), "min_interval_ms", 0)), HttpClientFactory.getClient());
    }

    private Map<String, Object> newsPage() {
        return Map.of(
            "name", "Trade Press",
            "url", server.url("/news").toString(),
            "item", "div.post",
            "title", "h2",
            "date", "time, .date",
            "snippet", "p.intro",
            "next", "a.next");
    }

    @Nested
    @DisplayName("News pages")
    class NewsPages {

        @Test
        @DisplayName("Should follow pagination and keep items inside the window")
        void paginates() throws Exception {
            // Given
            server.enqueue(new MockResponse().setBody(NEWS_PAGE_1));
            server.enqueue(new MockResponse().setBody(NEWS_PAGE_2));

            // When
            CollectorResult result = collector(newsPage())
                .collect(TestRequests.request(ProfileConfig.named("ads"), WebPageCollector.ENABLE_KEY, "1"));

            // Then
            assertTrue(result.success());
            assertEquals(2, server.getRequestCount());
            assertEquals(2, result.items().size());

            Item first = result.items().get(0);
            assertEquals(ItemKind.NEWS, first.kind());
            assertEquals("Agency of the year named", first.title());
            assertEquals(server.url("/posts/1").toString(), first.url());
            assertEquals(Instant.parse("2024-03-02T08:00:00Z"), first.publishedAt());
            assertEquals("Shortlist revealed.", first.snippet());
            assertEquals("Trade Press", first.sourceName());

            Item second = result.items().get(1);
            assertEquals("https://other.example.com/interview", second.url());
            assertNull(second.publishedAt());

            server.takeRequest();
            assertEquals("/news?page=2", server.takeRequest().getPath());
        }

        @Test
        @DisplayName("Should be unavailable when the scraping switch is off")
        void switchedOff() {
            // Given
            WebPageCollector collector = collector(newsPage());
            AvailabilityProber prober = new AvailabilityProber();

            for (String off : List.of("false", "0", "no", "OFF")) {
                // When
                Credentials credentials = Credentials.of(Map.of(WebPageCollector.ENABLE_KEY, off))
                    .withoutSwitchedOff(CollectorCatalog.switchKeys());
                Availability availability = prober.probe(collector, credentials.configuredKeys());

                // Then
                assertFalse(availability.available(), off);
                assertEquals(List.of(WebPageCollector.ENABLE_KEY), availability.missingKeys());
            }
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("Should be available when the scraping switch is on")
        void switchedOn() {
            // When
            Credentials credentials = Credentials.of(Map.of(WebPageCollector.ENABLE_KEY, "1"))
                .withoutSwitchedOff(CollectorCatalog.switchKeys());
            Availability availability = new AvailabilityProber().probe(collector(newsPage()), credentials.configuredKeys());

            // Then
            assertTrue(availability.available());
            assertEquals(WebPageCollector.ENABLE_KEY, availability.credentialKey());
        }
    }

    @Test
    @DisplayName("Should read award results")
    void awards() {
        // Given
        server.enqueue(new MockResponse().setBody(AWARDS_PAGE));
        WebPageCollector collector = collector(Map.of(
            "name", "Cannes Lions",
            "url", server.url("/winners").toString(),
            "item", "article.winner",
            "title", "h3",
            "kind", "award",
            "medal", ".medal",
            "winner", ".agency",
            "category", ".cat",
            "year", 2024));

        // When
        CollectorResult result = collector.collect(
            TestRequests.request(ProfileConfig.named("ads"), WebPageCollector.ENABLE_KEY, "yes"));

        // Then
        assertEquals(1, result.items().size());
        Item item = result.items().get(0);
        assertEquals(ItemKind.AWARD, item.kind());
        AwardDetails award = (AwardDetails) item.details();
        assertEquals("Cannes Lions", award.awardShow());
        assertEquals("Grand Prix", award.medal());
        assertEquals("McCann New York", award.winner());
        assertEquals("Outdoor", award.category());
        assertEquals("Fearless Girl", award.campaign());
        assertEquals(2024, award.year());
        assertTrue(item.url().isEmpty());
        assertFalse(item.id().isEmpty());
    }

    @Test
    @DisplayName("Should reject page definitions without an item selector")
    void missingItemSelector() {
        assertThrows(IllegalArgumentException.class,
            () -> collector(Map.of("url", "https://example.com/list")));
    }

    @Test
    @DisplayName("Should reject malformed selectors")
    void badSelector() {
        assertThrows(IllegalArgumentException.class,
            () -> collector(Map.of("url", "https://example.com/list", "item", "div[")));
    }

    @Test
    @DisplayName("Should reject pages that are not http(s) URLs")
    void nonHttpPage() {
        assertThrows(IllegalArgumentException.class,
            () -> collector(Map.of("url", "ftp://example.com/list", "item", "li")));
    }

    @Test
    @DisplayName("Should read max_pages in snake case")
    void maxPages() {
        // When
        WebPageCollector collector = collector(Map.of(
            "url", "https://example.com/list", "item", "li", "max_pages", 2));

        // Then
        assertEquals(2, collector.pages().get(0).maxPages());
        assertEquals("https://example.com/list", collector.pages().get(0).name());
    }
}
