package com.pulsewire.collectors.financial;

import com.pulsewire.collectors.TestRequests;
import com.pulsewire.collectors.TestRequests.MapCache;
import com.pulsewire.collectors.http.HttpClientFactory;
import com.pulsewire.core.collector.CancellationToken;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.FocusEntity;
import com.pulsewire.core.config.ProfileConfig;
import com.pulsewire.core.model.FinancialDetails;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.trace.CallLog;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlphaVantageCollectorTest {

    private static final ProfileConfig PROFILE = new ProfileConfig("ads",
        List.of(new FocusEntity("WPP plc", "WPP", null, null),
            new FocusEntity("Omnicom", "OMC", null, null),
            new FocusEntity("Private Agency", null, null, null)),
        null, null, null, null, false);

    private static final String QUOTE = """
        {"Global Quote": {
          "01. symbol": "WPP",
          "05. price": "812.4000",
          "07. latest trading day": "2024-03-04",
          "10. change percent": "-1.2000%"
        }}
        """;

    private MockWebServer server;
    private AlphaVantageCollector collector;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        collector = new AlphaVantageCollector(CollectorRegistration.of("alpha_vantage",
            Map.of("base_url", server.url("/").toString(), "min_interval_ms", 0)), HttpClientFactory.getClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should quote every listed entity")
    void quotes() throws Exception {
        // Given
        server.enqueue(new MockResponse().setBody(QUOTE));
        server.enqueue(new MockResponse().setBody(QUOTE.replace("WPP", "OMC")));

        // When
        CollectorResult result = collector.collect(
            TestRequests.request(PROFILE, AlphaVantageCollector.API_KEY, "av-secret"));

        // Then
        assertTrue(result.success());
        assertEquals(2, result.items().size());
        assertEquals(2, server.getRequestCount());

        Item item = result.items().get(0);
        assertEquals(ItemKind.FINANCIAL, item.kind());
        assertEquals("WPP 812.40 (-1.20%)", item.title());
        assertEquals(Instant.parse("2024-03-04T00:00:00Z"), item.publishedAt());
        assertFalse(item.url().contains("av-secret"));
        assertEquals(0.8, item.relevanceHint(), 1e-9);
        FinancialDetails details = (FinancialDetails) item.details();
        assertEquals("WPP", details.symbol());
        assertEquals("WPP plc", details.entityName());
        assertEquals(812.4, details.value(), 1e-9);
        assertEquals(-1.2, details.changePct(), 1e-9);

        assertEquals("WPP", server.takeRequest().getRequestUrl().queryParameter("symbol"));
    }

    @Test
    @DisplayName("Should stop at the quota notice and keep earlier quotes")
    void quotaNotice() {
        // Given
        server.enqueue(new MockResponse().setBody(QUOTE));
        server.enqueue(new MockResponse().setBody("{\"Note\": \"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute.\"}"));
        MapCache cache = new MapCache();
        CollectRequest request = new CollectRequest(PROFILE, TestRequests.FROM, TestRequests.TO, TestRequests.depth(25),
            AlphaVantageCollector.API_KEY, "av-secret", new CancellationToken(), cache, false, new CallLog());

        // When
        CollectorResult result = collector.collect(request);

        // Then
        assertTrue(result.success());
        assertEquals(1, result.items().size());
        assertEquals(1, cache.entries.size());
    }

    @Test
    @DisplayName("Should fail when the first call hits the quota")
    void quotaFirst() {
        // Given
        server.enqueue(new MockResponse().setBody("{\"Information\": \"Daily limit reached\"}"));

        // When
        CollectorResult result = collector.collect(
            TestRequests.request(PROFILE, AlphaVantageCollector.API_KEY, "av-secret"));

        // Then
        assertFalse(result.success());
        assertTrue(result.error().contains("rate limit"), result.error());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("Should fail without listed entities")
    void noSymbols() {
        // When
        CollectorResult result = collector.collect(
            TestRequests.request(ProfileConfig.named("empty"), AlphaVantageCollector.API_KEY, "k"));

        // Then
        assertEquals("No listed entities in profile", result.error());
    }

    @Test
    @DisplayName("Should format titles with and without change")
    void titles() {
        assertEquals("OMC 75.00 (+0.50%)", AlphaVantageCollector.quoteTitle("OMC", 75, 0.5));
        assertEquals("OMC 75.00", AlphaVantageCollector.quoteTitle("OMC", 75, null));
    }
}
