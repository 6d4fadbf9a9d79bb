package com.pulsewire.core.trace;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewire.core.json.Mappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RunTrace and its JSON and text renderings.
 */
class RunTraceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private RunTrace trace;

    @BeforeEach
    void setUp() {
        trace = new RunTrace("run-1", "advertising", "wpp", "daily_brief", "default",
            Clock.fixed(T0, ZoneOffset.UTC));
    }

    private static CollectorTrace succeeded(String id, int items) {
        ApiCall call = new ApiCall("https://api.example.com/search?q=x", "GET", 200, 120, false, null, 1, T0);
        ApiCall cached = new ApiCall("https://api.example.com/search?q=y", "GET", 200, 0, true, null, 1, T0);
        return new CollectorTrace(id, "Collector " + id, "news", CollectorStatus.SUCCEEDED, T0, T0.plusMillis(1500),
            1500, 1, items, null, "NEWSDATA_API_KEY", List.of(call, cached), true, null);
    }

    private static CollectorTrace failed(String id) {
        return new CollectorTrace(id, "Collector " + id, "financial", CollectorStatus.FAILED, T0, T0.plusSeconds(3),
            3000, 3, 0, null, null, List.of(), false, "HTTP 503");
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("Should keep the first entry for a collector id")
        void duplicateIgnored() {
            // Given
            trace.append(succeeded("news", 4));

            // When
            trace.append(failed("news"));

            // Then
            assertEquals(1, trace.getCollectors().size());
            assertEquals(CollectorStatus.SUCCEEDED, trace.getCollector("news").status());
        }

        @Test
        @DisplayName("Should set items after filter on ran collectors only")
        void itemsAfterFilter() {
            // Given
            trace.append(succeeded("news", 4));
            trace.append(failed("quotes"));
            trace.append(CollectorTrace.skipped("x", "X", "social", CollectorStatus.SKIPPED_UNAVAILABLE, "missing: XAI_API_KEY"));

            // When
            trace.recordItemsAfterFilter(Map.of("news", 3));

            // Then
            assertEquals(3, trace.getCollector("news").itemsAfterFilter());
            assertEquals(0, trace.getCollector("quotes").itemsAfterFilter());
            assertNull(trace.getCollector("x").itemsAfterFilter());
        }

        @Test
        @DisplayName("Should accept concurrent appends without losing entries")
        void concurrentAppends() throws Exception {
            // Given
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);

            // When
            for (int i = 0; i < 50; i++) {
                String id = "c" + i;
                pool.submit(() -> {
                    start.await();
                    trace.append(succeeded(id, 1));
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            // Then
            assertEquals(50, trace.getCollectors().size());
            assertEquals(50, trace.snapshot().totalItemsCollected());
        }

        @Test
        @DisplayName("Should count skipped collectors as neither succeeded nor failed")
        void counts() {
            trace.append(succeeded("news", 2));
            trace.append(failed("quotes"));
            trace.append(CollectorTrace.skipped("x", "X", "social", CollectorStatus.SKIPPED_EXCLUDED, "excluded"));

            TraceDocument doc = trace.snapshot();

            assertEquals(1, doc.successfulCollectors());
            assertEquals(1, doc.failedCollectors());
            assertEquals(2, doc.totalApiCalls());
        }
    }

    @Nested
    @DisplayName("Serialization")
    class Serialization {

        @Test
        @DisplayName("Should write snake_case fields and omit nulls")
        void snakeCase() throws Exception {
            // Given
            trace.start();
            trace.append(succeeded("news", 4));
            trace.complete();

            // When
            JsonNode json = Mappers.json().readTree(TraceWriter.toJson(trace.snapshot()));

            // Then
            assertEquals("run-1", json.get("run_id").asText());
            assertEquals("daily_brief", json.get("report_type").asText());
            assertEquals("2024-03-01T08:00:00Z", json.get("started_at").asText());
            assertEquals(0, json.get("duration_ms").asLong());
            JsonNode collector = json.get("collectors").get(0);
            assertEquals("SUCCEEDED", collector.get("status").asText());
            assertEquals(4, collector.get("items_collected").asInt());
            assertEquals("NEWSDATA_API_KEY", collector.get("credential_used").asText());
            assertEquals(120, collector.get("api_calls").get(0).get("latency_ms").asLong());
            assertFalse(collector.has("items_after_filter"));
            assertFalse(collector.has("error"));
            assertFalse(json.has("delivery"));
        }

        @Test
        @DisplayName("Should read back what it writes")
        void roundTrip(@TempDir Path dir) throws Exception {
            // Given
            trace.start();
            trace.append(succeeded("news", 4));
            trace.append(failed("quotes"));
            trace.recordProcessing(new ProcessingSummary(4, 3, 3, 3, 0.2, 0.9, 5));
            trace.recordDelivery(new DeliveryTrace("json", T0, T0, 0, true, null));
            trace.complete();
            TraceDocument doc = trace.snapshot();
            Path file = dir.resolve("traces").resolve("run-1.json");

            // When
            TraceWriter.write(doc, file);

            // Then
            assertTrue(Files.exists(file));
            assertEquals(doc, TraceWriter.fromJson(Files.readString(file)));
        }
    }

    @Nested
    @DisplayName("Formatting")
    class Formatting {

        @Test
        @DisplayName("Should render one line per collector with its outcome")
        void tree() {
            // Given
            trace.append(succeeded("news", 4));
            trace.append(failed("quotes"));
            trace.append(CollectorTrace.skipped("x", "X Search", "social", CollectorStatus.SKIPPED_UNAVAILABLE, "missing: XAI_API_KEY"));
            trace.recordProcessing(new ProcessingSummary(4, 3, 3, 2, 0.25, 0.75, 5));

            // When
            String text = TraceFormatter.format(trace.snapshot());

            // Then
            List<String> lines = new ArrayList<>(text.lines().toList());
            assertTrue(lines.get(0).startsWith("Run run-1"));
            assertTrue(text.contains("Collectors (1/3 succeeded)"));
            assertTrue(text.contains("✓ Collector news 4 items, 1.50s [2 calls, 1 cached]"));
            assertTrue(text.contains("✗ Collector quotes failed after 3 attempts: HTTP 503"));
            assertTrue(text.contains("✗ X Search skipped (missing: XAI_API_KEY)"));
            assertTrue(text.contains("Processing: 4 → 3 filtered → 3 unique → 2 returned (scores 0.250..0.750)"));
            assertTrue(text.endsWith("└── Delivery: none\n"));
        }
    }
}
