package com.pulsewire.core.run;

import com.pulsewire.core.FakeCollector;
import com.pulsewire.core.TestItems;
import com.pulsewire.core.availability.Availability;
import com.pulsewire.core.cache.ResponseCache;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.Credentials;
import com.pulsewire.core.config.PulseConfig;
import com.pulsewire.core.coordinator.CollectorSelection;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.pipeline.DateWindow;
import com.pulsewire.core.report.DeliveryException;
import com.pulsewire.core.report.ReportSink;
import com.pulsewire.core.report.RunReport;
import com.pulsewire.core.trace.CollectorStatus;
import com.pulsewire.core.trace.DeliveryTrace;
import com.pulsewire.core.trace.TraceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for PulseRun with scripted collectors.
 */
class PulseRunTest {

    private static final DateWindow WINDOW = new DateWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7), ZoneId.of("UTC"));
    private static final Instant MIDWEEK = Instant.parse("2024-01-04T10:00:00Z");

    private final PulseConfig config = new PulseConfig("advertising", null,
        List.of(new CollectorRegistration("rss", null, 10, null, null, null), CollectorRegistration.of("news")),
        null, null, null, null);

    private static Item item(String id, String title, Instant at) {
        return TestItems.news(id, title, at);
    }

    private PulseRun run(List<Collector> collectors, Credentials credentials) {
        return new PulseRun(config, collectors, credentials, ResponseCache.disabled(), Clock.systemUTC());
    }

    private static class CapturingSink implements ReportSink {
        final List<RunReport> reports = new ArrayList<>();

        @Override
        public String channel() {
            return "memory";
        }

        @Override
        public void deliver(RunReport report) {
            reports.add(report);
        }
    }

    @Test
    @DisplayName("Should collect, rank and deliver with a complete trace")
    void endToEnd() throws Exception {
        // Given
        FakeCollector rss = FakeCollector.returning("rss",
            item("a", "Agency wins account", MIDWEEK),
            item("shared", "Holding company results", MIDWEEK.minusSeconds(3600)),
            item("old", "Last year", Instant.parse("2023-06-01T00:00:00Z")));
        FakeCollector news = FakeCollector.returning("news",
            TestItems.newsBuilder("shared", "Holding company results").snippet("Full text from the API")
                .publishedAt(MIDWEEK.minusSeconds(3600)).build());
        FakeCollector social = new FakeCollector("x", r -> CollectorResult.empty()).withCredentials(false, "XAI_API_KEY");
        PulseRun pulseRun = run(List.of(rss, news, social), Credentials.empty());
        CapturingSink sink = new CapturingSink();

        // When
        RunOutcome outcome = pulseRun.execute(RunRequest.builder(WINDOW).retries(0).build());
        DeliveryTrace delivery = pulseRun.deliver(outcome, sink);

        // Then
        assertEquals(List.of("Fake x unavailable: missing: XAI_API_KEY"), outcome.warnings());
        assertEquals(2, outcome.result().items().size());
        Item shared = outcome.result().items().stream().map(s -> s.item())
            .filter(i -> i.id().equals("shared")).findFirst().orElseThrow();
        assertEquals("Full text from the API", shared.snippet());
        assertEquals(0, social.invocations());

        assertTrue(delivery.success());
        assertEquals(1, sink.reports.size());
        RunReport report = sink.reports.get(0);
        assertEquals("advertising", report.domain());
        assertEquals(RunRequest.DEFAULT_REPORT_TYPE, report.reportType());
        assertEquals(WINDOW.fromDate(), report.fromDate());
        assertEquals(2, report.sources().size());

        TraceDocument trace = outcome.trace().snapshot();
        assertEquals(List.of("rss", "news", "x"), trace.collectors().stream().map(c -> c.id()).toList());
        assertEquals(CollectorStatus.SKIPPED_UNAVAILABLE, trace.collectors().get(2).status());
        assertEquals(3, trace.collectors().get(0).itemsCollected());
        assertEquals(2, trace.collectors().get(0).itemsAfterFilter());
        assertEquals(4, trace.processing().itemsBeforeFilter());
        assertEquals(2, trace.processing().itemsAfterDedup());
        assertNotNull(trace.durationMs());
        assertEquals("memory", trace.delivery().channel());
        assertEquals("default", trace.depth());
    }

    @Test
    @DisplayName("Should warn about unknown collector ids in the selection")
    void unknownSelection() throws Exception {
        PulseRun pulseRun = run(List.of(FakeCollector.returning("rss", item("a", "A", MIDWEEK))), Credentials.empty());

        RunOutcome outcome = pulseRun.execute(RunRequest.builder(WINDOW)
            .selection(CollectorSelection.parse("rss,typo", "other"))
            .build());

        assertTrue(outcome.warnings().contains("Unknown collector in --collectors: typo"));
        assertTrue(outcome.warnings().contains("Unknown collector in --exclude-collectors: other"));
        assertEquals(1, outcome.result().items().size());
    }

    @Test
    @DisplayName("Should fail the run when no collector has its credentials")
    void nothingAvailable() {
        FakeCollector news = new FakeCollector("news", r -> CollectorResult.empty())
            .withCredentials(true, "NEWSDATA_API_KEY", "NEWSAPI_API_KEY");
        PulseRun pulseRun = run(List.of(news), Credentials.empty());

        assertThrows(RunFailedException.class, () -> pulseRun.execute(RunRequest.builder(WINDOW).build()));
    }

    @Test
    @DisplayName("Should report availability without running anything")
    void preflight() {
        FakeCollector news = new FakeCollector("news", r -> CollectorResult.empty())
            .withCredentials(true, "NEWSDATA_API_KEY", "NEWSAPI_API_KEY");
        PulseRun pulseRun = run(List.of(news), Credentials.of(Map.of("NEWSAPI_API_KEY", "k")));

        List<Availability> availability = pulseRun.preflight();

        assertTrue(availability.get(0).available());
        assertEquals("NEWSAPI_API_KEY", availability.get(0).credentialKey());
        assertEquals(0, news.invocations());
    }

    @Test
    @DisplayName("Should record a failed delivery instead of throwing")
    void failedDelivery() throws Exception {
        // Given
        PulseRun pulseRun = run(List.of(FakeCollector.returning("rss", item("a", "A", MIDWEEK))), Credentials.empty());
        RunOutcome outcome = pulseRun.execute(RunRequest.builder(WINDOW).build());
        ReportSink broken = new ReportSink() {
            @Override
            public String channel() {
                return "email";
            }

            @Override
            public void deliver(RunReport report) throws DeliveryException {
                throw new DeliveryException("SMTP unreachable");
            }
        };

        // When
        DeliveryTrace delivery = pulseRun.deliver(outcome, broken);

        // Then
        assertFalse(delivery.success());
        assertEquals("SMTP unreachable", delivery.error());
        assertEquals(delivery, outcome.trace().snapshot().delivery());
    }
}
