package com.pulsewire.core.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of one run. Collector threads, the coordinator and the pipeline
 * write to it concurrently; nothing here blocks or throws into the caller.
 */
public class RunTrace {

    private static final Logger log = LoggerFactory.getLogger(RunTrace.class);

    private final String runId;
    private final String domain;
    private final String profile;
    private final String reportType;
    private final String depth;
    private final Clock clock;

    private final Map<String, CollectorTrace> collectors = new ConcurrentHashMap<>();
    private final List<String> collectorOrder = new CopyOnWriteArrayList<>();

    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile ProcessingSummary processing;
    private volatile DeliveryTrace delivery;

    public RunTrace(String domain, String profile, String reportType, String depth) {
        this(UUID.randomUUID().toString(), domain, profile, reportType, depth, Clock.systemUTC());
    }

    public RunTrace(String runId, String domain, String profile, String reportType, String depth, Clock clock) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.domain = domain;
        this.profile = profile;
        this.reportType = reportType;
        this.depth = depth;
        this.clock = clock;
    }

    public String getRunId() {
        return runId;
    }

    public void start() {
        startedAt = clock.instant();
    }

    public void complete() {
        endedAt = clock.instant();
    }

    /**
     * Add the entry for a collector. Each collector id is recorded once; later entries are ignored.
     */
    public void append(CollectorTrace entry) {
        if (collectors.putIfAbsent(entry.id(), entry) == null) {
            collectorOrder.add(entry.id());
        } else {
            log.warn("Ignoring duplicate trace entry for collector {}", entry.id());
        }
    }

    /** Record how many of each collector's items survived the date filter. */
    public void recordItemsAfterFilter(Map<String, Integer> countsByCollector) {
        for (String id : collectorOrder) {
            collectors.computeIfPresent(id, (key, entry) -> entry.status().isSkipped()
                ? entry
                : entry.withItemsAfterFilter(countsByCollector.getOrDefault(key, 0)));
        }
    }

    public void recordProcessing(ProcessingSummary summary) {
        this.processing = summary;
    }

    public void recordDelivery(DeliveryTrace delivery) {
        this.delivery = delivery;
    }

    public CollectorTrace getCollector(String id) {
        return collectors.get(id);
    }

    public List<CollectorTrace> getCollectors() {
        List<CollectorTrace> entries = new ArrayList<>(collectorOrder.size());
        for (String id : collectorOrder) {
            entries.add(collectors.get(id));
        }
        return entries;
    }

    /** Snapshot for serialization and reporting. */
    public TraceDocument snapshot() {
        Instant start = startedAt;
        Instant end = endedAt;
        Long durationMs = start != null && end != null ? Duration.between(start, end).toMillis() : null;
        return new TraceDocument(runId, domain, profile, reportType, depth, start, end, durationMs,
            getCollectors(), processing, delivery);
    }
}
