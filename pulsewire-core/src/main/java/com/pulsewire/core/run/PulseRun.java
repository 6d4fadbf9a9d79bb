package com.pulsewire.core.run;

import com.pulsewire.core.availability.Availability;
import com.pulsewire.core.availability.AvailabilityProber;
import com.pulsewire.core.cache.ResponseCache;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.config.Credentials;
import com.pulsewire.core.config.DepthTable;
import com.pulsewire.core.config.PulseConfig;
import com.pulsewire.core.coordinator.CollectionPlan;
import com.pulsewire.core.coordinator.CollectionResult;
import com.pulsewire.core.coordinator.CoordinatorOptions;
import com.pulsewire.core.coordinator.ExecutionCoordinator;
import com.pulsewire.core.pipeline.PipelineResult;
import com.pulsewire.core.pipeline.ProcessingPipeline;
import com.pulsewire.core.report.DeliveryException;
import com.pulsewire.core.report.ReportSink;
import com.pulsewire.core.report.RunReport;
import com.pulsewire.core.trace.DeliveryTrace;
import com.pulsewire.core.trace.RunTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One configured collection run: availability check, concurrent collection, processing
 * and hand-off to a report sink.
 */
public class PulseRun {

    private static final Logger log = LoggerFactory.getLogger(PulseRun.class);

    private final PulseConfig config;
    private final List<Collector> collectors;
    private final Credentials credentials;
    private final ResponseCache cache;
    private final Clock clock;
    private final AvailabilityProber prober = new AvailabilityProber();

    public PulseRun(PulseConfig config, List<Collector> collectors, Credentials credentials,
                    ResponseCache cache, Clock clock) {
        this.config = config;
        this.collectors = List.copyOf(collectors);
        this.credentials = credentials;
        this.cache = cache;
        this.clock = clock;
    }

    /** Availability of every registered collector, in registration order. No I/O. */
    public List<Availability> preflight() {
        return prober.probe(collectors, credentials.configuredKeys());
    }

    /**
     * Collect and process. Individual collector failures are reported through the trace.
     *
     * @throws RunFailedException if no collector can run at all
     */
    public RunOutcome execute(RunRequest request) throws RunFailedException {
        RunTrace trace = new RunTrace(UUID.randomUUID().toString(), config.domain(), config.profile().name(),
            request.reportType(), request.depth().key(), clock);
        trace.start();
        log.info("Starting run {} for {}/{} ({} to {})", trace.getRunId(), config.domain(),
            config.profile().name(), request.window().fromDate(), request.window().toDate());
        try {
            List<Availability> availability = preflight();
            List<String> warnings = new ArrayList<>(AvailabilityProber.warnings(availability));
            warnings.addAll(unknownSelections(request));
            warnings.forEach(w -> log.warn(w));

            CoordinatorOptions options = CoordinatorOptions.builder()
                .settings(config.run())
                .depth(request.depth())
                .retries(request.retries())
                .timeoutOverride(request.timeoutOverride())
                .noCache(request.noCache())
                .build();
            CollectionPlan plan = new CollectionPlan(config.profile(), request.window().fromDate(),
                request.window().toDate(), credentials, request.selection(), options);

            ExecutionCoordinator coordinator = new ExecutionCoordinator(DepthTable.from(config), cache, clock);
            CollectionResult collected = coordinator.run(availability, plan, trace);

            ProcessingPipeline pipeline = new ProcessingPipeline(config.profile(), config.scoring(), config::priorityOf);
            PipelineResult result = pipeline.process(collected, request.window(), request.limit(), trace);
            return new RunOutcome(request.reportType(), request.window(), result, trace, warnings);
        } finally {
            trace.complete();
        }
    }

    /**
     * Hand the outcome to a sink and record the delivery in the trace.
     * A failed delivery is reported, not thrown.
     */
    public DeliveryTrace deliver(RunOutcome outcome, ReportSink sink) {
        Instant started = clock.instant();
        long start = System.nanoTime();
        String error = null;
        try {
            sink.deliver(toReport(outcome));
        } catch (DeliveryException e) {
            log.error("Delivery via {} failed: {}", sink.channel(), e.getMessage());
            error = e.getMessage();
        }
        DeliveryTrace delivery = new DeliveryTrace(sink.channel(), started, clock.instant(),
            (System.nanoTime() - start) / 1_000_000, error == null, error);
        outcome.trace().recordDelivery(delivery);
        return delivery;
    }

    public RunReport toReport(RunOutcome outcome) {
        PipelineResult result = outcome.result();
        return new RunReport(config.domain(), config.profile().name(), outcome.reportType(),
            outcome.window().fromDate(), outcome.window().toDate(), result.items(), result.sources(),
            outcome.warnings(), outcome.trace().snapshot());
    }

    private List<String> unknownSelections(RunRequest request) {
        Set<String> known = collectors.stream().map(Collector::id).collect(Collectors.toSet());
        List<String> warnings = new ArrayList<>();
        for (String id : request.selection().include()) {
            if (!known.contains(id)) warnings.add("Unknown collector in --collectors: " + id);
        }
        for (String id : request.selection().exclude()) {
            if (!known.contains(id)) warnings.add("Unknown collector in --exclude-collectors: " + id);
        }
        return warnings;
    }
}
