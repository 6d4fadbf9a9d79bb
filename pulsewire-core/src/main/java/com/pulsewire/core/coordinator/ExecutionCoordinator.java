package com.pulsewire.core.coordinator;

import com.pulsewire.core.availability.Availability;
import com.pulsewire.core.availability.AvailabilityProber;
import com.pulsewire.core.cache.ResponseCache;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.config.DepthProfile;
import com.pulsewire.core.config.DepthTable;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.Source;
import com.pulsewire.core.run.RunFailedException;
import com.pulsewire.core.trace.CollectorStatus;
import com.pulsewire.core.trace.CollectorTrace;
import com.pulsewire.core.trace.RunTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the selected collectors concurrently under per-collector timeouts and a global deadline.
 *
 * <p>Each collector gets a supervisor task on a bounded pool. The supervisor runs attempts on a
 * separate daemon pool so that an attempt which ignores cancellation can be abandoned without
 * blocking anything. A failure or timeout of one collector never affects the others.
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final DepthTable depths;
    private final ResponseCache cache;
    private final Clock clock;

    public ExecutionCoordinator(DepthTable depths, ResponseCache cache) {
        this(depths, cache, Clock.systemUTC());
    }

    public ExecutionCoordinator(DepthTable depths, ResponseCache cache, Clock clock) {
        this.depths = depths;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Run every available, selected collector and merge what finished in time.
     * Every registered collector ends up with exactly one trace entry.
     *
     * @throws RunFailedException if nothing is registered, available or selected
     */
    public CollectionResult run(List<Availability> availability, CollectionPlan plan, RunTrace trace)
            throws RunFailedException {
        if (availability.isEmpty()) {
            throw new RunFailedException("No collectors registered");
        }
        if (availability.stream().noneMatch(Availability::available)) {
            throw new RunFailedException("No collectors available: "
                + String.join("; ", AvailabilityProber.warnings(availability)));
        }

        CoordinatorOptions options = plan.options();
        List<CollectorSlot> slots = select(availability, plan, trace);
        if (slots.isEmpty()) {
            throw new RunFailedException("No collectors left to run after applying the collector selection");
        }

        log.info("Running {} collectors (depth: {}, retries: {}, deadline: {}s)",
            slots.size(), options.depth().key(), options.retries(), options.globalDeadline().toSeconds());

        int workers = Math.min(slots.size(), options.maxWorkers());
        ExecutorService supervisors = Executors.newFixedThreadPool(workers, daemonThreads("pulsewire-collector"));
        ExecutorService attempts = Executors.newCachedThreadPool(daemonThreads("pulsewire-attempt"));
        try {
            for (CollectorSlot slot : slots) {
                slot.setFuture(supervisors.submit(() -> supervise(slot, plan, attempts)));
            }
            awaitAll(slots, options);
        } finally {
            supervisors.shutdownNow();
            attempts.shutdownNow();
        }

        return merge(slots, trace);
    }

    private List<CollectorSlot> select(List<Availability> availability, CollectionPlan plan, RunTrace trace) {
        CoordinatorOptions options = plan.options();
        List<CollectorSlot> slots = new ArrayList<>();
        for (Availability a : availability) {
            Collector collector = a.collector();
            if (!a.available()) {
                trace.append(CollectorTrace.skipped(collector.id(), collector.name(), collector.type(),
                    CollectorStatus.SKIPPED_UNAVAILABLE, a.reason()));
                continue;
            }
            if (!plan.selection().admits(collector.id())) {
                trace.append(CollectorTrace.skipped(collector.id(), collector.name(), collector.type(),
                    CollectorStatus.SKIPPED_EXCLUDED, "excluded by collector selection"));
                continue;
            }
            DepthProfile depth = depths.resolve(options.depth(), collector.id());
            if (options.timeoutOverride() != null) {
                depth = depth.withTimeout(options.timeoutOverride());
            }
            slots.add(new CollectorSlot(a, depth));
        }
        return slots;
    }

    // ==================== Supervision ====================

    private void supervise(CollectorSlot slot, CollectionPlan plan, ExecutorService attempts) {
        slot.markStarted(clock.instant());
        Collector collector = slot.collector();
        CoordinatorOptions options = plan.options();
        int maxAttempts = 1 + options.retries();
        long budgetNanos = slot.depth().timeout().toNanos();
        String credential = slot.credentialKey() != null
            ? plan.credentials().get(slot.credentialKey()).orElse(null)
            : null;

        CollectorResult last = null;
        while (slot.attemptCount() < maxAttempts) {
            if (slot.token().isCancelled()) {
                return;
            }
            int attempt = slot.nextAttempt();
            CollectRequest request = new CollectRequest(plan.profile(), plan.fromDate(), plan.toDate(),
                slot.depth(), slot.credentialKey(), credential, slot.token(), cache, options.noCache(),
                slot.calls());

            Future<CollectorResult> future = attempts.submit(() -> collector.collect(request));
            try {
                long remaining = Math.max(0, budgetNanos - slot.elapsedNanos());
                last = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                String reason = "Timed out after " + slot.depth().timeout().toSeconds() + "s";
                slot.token().cancel(reason);
                if (slot.settle(null, traceOf(slot, CollectorStatus.TIMED_OUT, 0, reason))) {
                    log.warn("Collector {} timed out on attempt {}", collector.id(), attempt);
                }
                return;
            } catch (ExecutionException e) {
                Throwable fault = e.getCause() != null ? e.getCause() : e;
                log.error("Collector {} failed with an unexpected fault", collector.id(), fault);
                slot.settle(null, traceOf(slot, CollectorStatus.FAILED, 0, "Collector fault: " + describe(fault)));
                return;
            } catch (InterruptedException e) {
                // abandoned at the global deadline, the coordinator has settled the slot
                future.cancel(true);
                Thread.currentThread().interrupt();
                return;
            }

            if (last == null) {
                slot.settle(null, traceOf(slot, CollectorStatus.FAILED, 0, "Collector fault: returned no result"));
                return;
            }
            if (last.success()) {
                break;
            }
            log.warn("Collector {} attempt {}/{} failed: {}", collector.id(), attempt, maxAttempts, last.error());

            if (attempt < maxAttempts && !backoff(slot, options, attempt, budgetNanos)) {
                break;
            }
        }

        if (last == null) {
            return;
        }
        CollectorStatus status = last.success() ? CollectorStatus.SUCCEEDED : CollectorStatus.FAILED;
        if (slot.settle(last, traceOf(slot, status, capped(last, slot).size(), last.error()))) {
            log.info("Collector {} {}: {} items in {}ms", collector.id(),
                status == CollectorStatus.SUCCEEDED ? "succeeded" : "failed",
                last.items().size(), slot.elapsedMs());
        }
    }

    /**
     * Sleep before the next attempt.
     * @return false if the remaining time budget does not allow another attempt
     */
    private boolean backoff(CollectorSlot slot, CoordinatorOptions options, int attempt, long budgetNanos) {
        long sleepMs = options.retryBackoff().toMillis() * attempt;
        long remainingMs = (budgetNanos - slot.elapsedNanos()) / 1_000_000;
        if (remainingMs <= sleepMs) {
            log.info("Collector {} has no time left for another attempt", slot.id());
            return false;
        }
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void awaitAll(List<CollectorSlot> slots, CoordinatorOptions options) {
        long deadlineNanos = System.nanoTime() + options.globalDeadline().toNanos();
        for (CollectorSlot slot : slots) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                slot.future().get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                break;
            } catch (ExecutionException e) {
                Throwable fault = e.getCause() != null ? e.getCause() : e;
                log.error("Supervisor for collector {} failed", slot.id(), fault);
                slot.settle(null, traceOf(slot, CollectorStatus.FAILED, 0, "Collector fault: " + describe(fault)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        for (CollectorSlot slot : slots) {
            if (slot.isSettled()) continue;
            String reason = "Abandoned at global run deadline (" + options.globalDeadline().toSeconds() + "s)";
            if (slot.settle(null, traceOf(slot, CollectorStatus.TIMED_OUT, 0, reason))) {
                log.warn("Collector {} still running at the global deadline, abandoning it", slot.id());
            }
            slot.token().cancel(reason);
            slot.future().cancel(true);
        }
    }

    // ==================== Merge ====================

    private CollectionResult merge(List<CollectorSlot> slots, RunTrace trace) {
        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        List<String> order = new ArrayList<>();
        for (CollectorSlot slot : slots) {
            CollectorSlot.Settlement settlement = slot.settlement();
            trace.append(settlement.trace());
            order.add(slot.id());
            if (settlement.result() == null) continue;

            for (Item item : capped(settlement.result(), slot)) {
                items.add(slot.id().equals(item.collectorId()) ? item : item.withCollectorId(slot.id()));
            }
            sources.addAll(settlement.result().sources());
        }
        log.info("Collected {} items from {} collectors", items.size(), slots.size());
        return new CollectionResult(items, sources, order);
    }

    private static List<Item> capped(CollectorResult result, CollectorSlot slot) {
        List<Item> items = result.items();
        int max = slot.depth().maxItems();
        if (items.size() > max) {
            log.debug("Collector {} returned {} items, capping at {}", slot.id(), items.size(), max);
            return items.subList(0, max);
        }
        return items;
    }

    private CollectorTrace traceOf(CollectorSlot slot, CollectorStatus status, int itemsCollected, String error) {
        Collector collector = slot.collector();
        return new CollectorTrace(
            collector.id(),
            collector.name(),
            collector.type(),
            status,
            slot.startedAt(),
            clock.instant(),
            slot.elapsedMs(),
            slot.attemptCount(),
            itemsCollected,
            null,
            slot.credentialKey(),
            slot.calls().calls(),
            status == CollectorStatus.SUCCEEDED,
            error);
    }

    private static String describe(Throwable fault) {
        return fault.getMessage() != null
            ? fault.getClass().getSimpleName() + ": " + fault.getMessage()
            : fault.getClass().getSimpleName();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
