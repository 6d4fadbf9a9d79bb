package com.pulsewire.core.pipeline;

import com.pulsewire.core.config.ProfileConfig;
import com.pulsewire.core.config.ScoringSettings;
import com.pulsewire.core.coordinator.CollectionResult;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ScoredItem;
import com.pulsewire.core.model.Source;
import com.pulsewire.core.trace.ProcessingSummary;
import com.pulsewire.core.trace.RunTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.DoubleSummaryStatistics;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Filter, deduplicate, score, sort and limit, always in that order.
 */
public class ProcessingPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProcessingPipeline.class);

    private final ProfileConfig profile;
    private final ToIntFunction<String> priorityOfCollector;
    private final DateWindowFilter filter = new DateWindowFilter();
    private final Deduplicator deduplicator = new Deduplicator();
    private final ItemScorer scorer;

    public ProcessingPipeline(ProfileConfig profile, ScoringSettings scoring, ToIntFunction<String> priorityOfCollector) {
        this.profile = profile;
        this.priorityOfCollector = priorityOfCollector;
        this.scorer = new ItemScorer(scoring, new RelevanceMatcher(profile, scoring));
    }

    /**
     * @param limit maximum number of items to return, or null for all
     */
    public PipelineResult process(CollectionResult collected, DateWindow window, Integer limit, RunTrace trace) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        long start = System.nanoTime();
        List<Item> raw = collected.items();

        List<Item> inWindow = filter.apply(raw, window, profile.dropUndated());
        trace.recordItemsAfterFilter(countByCollector(inWindow));

        List<Item> unique = deduplicator.deduplicate(inWindow, collected.collectorOrder());

        List<ScoredItem> ranked = scorer.score(unique, window);
        ranked.sort(ItemOrdering.byRank(priorityOfCollector));

        List<ScoredItem> returned = limit != null && limit < ranked.size() ? ranked.subList(0, limit) : ranked;
        List<Source> sources = Source.deduplicate(collected.sources());

        DoubleSummaryStatistics scores = ranked.stream().mapToDouble(ScoredItem::score).summaryStatistics();
        Double minScore = scores.getCount() > 0 ? scores.getMin() : null;
        Double maxScore = scores.getCount() > 0 ? scores.getMax() : null;
        ProcessingSummary summary = new ProcessingSummary(raw.size(), inWindow.size(), unique.size(),
            returned.size(), minScore, maxScore, (System.nanoTime() - start) / 1_000_000);
        trace.recordProcessing(summary);

        log.info("Processed {} items: {} in window, {} unique, {} returned",
            raw.size(), inWindow.size(), unique.size(), returned.size());
        return new PipelineResult(returned, sources, summary);
    }

    private static Map<String, Integer> countByCollector(List<Item> items) {
        Map<String, Integer> counts = new HashMap<>();
        for (Item item : items) {
            counts.merge(item.collectorId(), 1, Integer::sum);
        }
        return counts;
    }
}
