package com.pulsewire.core.pipeline;

import com.pulsewire.core.model.ScoredItem;
import com.pulsewire.core.model.Source;
import com.pulsewire.core.trace.ProcessingSummary;

import java.util.List;

/**
 * Ranked items, deduplicated citations and the counts of each stage.
 */
public record PipelineResult(List<ScoredItem> items, List<Source> sources, ProcessingSummary summary) {

    public PipelineResult {
        items = List.copyOf(items);
        sources = List.copyOf(sources);
    }
}
