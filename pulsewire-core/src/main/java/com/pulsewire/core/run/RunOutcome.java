package com.pulsewire.core.run;

import com.pulsewire.core.pipeline.DateWindow;
import com.pulsewire.core.pipeline.PipelineResult;
import com.pulsewire.core.trace.RunTrace;

import java.util.List;

/**
 * Result of a run before delivery.
 */
public record RunOutcome(
    String reportType,
    DateWindow window,
    PipelineResult result,
    RunTrace trace,
    List<String> warnings
) {
    public RunOutcome {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
