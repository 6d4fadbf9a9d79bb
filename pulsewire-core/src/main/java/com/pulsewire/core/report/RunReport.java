package com.pulsewire.core.report;

import com.pulsewire.core.model.ScoredItem;
import com.pulsewire.core.model.Source;
import com.pulsewire.core.trace.TraceDocument;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything a report generator receives: ranked items, citations and the run trace.
 */
public record RunReport(
    String domain,
    String profile,
    String reportType,
    LocalDate fromDate,
    LocalDate toDate,
    List<ScoredItem> items,
    List<Source> sources,
    List<String> warnings,
    TraceDocument trace
) {
    public RunReport {
        items = List.copyOf(items);
        sources = List.copyOf(sources);
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
