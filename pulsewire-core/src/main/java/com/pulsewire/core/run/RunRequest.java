package com.pulsewire.core.run;

import com.pulsewire.core.config.Depth;
import com.pulsewire.core.coordinator.CollectorSelection;
import com.pulsewire.core.pipeline.DateWindow;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-run parameters, typically mapped from command-line flags.
 */
public record RunRequest(
    DateWindow window,
    Depth depth,
    CollectorSelection selection,
    int retries,
    Duration timeoutOverride,   // null keeps the depth timeout
    Integer limit,              // null returns everything
    boolean noCache,
    String reportType
) {
    public static final String DEFAULT_REPORT_TYPE = "daily_brief";

    public RunRequest {
        Objects.requireNonNull(window, "window");
        depth = depth != null ? depth : Depth.DEFAULT;
        selection = selection != null ? selection : CollectorSelection.all();
        reportType = reportType != null && !reportType.isBlank() ? reportType : DEFAULT_REPORT_TYPE;
    }

    public static Builder builder(DateWindow window) {
        return new Builder(window);
    }

    public static class Builder {
        private final DateWindow window;
        private Depth depth = Depth.DEFAULT;
        private CollectorSelection selection = CollectorSelection.all();
        private int retries;
        private Duration timeoutOverride;
        private Integer limit;
        private boolean noCache;
        private String reportType = DEFAULT_REPORT_TYPE;

        private Builder(DateWindow window) {
            this.window = window;
        }

        public Builder depth(Depth depth) { this.depth = depth; return this; }
        public Builder selection(CollectorSelection selection) { this.selection = selection; return this; }
        public Builder retries(int retries) { this.retries = retries; return this; }
        public Builder timeoutOverride(Duration timeoutOverride) { this.timeoutOverride = timeoutOverride; return this; }
        public Builder limit(Integer limit) { this.limit = limit; return this; }
        public Builder noCache(boolean noCache) { this.noCache = noCache; return this; }
        public Builder reportType(String reportType) { this.reportType = reportType; return this; }

        public RunRequest build() {
            return new RunRequest(window, depth, selection, retries, timeoutOverride, limit, noCache, reportType);
        }
    }
}
