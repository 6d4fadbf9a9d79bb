package com.pulsewire.core.trace;

import java.util.List;
import java.util.Locale;

/**
 * Renders a trace as a plain-text tree for terminals and logs.
 */
public final class TraceFormatter {

    private TraceFormatter() {
    }

    public static String format(TraceDocument trace) {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(trace.runId()).append('\n');
        sb.append("├── Domain: ").append(trace.domain()).append('\n');
        sb.append("├── Profile: ").append(trace.profile()).append('\n');
        sb.append("├── Report: ").append(trace.reportType())
            .append(" (").append(trace.depth()).append(")\n");
        if (trace.durationMs() != null) {
            sb.append("├── Duration: ").append(seconds(trace.durationMs())).append('\n');
        }

        List<CollectorTrace> collectors = trace.collectors();
        sb.append("├── Collectors (").append(trace.successfulCollectors()).append('/')
            .append(collectors.size()).append(" succeeded)\n");
        for (int i = 0; i < collectors.size(); i++) {
            CollectorTrace c = collectors.get(i);
            boolean last = i == collectors.size() - 1;
            sb.append("│   ").append(last ? "└── " : "├── ")
                .append(c.success() ? "✓ " : "✗ ")
                .append(c.name()).append(' ');
            switch (c.status()) {
                case SUCCEEDED -> sb.append(c.itemsCollected()).append(" items, ")
                    .append(seconds(c.durationMs()));
                case FAILED -> sb.append("failed after ").append(c.attempts())
                    .append(c.attempts() == 1 ? " attempt" : " attempts")
                    .append(c.error() != null ? ": " + c.error() : "");
                case TIMED_OUT -> sb.append("timed out").append(c.error() != null ? ": " + c.error() : "");
                case SKIPPED_UNAVAILABLE -> sb.append("skipped (").append(c.error()).append(')');
                case SKIPPED_EXCLUDED -> sb.append("excluded");
            }
            if (!c.apiCalls().isEmpty()) {
                long cached = c.apiCalls().stream().filter(ApiCall::cached).count();
                sb.append(" [").append(c.apiCalls().size()).append(" calls");
                if (cached > 0) {
                    sb.append(", ").append(cached).append(" cached");
                }
                sb.append(']');
            }
            sb.append('\n');
        }

        ProcessingSummary p = trace.processing();
        if (p != null) {
            sb.append("├── Processing: ").append(p.itemsBeforeFilter()).append(" → ")
                .append(p.itemsAfterFilter()).append(" filtered → ")
                .append(p.itemsAfterDedup()).append(" unique → ")
                .append(p.itemsReturned()).append(" returned");
            if (p.minScore() != null && p.maxScore() != null) {
                sb.append(String.format(Locale.ROOT, " (scores %.3f..%.3f)", p.minScore(), p.maxScore()));
            }
            sb.append('\n');
        }

        DeliveryTrace d = trace.delivery();
        if (d != null) {
            sb.append("└── Delivery: ").append(d.channel()).append(' ')
                .append(d.success() ? "ok" : "failed: " + d.error()).append('\n');
        } else {
            sb.append("└── Delivery: none\n");
        }
        return sb.toString();
    }

    private static String seconds(long ms) {
        return String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
    }
}
