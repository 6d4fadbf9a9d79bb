package com.pulsewire.core.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Inclusive date range, evaluated as the half-open instant range
 * {@code [fromDate 00:00, toDate+1 00:00)} in the given zone.
 */
public record DateWindow(LocalDate fromDate, LocalDate toDate, ZoneId zone) {

    public DateWindow {
        Objects.requireNonNull(fromDate, "fromDate");
        Objects.requireNonNull(toDate, "toDate");
        zone = zone != null ? zone : ZoneId.of("UTC");
        if (fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
    }

    /** The last {@code days} days up to and including today. */
    public static DateWindow lastDays(int days, Clock clock, ZoneId zone) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return new DateWindow(today.minusDays(days), today, zone);
    }

    public Instant start() {
        return fromDate.atStartOfDay(zone).toInstant();
    }

    /** First instant after the window, the reference point for recency. */
    public Instant end() {
        return toDate.plusDays(1).atStartOfDay(zone).toInstant();
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start()) && instant.isBefore(end());
    }
}
