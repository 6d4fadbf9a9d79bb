package com.pulsewire.collectors;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Lenient parsing of the timestamp formats upstream sources use: ISO-8601, RFC 1123 as in
 * HTTP and RSS headers, and common written dates. Unparsable input yields null,
 * which the pipeline treats as undated.
 */
public final class Timestamps {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH));

    private static final List<Function<String, Instant>> PARSERS = new ArrayList<>();

    static {
        PARSERS.add(v -> OffsetDateTime.parse(v).toInstant());
        PARSERS.add(v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        PARSERS.add(v -> LocalDateTime.parse(v, SPACE_SEPARATED).toInstant(ZoneOffset.UTC));
        PARSERS.add(v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC));
        for (DateTimeFormatter format : DATE_FORMATS) {
            PARSERS.add(v -> LocalDate.parse(v, format).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
    }

    private Timestamps() {
    }

    /** Parse an instant; zone-less values are taken as UTC and bare dates as midnight UTC. */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (Function<String, Instant> parser : PARSERS) {
            Instant instant = attempt(parser, v);
            if (instant != null) {
                return instant;
            }
        }
        return null;
    }

    public static Instant ofEpochSeconds(long seconds) {
        return seconds > 0 ? Instant.ofEpochSecond(seconds) : null;
    }

    private static Instant attempt(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
