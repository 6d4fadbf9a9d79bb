package com.pulsewire.collectors;

import com.pulsewire.collectors.http.SourceHttp;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Base for collectors backed by one HTTP source. Settings understood by every subclass:
 * {@code name}, {@code base_url}, {@code http_retries}, {@code retry_delay_ms} and {@code min_interval_ms}.
 */
public abstract class HttpCollector implements Collector {

    private static final Logger log = LoggerFactory.getLogger(HttpCollector.class);

    protected final CollectorRegistration registration;
    protected final SourceHttp http;
    private final String name;
    private final HttpUrl baseUrl;

    protected HttpCollector(CollectorRegistration registration, OkHttpClient client, String defaultName,
                            String defaultBaseUrl, Duration defaultMinInterval) {
        this.registration = registration;
        this.name = registration.setting("name", defaultName);
        String base = registration.setting("base_url", defaultBaseUrl);
        this.baseUrl = base != null ? parseUrl(base) : null;
        this.http = new SourceHttp(client,
            registration.id().replaceAll("[^A-Za-z0-9_.-]", "_"),
            Duration.ofMillis(registration.longSetting("min_interval_ms", defaultMinInterval.toMillis())),
            registration.intSetting("http_retries", SourceHttp.DEFAULT_MAX_RETRIES),
            Duration.ofMillis(registration.longSetting("retry_delay_ms", SourceHttp.DEFAULT_RETRY_DELAY.toMillis())));
    }

    @Override
    public String id() {
        return registration.id();
    }

    @Override
    public String name() {
        return name;
    }

    /** Configured or default API root; null for collectors that take full URLs from the profile. */
    protected HttpUrl baseUrl() {
        return baseUrl;
    }

    /**
     * Runs {@link #fetch}; a {@link SourceException} that escapes it fails the whole attempt.
     */
    @Override
    public final CollectorResult collect(CollectRequest request) {
        try {
            return fetch(request);
        } catch (SourceException e) {
            log.warn("{} failed: {}", name, e.getMessage());
            return CollectorResult.failed(name + ": " + e.getMessage());
        }
    }

    protected abstract CollectorResult fetch(CollectRequest request) throws SourceException;

    // ==================== Helpers ====================

    protected static boolean inWindow(Instant instant, CollectRequest request) {
        if (instant == null) {
            return true;
        }
        LocalDate day = instant.atZone(ZoneOffset.UTC).toLocalDate();
        return !day.isBefore(request.fromDate()) && !day.isAfter(request.toDate());
    }

    protected static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max).trim();
    }

    protected static HttpUrl parseUrl(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Not an http(s) URL: " + url);
        }
        return parsed;
    }
}
