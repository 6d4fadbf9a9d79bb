package com.pulsewire.collectors.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewire.core.cache.CacheKey;
import com.pulsewire.core.collector.CancellationToken;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.RateLimitedException;
import com.pulsewire.core.collector.SourceException;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * HTTP access for one source: response cache, rate limiting, retries and call tracing.
 *
 * Rate limiting: minimum interval between calls of this instance
 * Retry: linear backoff on transport errors, 5xx and 429; other 4xx fail at once
 * Tracing: every attempt and cache hit goes to the request's call log, with API keys redacted
 */
public class SourceHttp {

    private static final Logger log = LoggerFactory.getLogger(SourceHttp.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Set<String> SECRET_PARAMS = Set.of("apikey", "api_key", "apiKey", "token", "key");
    private static final String REDACTED = "***";

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(10);

    private final OkHttpClient client;
    private final String namespace;
    private final long minIntervalMs;
    private final int maxRetries;
    private final long retryDelayMs;
    private Predicate<String> cacheable = body -> true;

    // Rate limiting state
    private volatile long lastRequestTime = 0;
    private final Object rateLimitLock = new Object();

    public SourceHttp(OkHttpClient client, String namespace) {
        this(client, namespace, Duration.ZERO, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    /**
     * @param namespace   cache namespace, one per source
     * @param minInterval minimum time between two calls
     * @param maxRetries  extra attempts after a retryable failure
     * @param retryDelay  delay before the first retry, growing linearly
     */
    public SourceHttp(OkHttpClient client, String namespace, Duration minInterval, int maxRetries, Duration retryDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.client = client;
        this.namespace = namespace;
        this.minIntervalMs = minInterval.toMillis();
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelay.toMillis();
    }

    /** Only cache successful bodies that pass the filter, e.g. to skip in-band rate limit notices. */
    public SourceHttp cacheWhen(Predicate<String> cacheable) {
        this.cacheable = cacheable;
        return this;
    }

    // ==================== Requests ====================

    public String get(HttpUrl url, CollectRequest ctx) throws SourceException {
        return get(url, Map.of(), ctx);
    }

    public String get(HttpUrl url, Map<String, String> headers, CollectRequest ctx) throws SourceException {
        Request.Builder builder = new Request.Builder().url(url).get();
        headers.forEach(builder::header);
        return execute(builder, "", ctx);
    }

    public JsonNode getJson(HttpUrl url, CollectRequest ctx) throws SourceException {
        return parse(url, get(url, Map.of("Accept", "application/json"), ctx));
    }

    public String postJson(HttpUrl url, String json, Map<String, String> headers, CollectRequest ctx)
            throws SourceException {
        Request.Builder builder = new Request.Builder().url(url).post(RequestBody.create(json, JSON));
        headers.forEach(builder::header);
        return execute(builder, json, ctx);
    }

    /** Parse a body as JSON. Malformed bodies are a source failure. */
    public JsonNode parse(HttpUrl url, String body) throws SourceException {
        try {
            return HttpClientFactory.getMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceException("Invalid JSON from " + redact(url).host() + ": " + e.getOriginalMessage(), e);
        }
    }

    // ==================== Execution ====================

    private String execute(Request.Builder builder, String payload, CollectRequest ctx) throws SourceException {
        Request request = builder.header("User-Agent", HttpClientFactory.USER_AGENT).build();
        String method = request.method();
        String endpoint = redact(request.url()).toString();
        CacheKey key = CacheKey.of(namespace, method, endpoint, payload, ctx.fromDate(), ctx.toDate());

        if (!ctx.noCache()) {
            var cached = ctx.cache().get(key);
            if (cached.isPresent()) {
                log.debug("Cache hit for {} {}", method, endpoint);
                ctx.calls().recordCacheHit(endpoint, method);
                return cached.get();
            }
        }

        SourceException lastException = null;
        long delayMs = 0;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                log.debug("Retry attempt {} for {} after {}ms", attempt, endpoint, delayMs);
                sleep(delayMs, ctx.cancellation());
            }
            throwIfCancelled(ctx.cancellation());
            waitForRateLimit(ctx.cancellation());

            long start = System.nanoTime();
            Call call = client.newCall(request);
            try (CancellationToken.Registration ignored = ctx.cancellation().onCancel(call::cancel);
                 Response response = call.execute()) {
                ResponseBody responseBody = response.body();
                String body = responseBody != null ? responseBody.string() : "";
                long latencyMs = elapsedMs(start);

                if (response.isSuccessful()) {
                    ctx.calls().record(endpoint, method, response.code(), latencyMs, false, null);
                    if (cacheable.test(body)) {
                        ctx.cache().put(key, body);
                    }
                    return body;
                }

                String error = "HTTP " + response.code() + (response.message().isEmpty() ? "" : " " + response.message());
                ctx.calls().record(endpoint, method, response.code(), latencyMs, false, error);
                delayMs = retryDelayMs * (attempt + 1);

                if (response.code() == 429) {
                    long retryAfterMs = parseRetryAfter(response.header("Retry-After"));
                    lastException = new RateLimitedException(error, retryAfterMs);
                    if (retryAfterMs > MAX_RETRY_AFTER.toMillis()) {
                        log.warn("{} rate limited for {}s, not waiting", namespace, retryAfterMs / 1000);
                        throw lastException;
                    }
                    log.warn("{} rate limited, waiting before retry", namespace);
                    delayMs = Math.max(delayMs, retryAfterMs);
                    continue;
                }

                lastException = new SourceException(error, response.code());
                // Don't retry on 4xx errors (except 429)
                if (!lastException.isRetryable()) {
                    throw lastException;
                }
            } catch (IOException e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                ctx.calls().record(endpoint, method, 0, elapsedMs(start), false, error);
                throwIfCancelled(ctx.cancellation());
                lastException = new SourceException("Connection error: " + error, e);
                delayMs = retryDelayMs * (attempt + 1);
            }
        }

        throw lastException != null ? lastException : new SourceException("Request failed after retries: " + endpoint);
    }

    private void waitForRateLimit(CancellationToken token) throws SourceException {
        if (minIntervalMs <= 0) {
            return;
        }
        synchronized (rateLimitLock) {
            long timeSinceLastRequest = System.currentTimeMillis() - lastRequestTime;
            if (timeSinceLastRequest < minIntervalMs) {
                long waitTime = minIntervalMs - timeSinceLastRequest;
                log.debug("Rate limiting {}: waiting {}ms", namespace, waitTime);
                sleep(waitTime, token);
            }
            lastRequestTime = System.currentTimeMillis();
        }
    }

    private static void sleep(long ms, CancellationToken token) throws SourceException {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted while waiting", e);
        }
        throwIfCancelled(token);
    }

    private static void throwIfCancelled(CancellationToken token) throws SourceException {
        if (token.isCancelled()) {
            throw new SourceException("Cancelled: " + (token.reason() != null ? token.reason() : "run stopped"));
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /** Retry-After in milliseconds; only the delta-seconds form is understood. */
    static long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(header.trim())) * 1000;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", header);
            return 0;
        }
    }

    /** The URL with credential query parameters masked, as recorded in traces and cache keys. */
    public static HttpUrl redact(HttpUrl url) {
        HttpUrl.Builder builder = url.newBuilder();
        for (String name : url.queryParameterNames()) {
            if (SECRET_PARAMS.contains(name)) {
                builder.setQueryParameter(name, REDACTED);
            }
        }
        return builder.build();
    }
}
