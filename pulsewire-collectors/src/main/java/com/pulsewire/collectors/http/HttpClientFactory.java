package com.pulsewire.collectors.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client and mapper for source APIs.
 *
 * - getClient(): pooled client for JSON APIs and feeds
 * - getSlowClient(): longer read timeout for search APIs that run tools server-side
 * - getMapper(): lenient mapper for upstream payloads, which use their own naming
 */
public final class HttpClientFactory {

    public static final String USER_AGENT = "pulsewire/1.0 (industry intelligence collector)";

    private static final OkHttpClient SHARED_CLIENT;
    private static final OkHttpClient SLOW_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;

    static {
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
            .connectTimeout(15, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        // xAI search runs X queries before answering
        SLOW_CLIENT = SHARED_CLIENT.newBuilder()
            .readTimeout(120, TimeUnit.SECONDS)
            .build();

        SHARED_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private HttpClientFactory() {
        // Prevent instantiation
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    public static OkHttpClient getSlowClient() {
        return SLOW_CLIENT;
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
