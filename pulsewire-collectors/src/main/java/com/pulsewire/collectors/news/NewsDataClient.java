package com.pulsewire.collectors.news;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewire.collectors.Timestamps;
import com.pulsewire.collectors.http.SourceHttp;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.SourceException;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * NewsData.io latest-news search.
 */
public class NewsDataClient {

    private static final Logger log = LoggerFactory.getLogger(NewsDataClient.class);

    public static final String DEFAULT_BASE_URL = "https://newsdata.io";
    private static final int MAX_PAGES = 3;

    private final SourceHttp http;
    private final HttpUrl baseUrl;

    public NewsDataClient(SourceHttp http, HttpUrl baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    /**
     * Search English articles, following result pages until {@code maxResults} are collected.
     */
    public List<NewsArticle> search(String query, String apiKey, int maxResults, CollectRequest ctx)
            throws SourceException {
        List<NewsArticle> articles = new ArrayList<>();
        String nextPage = null;
        int page = 0;

        do {
            HttpUrl.Builder url = baseUrl.newBuilder()
                .addPathSegments("api/1/news")
                .addQueryParameter("apikey", apiKey)
                .addQueryParameter("q", query)
                .addQueryParameter("language", "en");
            if (nextPage != null) {
                url.addQueryParameter("page", nextPage);
            }
            JsonNode response = http.getJson(url.build(), ctx);

            if ("error".equals(response.path("status").asText())) {
                String message = response.path("results").path("message").asText("unknown error");
                throw new SourceException("NewsData.io error: " + message, 400);
            }

            for (JsonNode result : response.path("results")) {
                if (articles.size() >= maxResults) break;
                articles.add(parse(result));
            }

            nextPage = response.path("nextPage").asText(null);
            page++;
        } while (nextPage != null && articles.size() < maxResults && page < MAX_PAGES && !ctx.isCancelled());

        log.debug("NewsData.io returned {} articles for '{}' in {} pages", articles.size(), query, page);
        return articles;
    }

    static NewsArticle parse(JsonNode result) {
        List<String> categories = new ArrayList<>();
        JsonNode category = result.path("category");
        if (category.isArray()) {
            category.forEach(c -> categories.add(c.asText()));
        } else if (category.isTextual()) {
            categories.add(category.asText());
        }

        String source = result.path("source_name").asText(null);
        if (source == null) {
            source = result.path("source_id").asText(null);
        }
        JsonNode creator = result.path("creator");
        String author = creator.isArray() && creator.size() > 0 ? creator.get(0).asText() : null;

        return new NewsArticle(
            result.path("title").asText(null),
            result.path("link").asText(null),
            result.path("description").asText(null),
            Timestamps.parse(result.path("pubDate").asText(null)),
            source,
            author,
            categories);
    }
}
