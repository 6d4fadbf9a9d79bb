package com.pulsewire.collectors.news;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewire.collectors.Timestamps;
import com.pulsewire.collectors.http.SourceHttp;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.SourceException;
import okhttp3.HttpUrl;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * NewsAPI.org "everything" search, used when only a NewsAPI key is configured.
 */
public class NewsApiClient {

    public static final String DEFAULT_BASE_URL = "https://newsapi.org";
    private static final int MAX_PAGE_SIZE = 100;

    private final SourceHttp http;
    private final HttpUrl baseUrl;

    public NewsApiClient(SourceHttp http, HttpUrl baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    public List<NewsArticle> search(String query, String apiKey, LocalDate from, LocalDate to, int maxResults,
                                    CollectRequest ctx) throws SourceException {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("v2/everything")
            .addQueryParameter("q", query)
            .addQueryParameter("from", from.toString())
            .addQueryParameter("to", to.toString())
            .addQueryParameter("sortBy", "relevancy")
            .addQueryParameter("language", "en")
            .addQueryParameter("pageSize", String.valueOf(Math.min(maxResults, MAX_PAGE_SIZE)))
            .addQueryParameter("apiKey", apiKey)
            .build();
        JsonNode response = http.getJson(url, ctx);

        if (!"ok".equals(response.path("status").asText())) {
            throw new SourceException("NewsAPI error: " + response.path("message").asText("unknown error"), 400);
        }

        List<NewsArticle> articles = new ArrayList<>();
        for (JsonNode article : response.path("articles")) {
            if (articles.size() >= maxResults) break;
            articles.add(new NewsArticle(
                article.path("title").asText(null),
                article.path("url").asText(null),
                article.path("description").asText(null),
                Timestamps.parse(article.path("publishedAt").asText(null)),
                article.path("source").path("name").asText(null),
                article.path("author").asText(null),
                List.of()));
        }
        return articles;
    }
}
