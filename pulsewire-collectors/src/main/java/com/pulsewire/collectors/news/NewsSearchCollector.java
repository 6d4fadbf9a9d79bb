package com.pulsewire.collectors.news;

import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemIds;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.NewsDetails;
import com.pulsewire.core.model.Source;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword news search. Uses NewsData.io when its key is configured, NewsAPI.org otherwise.
 */
public class NewsSearchCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(NewsSearchCollector.class);

    public static final String NEWSDATA_KEY = "NEWSDATA_API_KEY";
    public static final String NEWSAPI_KEY = "NEWSAPI_API_KEY";

    static final int MAX_TERMS = 5;
    private static final int SNIPPET_LENGTH = 300;

    private final NewsDataClient newsData;
    private final NewsApiClient newsApi;

    public NewsSearchCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "News Search", null, Duration.ZERO);
        this.newsData = new NewsDataClient(http, parseUrl(registration.setting("newsdata_url", NewsDataClient.DEFAULT_BASE_URL)));
        this.newsApi = new NewsApiClient(http, parseUrl(registration.setting("newsapi_url", NewsApiClient.DEFAULT_BASE_URL)));
    }

    @Override
    public String type() {
        return "news";
    }

    @Override
    public List<String> requiredCredentials() {
        return List.of(NEWSDATA_KEY, NEWSAPI_KEY);
    }

    @Override
    public boolean requiresAny() {
        return true;
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) throws SourceException {
        if (request.credential() == null) {
            return CollectorResult.failed("No news API key configured");
        }
        List<String> terms = searchTerms(registration, request);
        if (terms.isEmpty()) {
            return CollectorResult.failed("No keywords to search in profile");
        }

        String query = orQuery(terms);
        List<NewsArticle> articles = NEWSAPI_KEY.equals(request.credentialKey())
            ? newsApi.search(query, request.credential(), request.fromDate(), request.toDate(), request.maxItems(), request)
            : newsData.search(query, request.credential(), request.maxItems(), request);

        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        for (NewsArticle article : articles) {
            if (!article.isUsable()) continue;
            items.add(toItem(article, terms));
            sources.add(Source.of(article.sourceName(), article.url()));
        }

        log.info("{} found {} articles for {} terms", name(), items.size(), terms.size());
        return CollectorResult.of(items, sources);
    }

    private Item toItem(NewsArticle article, List<String> terms) {
        return Item.builder()
            .id(ItemIds.forUrl(article.url()))
            .kind(ItemKind.NEWS)
            .collectorId(id())
            .title(article.title())
            .url(article.url())
            .sourceName(article.sourceName())
            .publishedAt(article.publishedAt())
            .snippet(truncate(article.description(), SNIPPET_LENGTH))
            .relevanceHint(keywordRelevance(article, terms))
            .details(new NewsDetails(article.author(), article.categories(), List.of()))
            .build();
    }

    /** 0.5 plus 0.1 per matched search term, at most 1. */
    static double keywordRelevance(NewsArticle article, List<String> terms) {
        String text = article.matchText();
        long matches = terms.stream().filter(t -> text.contains(t.toLowerCase(Locale.ROOT))).count();
        return Math.min(0.5 + matches * 0.1, 1.0);
    }

    /** The {@code keywords} setting when given, else entity names and boost keywords. */
    static List<String> searchTerms(CollectorRegistration registration, CollectRequest request) {
        List<String> configured = registration.listSetting("keywords");
        if (!configured.isEmpty()) {
            return configured.subList(0, Math.min(MAX_TERMS, configured.size()));
        }
        return request.profile().searchTerms(MAX_TERMS);
    }

    static String orQuery(List<String> terms) {
        List<String> quoted = new ArrayList<>();
        for (String term : terms) {
            quoted.add(term.contains(" ") ? "\"" + term + "\"" : term);
        }
        return String.join(" OR ", quoted);
    }
}
