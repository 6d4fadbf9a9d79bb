package com.pulsewire.collectors.news;

import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.FocusEntity;
import com.pulsewire.core.model.DealDetails;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemIds;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.Source;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * M&A and private equity activity around the profile's entities, found through NewsData.io.
 * Settings: {@code industry_terms} (default advertising and marketing agency).
 */
public class DealNewsCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(DealNewsCollector.class);

    static final double RELEVANCE_HINT = 0.7;
    private static final int SNIPPET_LENGTH = 500;
    private static final List<String> DEFAULT_INDUSTRY_TERMS = List.of("advertising agency", "marketing agency");

    private final NewsDataClient newsData;

    public DealNewsCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "M&A Activity", NewsDataClient.DEFAULT_BASE_URL, Duration.ZERO);
        this.newsData = new NewsDataClient(http, baseUrl());
    }

    @Override
    public String type() {
        return "deals";
    }

    @Override
    public List<String> requiredCredentials() {
        return List.of(NewsSearchCollector.NEWSDATA_KEY);
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) throws SourceException {
        List<NewsArticle> articles = newsData.search(query(request), request.credential(), request.maxItems(), request);

        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        for (NewsArticle article : articles) {
            if (!article.isUsable()) continue;
            Optional<DealDetails> deal = DealParser.parse(article.title(), article.description());
            if (deal.isEmpty()) continue;

            items.add(Item.builder()
                .id(ItemIds.forUrl(article.url()))
                .kind(ItemKind.DEAL)
                .collectorId(id())
                .title(article.title())
                .url(article.url())
                .sourceName(article.sourceName())
                .publishedAt(article.publishedAt())
                .snippet(truncate(article.description(), SNIPPET_LENGTH))
                .relevanceHint(RELEVANCE_HINT)
                .details(deal.get())
                .build());
            sources.add(Source.of(article.sourceName(), article.url()));
        }

        log.info("{} found {} deals in {} articles", name(), items.size(), articles.size());
        return CollectorResult.of(items, sources);
    }

    String query(CollectRequest request) {
        List<String> subjects = new ArrayList<>();
        for (FocusEntity entity : request.profile().entities()) {
            if (subjects.size() >= NewsSearchCollector.MAX_TERMS) break;
            subjects.add(entity.name());
        }
        List<String> industry = registration.listSetting("industry_terms");
        subjects.addAll(industry.isEmpty() ? DEFAULT_INDUSTRY_TERMS : industry);
        return "(" + NewsSearchCollector.orQuery(DealParser.DEAL_KEYWORDS) + ") AND ("
            + NewsSearchCollector.orQuery(subjects) + ")";
    }
}
