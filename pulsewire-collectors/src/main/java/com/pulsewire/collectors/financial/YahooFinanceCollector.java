package com.pulsewire.collectors.financial;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.FocusEntity;
import com.pulsewire.core.model.FinancialDetails;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemIds;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.Source;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Daily quotes from the public Yahoo Finance chart endpoint. Needs no key.
 */
public class YahooFinanceCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(YahooFinanceCollector.class);

    public static final String DEFAULT_BASE_URL = "https://query1.finance.yahoo.com";
    static final double RELEVANCE_HINT = 0.8;

    public YahooFinanceCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "Yahoo Finance", DEFAULT_BASE_URL, Duration.ofMillis(250));
    }

    @Override
    public String type() {
        return "financial";
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) {
        List<FocusEntity> listed = request.profile().listedEntities();
        if (listed.isEmpty()) {
            return CollectorResult.failed("No listed entities in profile");
        }

        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (FocusEntity entity : listed.subList(0, Math.min(listed.size(), request.maxItems()))) {
            if (request.isCancelled()) break;
            try {
                Item item = quote(entity, request);
                if (item != null) {
                    items.add(item);
                    sources.add(Source.of(name(), item.url()));
                }
            } catch (SourceException e) {
                log.warn("Chart for {} failed: {}", entity.symbol(), e.getMessage());
                errors.add(entity.symbol() + ": " + e.getMessage());
            }
        }

        if (items.isEmpty() && !errors.isEmpty()) {
            return CollectorResult.failed(String.join("; ", errors));
        }
        return CollectorResult.of(items, sources);
    }

    private Item quote(FocusEntity entity, CollectRequest request) throws SourceException {
        HttpUrl url = baseUrl().newBuilder()
            .addPathSegments("v8/finance/chart")
            .addPathSegment(entity.symbol())
            .addQueryParameter("interval", "1d")
            .addQueryParameter("range", "1d")
            .build();
        JsonNode chart = http.getJson(url, request).path("chart");

        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new SourceException(error.path("description").asText("chart error"), 404);
        }
        JsonNode results = chart.path("result");
        if (!results.isArray() || results.isEmpty()) {
            log.debug("No chart data for {}", entity.symbol());
            return null;
        }
        return toItem(entity, results.get(0).path("meta"));
    }

    Item toItem(FocusEntity entity, JsonNode meta) {
        JsonNode priceNode = meta.path("regularMarketPrice");
        if (!priceNode.isNumber()) {
            return null;
        }
        double price = priceNode.asDouble();
        JsonNode previous = meta.has("previousClose") ? meta.path("previousClose") : meta.path("chartPreviousClose");
        Double changePct = previous.isNumber() && previous.asDouble() != 0
            ? (price - previous.asDouble()) / previous.asDouble() * 100
            : null;
        Instant marketTime = meta.path("regularMarketTime").isNumber()
            ? Instant.ofEpochSecond(meta.path("regularMarketTime").asLong())
            : null;
        String day = marketTime != null ? marketTime.atZone(ZoneOffset.UTC).toLocalDate().toString() : "";

        return Item.builder()
            .id(ItemIds.forContent("yahoo", entity.symbol(), day))
            .kind(ItemKind.FINANCIAL)
            .collectorId(id())
            .title(AlphaVantageCollector.quoteTitle(entity.symbol(), price, changePct))
            .url("https://finance.yahoo.com/quote/" + entity.symbol())
            .sourceName(name())
            .publishedAt(marketTime)
            .snippet(entity.name() + " last traded at " + String.format(Locale.ROOT, "%.2f", price))
            .relevanceHint(RELEVANCE_HINT)
            .details(new FinancialDetails(entity.symbol(), entity.name(), "stock_price", price, changePct))
            .build();
    }
}
