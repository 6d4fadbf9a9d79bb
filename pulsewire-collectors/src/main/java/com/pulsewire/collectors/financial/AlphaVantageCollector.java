package com.pulsewire.collectors.financial;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.RateLimitedException;
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
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Daily quotes for the profile's listed entities from Alpha Vantage's GLOBAL_QUOTE endpoint.
 *
 * <p>The free tier allows a handful of calls per minute and answers over-quota requests with
 * HTTP 200 and a {@code Note} or {@code Information} field, so those bodies are never cached
 * and end the run's remaining lookups.
 */
public class AlphaVantageCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageCollector.class);

    public static final String API_KEY = "ALPHA_VANTAGE_API_KEY";
    public static final String DEFAULT_BASE_URL = "https://www.alphavantage.co";
    static final double RELEVANCE_HINT = 0.8;

    public AlphaVantageCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "Alpha Vantage", DEFAULT_BASE_URL, Duration.ofSeconds(1));
        http.cacheWhen(body -> !isQuotaNotice(body));
    }

    @Override
    public String type() {
        return "financial";
    }

    @Override
    public List<String> requiredCredentials() {
        return List.of(API_KEY);
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) {
        List<FocusEntity> listed = request.profile().listedEntities();
        if (listed.isEmpty()) {
            return CollectorResult.failed("No listed entities in profile");
        }

        List<Item> items = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (FocusEntity entity : listed.subList(0, Math.min(listed.size(), request.maxItems()))) {
            if (request.isCancelled()) break;
            try {
                Item quote = quote(entity, request);
                if (quote != null) {
                    items.add(quote);
                }
            } catch (RateLimitedException e) {
                log.warn("Alpha Vantage quota reached after {} quotes", items.size());
                errors.add(e.getMessage());
                break;
            } catch (SourceException e) {
                log.warn("Quote for {} failed: {}", entity.symbol(), e.getMessage());
                errors.add(entity.symbol() + ": " + e.getMessage());
            }
        }

        List<Source> sources = items.isEmpty()
            ? List.of()
            : List.of(Source.of(name(), "https://www.alphavantage.co"));
        if (items.isEmpty() && !errors.isEmpty()) {
            return CollectorResult.failed(String.join("; ", errors));
        }
        return CollectorResult.of(items, sources);
    }

    private Item quote(FocusEntity entity, CollectRequest request) throws SourceException {
        HttpUrl url = baseUrl().newBuilder()
            .addPathSegment("query")
            .addQueryParameter("function", "GLOBAL_QUOTE")
            .addQueryParameter("symbol", entity.symbol())
            .addQueryParameter("apikey", request.credential())
            .build();
        JsonNode response = http.getJson(url, request);

        if (response.has("Note") || response.has("Information")) {
            String notice = response.has("Note") ? response.path("Note").asText() : response.path("Information").asText();
            throw new RateLimitedException("Alpha Vantage rate limit: " + notice, 60_000);
        }
        if (response.has("Error Message")) {
            throw new SourceException(response.path("Error Message").asText(), 400);
        }

        JsonNode quote = response.path("Global Quote");
        String price = quote.path("05. price").asText("");
        if (price.isEmpty()) {
            log.debug("No quote for {}", entity.symbol());
            return null;
        }
        return toItem(entity, quote, url);
    }

    Item toItem(FocusEntity entity, JsonNode quote, HttpUrl url) throws SourceException {
        double price;
        Double changePct;
        try {
            price = Double.parseDouble(quote.path("05. price").asText());
            String pct = quote.path("10. change percent").asText("").replace("%", "").trim();
            changePct = pct.isEmpty() ? null : Double.parseDouble(pct);
        } catch (NumberFormatException e) {
            throw new SourceException("Malformed quote for " + entity.symbol() + ": " + e.getMessage(), e);
        }

        String day = quote.path("07. latest trading day").asText("");
        return Item.builder()
            .id(ItemIds.forContent("alphavantage", entity.symbol(), day))
            .kind(ItemKind.FINANCIAL)
            .collectorId(id())
            .title(quoteTitle(entity.symbol(), price, changePct))
            .url(url.newBuilder().removeAllQueryParameters("apikey").build().toString())
            .sourceName(name())
            .publishedAt(tradingDay(day))
            .snippet(entity.name() + " last traded at " + String.format(Locale.ROOT, "%.2f", price))
            .relevanceHint(RELEVANCE_HINT)
            .details(new FinancialDetails(entity.symbol(), entity.name(), "stock_price", price, changePct))
            .build();
    }

    static String quoteTitle(String symbol, double price, Double changePct) {
        if (changePct == null) {
            return String.format(Locale.ROOT, "%s %.2f", symbol, price);
        }
        return String.format(Locale.ROOT, "%s %.2f (%+.2f%%)", symbol, price, changePct);
    }

    static boolean isQuotaNotice(String body) {
        return body.contains("\"Note\"") || body.contains("\"Information\"");
    }

    private static Instant tradingDay(String day) {
        if (day.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(day).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparsable trading day '{}'", day);
            return null;
        }
    }
}
