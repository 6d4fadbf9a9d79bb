package com.pulsewire.collectors;

import com.pulsewire.collectors.financial.AlphaVantageCollector;
import com.pulsewire.collectors.financial.YahooFinanceCollector;
import com.pulsewire.collectors.http.HttpClientFactory;
import com.pulsewire.collectors.news.DealNewsCollector;
import com.pulsewire.collectors.news.NewsSearchCollector;
import com.pulsewire.collectors.rss.RssCollector;
import com.pulsewire.collectors.social.XSearchCollector;
import com.pulsewire.collectors.web.WebPageCollector;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.ConfigException;
import com.pulsewire.core.config.PulseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps factory ids to collector factories and builds the registered collectors of a config.
 */
public class CollectorCatalog {

    private static final Logger log = LoggerFactory.getLogger(CollectorCatalog.class);

    public static final String RSS = "rss";
    public static final String NEWS_SEARCH = "news_search";
    public static final String DEAL_NEWS = "deal_news";
    public static final String ALPHA_VANTAGE = "alpha_vantage";
    public static final String YAHOO_FINANCE = "yahoo_finance";
    public static final String X_SEARCH = "x_search";
    public static final String WEB_PAGE = "web_page";

    private final Map<String, CollectorFactory> factories = new LinkedHashMap<>();

    /** Catalog with every built-in collector on the shared HTTP clients. */
    public static CollectorCatalog defaults() {
        return new CollectorCatalog()
            .register(RSS, r -> new RssCollector(r, HttpClientFactory.getClient()))
            .register(NEWS_SEARCH, r -> new NewsSearchCollector(r, HttpClientFactory.getClient()))
            .register(DEAL_NEWS, r -> new DealNewsCollector(r, HttpClientFactory.getClient()))
            .register(ALPHA_VANTAGE, r -> new AlphaVantageCollector(r, HttpClientFactory.getClient()))
            .register(YAHOO_FINANCE, r -> new YahooFinanceCollector(r, HttpClientFactory.getClient()))
            .register(X_SEARCH, r -> new XSearchCollector(r, HttpClientFactory.getSlowClient()))
            .register(WEB_PAGE, r -> new WebPageCollector(r, HttpClientFactory.getClient()));
    }

    /** Registrations used when a config lists no collectors. The page scraper needs pages and is left out. */
    public static List<CollectorRegistration> defaultRegistrations() {
        return List.of(
            new CollectorRegistration(NEWS_SEARCH, null, 10, null, null, null),
            new CollectorRegistration(RSS, null, 20, null, null, null),
            new CollectorRegistration(ALPHA_VANTAGE, null, 30, null, null, null),
            new CollectorRegistration(YAHOO_FINANCE, null, 40, null, null, null),
            new CollectorRegistration(X_SEARCH, null, 50, null, null, null),
            new CollectorRegistration(DEAL_NEWS, null, 60, null, null, null));
    }

    public CollectorCatalog register(String factoryId, CollectorFactory factory) {
        factories.put(factoryId, factory);
        return this;
    }

    public Set<String> factoryIds() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public Optional<CollectorFactory> factory(String factoryId) {
        return Optional.ofNullable(factories.get(factoryId));
    }

    /**
     * Build the enabled collectors of a config in registration order.
     * Falls back to {@link #defaultRegistrations()} when the config registers none.
     *
     * @throws ConfigException for an unknown factory or invalid collector settings
     */
    public List<Collector> build(PulseConfig config) throws ConfigException {
        List<CollectorRegistration> registrations = config.collectors().isEmpty()
            ? defaultRegistrations()
            : config.collectors();

        List<Collector> collectors = new ArrayList<>();
        for (CollectorRegistration registration : registrations) {
            if (!registration.enabled()) {
                log.info("Collector {} is disabled", registration.id());
                continue;
            }
            CollectorFactory factory = factories.get(registration.factory());
            if (factory == null) {
                throw new ConfigException("Unknown collector factory '" + registration.factory()
                    + "' for " + registration.id() + " (known: " + String.join(", ", factories.keySet()) + ")");
            }
            try {
                collectors.add(factory.create(registration));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid settings for collector " + registration.id() + ": " + e.getMessage(), e);
            }
        }
        log.info("Built {} collectors", collectors.size());
        return collectors;
    }

    /** Credential keys that act as on/off switches rather than secrets. */
    public static Set<String> switchKeys() {
        return Set.of(WebPageCollector.ENABLE_KEY);
    }

    /** Every credential key the collectors may use, for loading from the environment. */
    public static Set<String> credentialKeys(List<? extends Collector> collectors) {
        Set<String> keys = new LinkedHashSet<>();
        collectors.forEach(c -> keys.addAll(c.requiredCredentials()));
        return keys;
    }
}
