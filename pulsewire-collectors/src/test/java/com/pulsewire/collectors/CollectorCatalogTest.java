package com.pulsewire.collectors;

import com.pulsewire.collectors.news.NewsSearchCollector;
import com.pulsewire.collectors.rss.RssCollector;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.ConfigException;
import com.pulsewire.core.config.PulseConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CollectorCatalogTest {

    private static PulseConfig config(CollectorRegistration... registrations) {
        return new PulseConfig("test", null, List.of(registrations), null, null, null, null);
    }

    @Test
    @DisplayName("Should know every built-in factory")
    void builtIns() {
        assertEquals(Set.of("rss", "news_search", "deal_news", "alpha_vantage", "yahoo_finance", "x_search", "web_page"),
            CollectorCatalog.defaults().factoryIds());
    }

    @Test
    @DisplayName("Should fall back to the default registrations")
    void defaultsWhenEmpty() throws Exception {
        // When
        List<Collector> collectors = CollectorCatalog.defaults().build(config());

        // Then
        assertEquals(List.of("news_search", "rss", "alpha_vantage", "yahoo_finance", "x_search", "deal_news"),
            collectors.stream().map(Collector::id).toList());
    }

    @Test
    @DisplayName("Should build registrations by factory and skip disabled ones")
    void buildRegistered() throws Exception {
        // Given
        PulseConfig config = config(
            new CollectorRegistration("trade_press", "rss", 5, null, Map.of("name", "Trade Press"), null),
            new CollectorRegistration("news_search", null, null, false, null, null));

        // When
        List<Collector> collectors = CollectorCatalog.defaults().build(config);

        // Then
        assertEquals(1, collectors.size());
        assertInstanceOf(RssCollector.class, collectors.get(0));
        assertEquals("trade_press", collectors.get(0).id());
        assertEquals("Trade Press", collectors.get(0).name());
    }

    @Test
    @DisplayName("Should reject unknown factories")
    void unknownFactory() {
        // Given
        PulseConfig config = config(new CollectorRegistration("odd", "carrier_pigeon", null, null, null, null));

        // When
        ConfigException e = assertThrows(ConfigException.class, () -> CollectorCatalog.defaults().build(config));

        // Then
        assertTrue(e.getMessage().contains("carrier_pigeon"));
    }

    @Test
    @DisplayName("Should turn invalid settings into a config error")
    void invalidSettings() {
        // Given
        PulseConfig config = config(CollectorRegistration.of("news_search", Map.of("newsdata_url", "ftp://nowhere")));

        // When / Then
        assertThrows(ConfigException.class, () -> CollectorCatalog.defaults().build(config));
    }

    @Test
    @DisplayName("Should accept custom factories")
    void customFactory() throws Exception {
        // Given
        CollectorCatalog catalog = new CollectorCatalog().register("static", r -> new Collector() {
            @Override
            public String id() {
                return r.id();
            }

            @Override
            public String name() {
                return "Static";
            }

            @Override
            public String type() {
                return "news";
            }

            @Override
            public CollectorResult collect(CollectRequest request) {
                return CollectorResult.empty();
            }
        });

        // When
        List<Collector> collectors = catalog.build(config(new CollectorRegistration("mine", "static", null, null, null, null)));

        // Then
        assertEquals("mine", collectors.get(0).id());
    }

    @Test
    @DisplayName("Should list credential keys of the built collectors in order")
    void credentialKeys() throws Exception {
        // When
        Set<String> keys = CollectorCatalog.credentialKeys(CollectorCatalog.defaults().build(config()));

        // Then
        assertEquals(List.of(NewsSearchCollector.NEWSDATA_KEY, NewsSearchCollector.NEWSAPI_KEY,
            "ALPHA_VANTAGE_API_KEY", "XAI_API_KEY"), List.copyOf(keys));
    }
}
