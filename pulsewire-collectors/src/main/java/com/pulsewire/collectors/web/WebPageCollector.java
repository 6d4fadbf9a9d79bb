package com.pulsewire.collectors.web;

import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.collectors.Timestamps;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.model.AwardDetails;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemIds;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.NewsDetails;
import com.pulsewire.core.model.Source;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scrapes listing pages that have no feed or API, such as award winner lists.
 * Pages are described by the {@code pages} setting, see {@link PageDefinition}.
 *
 * <p>Scraping is opt-in: the collector is only available when {@code PULSEWIRE_ENABLE_SCRAPING}
 * is set. The key is one of {@link com.pulsewire.collectors.CollectorCatalog#switchKeys()}, so
 * a value such as false leaves the collector unavailable.
 */
public class WebPageCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(WebPageCollector.class);

    public static final String ENABLE_KEY = "PULSEWIRE_ENABLE_SCRAPING";
    static final double RELEVANCE_HINT = 0.6;
    private static final int SNIPPET_LENGTH = 300;

    private final List<PageDefinition> pages;

    public WebPageCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "Web Pages", null, Duration.ofMillis(500));
        this.pages = List.of(registration.settingAs("pages", PageDefinition[].class, new PageDefinition[0]));
        pages.forEach(WebPageCollector::checkPage);
    }

    private static void checkPage(PageDefinition page) {
        parseUrl(page.url());
        checkSelectors(page);
    }

    private static void checkSelectors(PageDefinition page) {
        for (String selector : page.selectors()) {
            try {
                QueryParser.parse(selector);
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                throw new IllegalArgumentException("Bad selector '" + selector + "' for " + page.name() + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public String type() {
        return "web";
    }

    @Override
    public List<String> requiredCredentials() {
        return List.of(ENABLE_KEY);
    }

    List<PageDefinition> pages() {
        return pages;
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) {
        if (pages.isEmpty()) {
            return CollectorResult.failed("No pages configured");
        }

        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (PageDefinition page : pages) {
            if (request.isCancelled() || items.size() >= request.maxItems()) break;
            try {
                List<Item> found = scrape(page, request);
                int room = request.maxItems() - items.size();
                items.addAll(found.subList(0, Math.min(room, found.size())));
                if (!found.isEmpty()) {
                    sources.add(Source.of(page.name(), page.url()));
                }
            } catch (SourceException e) {
                log.warn("Page {} failed: {}", page.name(), e.getMessage());
                errors.add(page.name() + ": " + e.getMessage());
            }
        }

        if (items.isEmpty() && !errors.isEmpty()) {
            return CollectorResult.failed(String.join("; ", errors));
        }
        return CollectorResult.of(items, sources);
    }

    /** Items from a page and the pages its next link leads to, limited to the request window. */
    List<Item> scrape(PageDefinition page, CollectRequest request) throws SourceException {
        List<Item> items = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String url = page.url();

        for (int n = 0; n < page.maxPages() && url != null && visited.add(url); n++) {
            if (request.isCancelled()) break;
            Document doc = Jsoup.parse(http.get(parseUrl(url), request), url);

            for (Element element : doc.select(page.item())) {
                Item item = mapElement(element, page, request);
                if (item != null && inWindow(item.publishedAt(), request)) {
                    items.add(item);
                }
            }
            url = nextUrl(doc, page);
        }
        log.debug("{} yielded {} items from {} pages", page.name(), items.size(), visited.size());
        return items;
    }

    private static String nextUrl(Document doc, PageDefinition page) {
        if (page.next() == null || page.next().isBlank()) {
            return null;
        }
        Element next = doc.selectFirst(page.next());
        if (next == null) {
            return null;
        }
        String href = next.absUrl("href");
        return href.isEmpty() || HttpUrl.parse(href) == null ? null : href;
    }

    private Item mapElement(Element element, PageDefinition page, CollectRequest request) {
        try {
            return toItem(element, page, request);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping malformed entry on {}: {}", page.name(), e.getMessage());
            return null;
        }
    }

    Item toItem(Element element, PageDefinition page, CollectRequest request) {
        String title = text(element, page.title());
        if (title.isEmpty()) {
            return null;
        }
        String link = link(element, page.link()).trim();
        Instant published = date(element, page.date());
        String snippet = truncate(text(element, page.snippet()), SNIPPET_LENGTH);

        Item.Builder builder = Item.builder()
            .id(!link.isEmpty() ? ItemIds.forUrl(link) : ItemIds.forContent(page.name(), title))
            .collectorId(id())
            .title(title)
            .url(link)
            .sourceName(page.name())
            .publishedAt(published)
            .snippet(snippet)
            .relevanceHint(RELEVANCE_HINT);

        if (page.isAward()) {
            int year = page.year() != null ? page.year() : request.toDate().getYear();
            return builder
                .kind(ItemKind.AWARD)
                .details(new AwardDetails(page.name(), text(element, page.category()),
                    text(element, page.winner()), text(element, page.medal()), title, year))
                .build();
        }
        return builder.kind(ItemKind.NEWS).details(NewsDetails.empty()).build();
    }

    // ==================== Extraction ====================

    private static String text(Element element, String selector) {
        if (selector == null || selector.isBlank()) {
            return "";
        }
        Element found = element.selectFirst(selector);
        return found != null ? found.text().trim() : "";
    }

    private static String link(Element element, String selector) {
        Element anchor = element.is("a[href]") ? element : element.selectFirst(selector);
        return anchor != null ? anchor.absUrl("href") : "";
    }

    /** A time element's datetime attribute wins over its text. */
    private static Instant date(Element element, String selector) {
        if (selector == null || selector.isBlank()) {
            return null;
        }
        Element found = element.selectFirst(selector);
        if (found == null) {
            return null;
        }
        String datetime = found.attr("datetime");
        return Timestamps.parse(!datetime.isEmpty() ? datetime : found.text());
    }
}
