package com.pulsewire.collectors.rss;

import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.FeedSource;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemIds;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.NewsDetails;
import com.pulsewire.core.model.Source;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Collects articles from the profile's publication feeds (RSS, Atom and RDF).
 * Extra feed URLs can be listed in the {@code feeds} setting.
 */
public class RssCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(RssCollector.class);

    static final double RELEVANCE_HINT = 0.6;
    private static final int SNIPPET_LENGTH = 300;
    private static final Map<String, String> FEED_HEADERS = Map.of(
        "Accept", "application/rss+xml, application/atom+xml, application/xml;q=0.9, */*;q=0.8");

    public RssCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "RSS Feeds", null, Duration.ZERO);
    }

    @Override
    public String type() {
        return "rss";
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) {
        List<FeedSource> feeds = feeds(request);
        if (feeds.isEmpty()) {
            return CollectorResult.failed("No RSS feeds configured");
        }

        int perFeed = Math.max(1, request.maxItems() / feeds.size());
        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (FeedSource feed : feeds) {
            if (request.isCancelled()) break;
            try {
                List<Item> feedItems = fetchFeed(feed, request);
                items.addAll(feedItems.subList(0, Math.min(perFeed, feedItems.size())));
                if (!feedItems.isEmpty()) {
                    sources.add(Source.of(feed.name(), feed.url()));
                }
            } catch (SourceException e) {
                log.warn("Feed {} failed: {}", feed.name(), e.getMessage());
                errors.add(feed.name() + ": " + e.getMessage());
            }
        }

        log.info("Fetched {} articles from {} feeds", items.size(), feeds.size());
        return new CollectorResult(items, sources,
            !errors.isEmpty() && items.isEmpty() ? String.join("; ", errors) : null);
    }

    private List<FeedSource> feeds(CollectRequest request) {
        List<FeedSource> feeds = new ArrayList<>(request.profile().publications());
        for (String url : registration.listSetting("feeds")) {
            feeds.add(new FeedSource(null, url));
        }
        return feeds;
    }

    List<Item> fetchFeed(FeedSource feed, CollectRequest request) throws SourceException {
        HttpUrl url = HttpUrl.parse(feed.url());
        if (url == null) {
            throw new SourceException("Invalid feed URL " + feed.url());
        }
        String body = http.get(url, FEED_HEADERS, request);

        SyndFeed syndFeed;
        try {
            syndFeed = new SyndFeedInput().build(new StringReader(body));
        } catch (FeedException | IllegalArgumentException e) {
            throw new SourceException("Unparsable feed: " + e.getMessage(), e);
        }

        List<Item> items = new ArrayList<>();
        for (SyndEntry entry : syndFeed.getEntries()) {
            Item item = parseEntry(entry, feed);
            if (item != null && inWindow(item.publishedAt(), request)) {
                items.add(item);
            }
        }
        return items;
    }

    private Item parseEntry(SyndEntry entry, FeedSource feed) {
        String link = entry.getLink();
        String title = text(entry.getTitle());
        if (link == null || link.isBlank() || title.isEmpty()) {
            return null;
        }

        List<String> categories = new ArrayList<>();
        for (SyndCategory category : entry.getCategories()) {
            if (category.getName() != null && !category.getName().isBlank()) {
                categories.add(category.getName().trim());
            }
        }

        return Item.builder()
            .id(ItemIds.forUrl(link))
            .kind(ItemKind.NEWS)
            .collectorId(id())
            .title(title)
            .url(link.trim())
            .sourceName(feed.name())
            .publishedAt(published(entry))
            .snippet(truncate(text(content(entry)), SNIPPET_LENGTH))
            .relevanceHint(RELEVANCE_HINT)
            .details(new NewsDetails(entry.getAuthor(), categories, List.of()))
            .build();
    }

    private static Instant published(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private static String content(SyndEntry entry) {
        // Try description first
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return entry.getDescription().getValue();
        }
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null) {
                return content.getValue();
            }
        }
        return "";
    }

    private static String text(String html) {
        return html == null ? "" : Jsoup.parse(html).text().trim();
    }
}
