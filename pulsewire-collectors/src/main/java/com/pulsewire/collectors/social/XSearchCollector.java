package com.pulsewire.collectors.social;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulsewire.collectors.HttpCollector;
import com.pulsewire.collectors.Timestamps;
import com.pulsewire.collectors.http.HttpClientFactory;
import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.collector.SourceException;
import com.pulsewire.core.config.CollectorRegistration;
import com.pulsewire.core.config.ThoughtLeader;
import com.pulsewire.core.model.Engagement;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.ItemIds;
import com.pulsewire.core.model.ItemKind;
import com.pulsewire.core.model.SocialDetails;
import com.pulsewire.core.model.Source;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts by the profile's thought leaders, found by an xAI model with the {@code x_search} tool.
 * Settings: {@code model}.
 */
public class XSearchCollector extends HttpCollector {

    private static final Logger log = LoggerFactory.getLogger(XSearchCollector.class);

    public static final String API_KEY = "XAI_API_KEY";
    public static final String DEFAULT_BASE_URL = "https://api.x.ai";
    public static final String DEFAULT_MODEL = "grok-4-1-fast";
    static final double DEFAULT_RELEVANCE = 0.7;
    private static final int MAX_HANDLES = 10;

    private final String model;

    public XSearchCollector(CollectorRegistration registration, OkHttpClient client) {
        super(registration, client, "xAI X Search", DEFAULT_BASE_URL, Duration.ZERO);
        this.model = registration.setting("model", DEFAULT_MODEL);
    }

    @Override
    public String type() {
        return "social";
    }

    @Override
    public List<String> requiredCredentials() {
        return List.of(API_KEY);
    }

    @Override
    protected CollectorResult fetch(CollectRequest request) throws SourceException {
        List<String> handles = request.profile().handles();
        if (handles.isEmpty()) {
            return CollectorResult.failed("No thought leader handles in profile");
        }
        handles = handles.subList(0, Math.min(MAX_HANDLES, handles.size()));

        HttpUrl url = baseUrl().newBuilder().addPathSegments("v1/responses").build();
        String body = http.postJson(url, requestBody(prompt(handles, request)),
            Map.of("Authorization", "Bearer " + request.credential()), request);
        List<JsonNode> posts = extractPosts(http.parse(url, body));

        Map<String, String> leaders = new HashMap<>();
        for (ThoughtLeader leader : request.profile().thoughtLeaders()) {
            if (!leader.handle().isEmpty()) {
                leaders.put(leader.handle().toLowerCase(Locale.ROOT), leader.name());
            }
        }

        List<Item> items = new ArrayList<>();
        List<Source> sources = new ArrayList<>();
        for (JsonNode post : posts) {
            Item item = mapPost(post, leaders);
            if (item == null) continue;
            items.add(item);
            if (!item.url().isEmpty()) {
                sources.add(Source.of(item.sourceName(), item.url()));
            }
            if (items.size() >= request.maxItems()) break;
        }

        log.info("{} returned {} posts for {} handles", name(), items.size(), handles.size());
        return CollectorResult.of(items, sources);
    }

    // ==================== Request ====================

    static String prompt(List<String> handles, CollectRequest request) {
        List<String> tagged = handles.stream().map(h -> "@" + h).toList();
        return "Search X/Twitter for recent posts from these thought leaders: " + String.join(", ", tagged) + "\n\n"
            + "Focus on posts from " + request.fromDate() + " to " + request.toDate() + ".\n\n"
            + "Return up to " + request.maxItems() + " posts, preferring industry trends, insights and predictions, "
            + "high engagement and recency.\n\n"
            + "Return the results as a JSON array with these fields:\n"
            + "- id: post ID\n"
            + "- text: post content\n"
            + "- url: link to post\n"
            + "- author_handle: @username\n"
            + "- date: YYYY-MM-DD\n"
            + "- likes, reposts, replies, quotes: numbers\n"
            + "- relevance: 0.0-1.0 score\n"
            + "- why_relevant: brief explanation\n";
    }

    String requestBody(String prompt) throws SourceException {
        ObjectMapper mapper = HttpClientFactory.getMapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        root.putArray("tools").addObject().put("type", "x_search");
        ObjectNode message = root.putArray("input").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new SourceException("Cannot encode xAI request: " + e.getOriginalMessage(), e);
        }
    }

    // ==================== Response ====================

    /**
     * Posts from every text block of the response. The model answers in prose around a JSON array,
     * so each text is cut from its first '[' to its last ']'.
     */
    static List<JsonNode> extractPosts(JsonNode response) {
        List<String> texts = new ArrayList<>();
        if (response.path("output_text").isTextual()) {
            texts.add(response.path("output_text").asText());
        }
        for (JsonNode output : response.path("output")) {
            JsonNode content = output.path("content");
            if (content.isTextual()) {
                texts.add(content.asText());
            }
            for (JsonNode part : content) {
                if (part.path("text").isTextual()) {
                    texts.add(part.path("text").asText());
                }
            }
        }

        List<JsonNode> posts = new ArrayList<>();
        for (String text : texts) {
            JsonNode parsed = parseArray(text);
            if (parsed == null && text.trim().startsWith("{")) {
                parsed = parseObject(text).path("posts");
            }
            if (parsed != null && parsed.isArray()) {
                parsed.forEach(posts::add);
            }
        }
        return posts;
    }

    private static JsonNode parseArray(String text) {
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return null;
        }
        try {
            JsonNode node = HttpClientFactory.getMapper().readTree(text.substring(start, end + 1));
            return node instanceof ArrayNode ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("No JSON array in model text: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static JsonNode parseObject(String text) {
        try {
            return HttpClientFactory.getMapper().readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("No JSON object in model text: {}", e.getOriginalMessage());
            return HttpClientFactory.getMapper().missingNode();
        }
    }

    /** One malformed post is skipped so the rest of the answer survives. */
    private Item mapPost(JsonNode post, Map<String, String> leaders) {
        try {
            return toItem(post, leaders);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping malformed post from {}: {}", name(), e.getMessage());
            return null;
        }
    }

    Item toItem(JsonNode post, Map<String, String> leaders) {
        String text = post.path("text").asText("").trim();
        if (text.isEmpty()) {
            return null;
        }
        String handle = post.path("author_handle").asText("").trim().replaceFirst("^@", "").toLowerCase(Locale.ROOT);
        String url = post.path("url").asText("").trim();
        String authorName = leaders.getOrDefault(handle, handle);

        Engagement engagement = null;
        if (post.path("likes").isNumber() || post.path("reposts").isNumber()) {
            engagement = new Engagement(null, null, count(post, "likes"), count(post, "reposts"),
                count(post, "replies"), count(post, "quotes"), null);
        }

        String why = post.path("why_relevant").asText("");
        return Item.builder()
            .id(!url.isEmpty() ? ItemIds.forUrl(url) : ItemIds.forContent("x", handle, text))
            .kind(ItemKind.SOCIAL)
            .collectorId(id())
            .title(truncate(text, 140))
            .url(url)
            .sourceName("X/@" + handle)
            .publishedAt(Timestamps.parse(post.path("date").asText(null)))
            .snippet(why.isEmpty() ? text : text + "\n" + why)
            .engagement(engagement)
            .relevanceHint(post.path("relevance").isNumber() ? post.path("relevance").asDouble() : DEFAULT_RELEVANCE)
            .details(new SocialDetails("x", authorName, handle))
            .build();
    }

    private static Long count(JsonNode post, String field) {
        JsonNode value = post.path(field);
        return value.isNumber() ? value.asLong() : null;
    }
}
