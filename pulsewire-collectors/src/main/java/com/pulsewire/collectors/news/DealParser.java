package com.pulsewire.collectors.news;

import com.pulsewire.core.model.DealDetails;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic extraction of M&A and investment details from a headline and description.
 */
final class DealParser {

    static final List<String> DEAL_KEYWORDS = List.of(
        "acquisition", "merger", "acquired", "buys", "acquires", "investment",
        "stake", "deal", "private equity");

    private static final Pattern VALUE = Pattern.compile(
        "\\$(\\d+(?:\\.\\d+)?)\\s*(billion|million|bn|b|m)\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> ACQUIRER_MARKERS = List.of("acquires", "buys", "acquire", "to");
    private static final List<String> TARGET_MARKERS = List.of("acquires", "buys");

    private DealParser() {
    }

    /** Deal details, or empty when the text is not about a deal. */
    static Optional<DealDetails> parse(String title, String description) {
        String text = (title + " " + (description != null ? description : "")).toLowerCase(Locale.ROOT);
        if (DEAL_KEYWORDS.stream().noneMatch(text::contains)) {
            return Optional.empty();
        }

        Double value = null;
        String valueText = "";
        Matcher m = VALUE.matcher(text);
        if (m.find()) {
            double amount = Double.parseDouble(m.group(1));
            boolean billions = m.group(2).toLowerCase(Locale.ROOT).startsWith("b");
            value = amount * (billions ? 1_000_000_000d : 1_000_000d);
            valueText = "$" + m.group(1) + (billions ? "B" : "M");
        }

        return Optional.of(new DealDetails(activityType(text), acquirer(title), target(title), value, valueText));
    }

    static String activityType(String text) {
        if (text.contains("acquir") || text.contains("acquisition") || text.contains("buys") || text.contains("bought")) {
            return "acquisition";
        }
        if (text.contains("merger")) {
            return "merger";
        }
        if (text.contains("invest") || text.contains("stake") || text.contains("funding")) {
            return "investment";
        }
        return "unknown";
    }

    /** Words before the first "acquires", "buys" or "to". */
    static String acquirer(String title) {
        String[] words = title.trim().split("\\s+");
        for (int i = 0; i < words.length; i++) {
            if (ACQUIRER_MARKERS.contains(words[i].toLowerCase(Locale.ROOT))) {
                return String.join(" ", List.of(words).subList(0, i));
            }
        }
        return "";
    }

    /** Words after the first "acquires" or "buys". */
    static String target(String title) {
        String[] words = title.trim().split("\\s+");
        for (int i = 0; i < words.length; i++) {
            if (TARGET_MARKERS.contains(words[i].toLowerCase(Locale.ROOT))) {
                return String.join(" ", List.of(words).subList(i + 1, words.length));
            }
        }
        return "";
    }
}
