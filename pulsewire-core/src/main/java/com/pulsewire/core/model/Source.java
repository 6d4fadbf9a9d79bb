package com.pulsewire.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A citation target. Many items may cite the same source.
 */
public record Source(String name, String url, LocalDate accessed) {

    public Source {
        name = name != null ? name.trim() : "";
        url = url != null ? url.trim() : "";
    }

    public static Source of(String name, String url) {
        return new Source(name, url, LocalDate.now());
    }

    /** Sources with the same name and URL, first appearance wins. */
    public static List<Source> deduplicate(Collection<Source> sources) {
        Map<String, Source> unique = new LinkedHashMap<>();
        for (Source source : sources) {
            unique.putIfAbsent(source.name() + "\n" + source.url(), source);
        }
        return new ArrayList<>(unique.values());
    }
}
