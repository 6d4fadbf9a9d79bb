package com.pulsewire.core.config;

import com.pulsewire.core.json.Mappers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One registered collector: which factory builds it, its priority and free-form settings.
 */
public record CollectorRegistration(
    String id,
    String factory,                 // defaults to id
    Integer priority,               // lower wins sort ties, default 100
    Boolean enabled,
    Map<String, Object> settings,
    Map<String, DepthSpec> depth
) {
    public static final int DEFAULT_PRIORITY = 100;

    public CollectorRegistration {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Collector registration needs an id");
        }
        factory = factory != null && !factory.isBlank() ? factory : id;
        priority = priority != null ? priority : DEFAULT_PRIORITY;
        enabled = enabled == null || enabled;
        settings = settings != null ? Map.copyOf(settings) : Map.of();
        depth = depth != null ? Map.copyOf(depth) : Map.of();
    }

    public static CollectorRegistration of(String id) {
        return new CollectorRegistration(id, null, null, null, null, null);
    }

    public static CollectorRegistration of(String id, Map<String, Object> settings) {
        return new CollectorRegistration(id, null, null, null, settings, null);
    }

    // ==================== Settings ====================

    public String setting(String key, String fallback) {
        Object value = settings.get(key);
        return value != null ? value.toString() : fallback;
    }

    public int intSetting(String key, int fallback) {
        Object value = settings.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting " + key + " of " + id + " is not a number: " + value, e);
            }
        }
        return fallback;
    }

    public long longSetting(String key, long fallback) {
        Object value = settings.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting " + key + " of " + id + " is not a number: " + value, e);
            }
        }
        return fallback;
    }

    public List<String> listSetting(String key) {
        Object value = settings.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    /** Convert a structured setting into a typed value, e.g. a list of page definitions. */
    public <T> T settingAs(String key, Class<T> type, T fallback) {
        Object value = settings.get(key);
        return value != null ? Mappers.yaml().convertValue(value, type) : fallback;
    }
}
