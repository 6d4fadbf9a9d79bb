package com.pulsewire.core.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared, preconfigured Jackson mappers.
 *
 * Both use snake_case property names, ISO-8601 dates and lenient unknown property handling:
 * - json(): run results and traces, null fields omitted
 * - yaml(): configuration files
 */
public final class Mappers {

    private static final ObjectMapper JSON;
    private static final ObjectMapper YAML;

    static {
        JSON = configure(new ObjectMapper())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

        YAML = configure(new ObjectMapper(new YAMLFactory()));
    }

    private Mappers() {
        // Prevent instantiation
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /** Mapper for result and trace documents. */
    public static ObjectMapper json() {
        return JSON;
    }

    /** Mapper for YAML configuration. */
    public static ObjectMapper yaml() {
        return YAML;
    }
}
