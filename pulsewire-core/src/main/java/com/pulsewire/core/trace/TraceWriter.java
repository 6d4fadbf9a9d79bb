package com.pulsewire.core.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pulsewire.core.json.Mappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes trace documents as snake_case JSON.
 */
public final class TraceWriter {

    private TraceWriter() {
    }

    public static String toJson(TraceDocument trace) {
        try {
            return Mappers.json().writerWithDefaultPrettyPrinter().writeValueAsString(trace);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Trace is not serializable", e);
        }
    }

    public static TraceDocument fromJson(String json) throws IOException {
        return Mappers.json().readValue(json, TraceDocument.class);
    }

    public static void write(TraceDocument trace, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(trace));
    }
}
