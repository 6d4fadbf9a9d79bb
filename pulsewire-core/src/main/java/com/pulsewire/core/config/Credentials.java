package com.pulsewire.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configured credential values keyed by name, e.g. {@code NEWSDATA_API_KEY}.
 * Only non-blank values count as configured.
 */
public final class Credentials {

    private static final Logger log = LoggerFactory.getLogger(Credentials.class);

    private static final Set<String> OFF_VALUES = Set.of("0", "false", "no", "off");

    private final Map<String, String> values;

    private Credentials(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Credentials empty() {
        return new Credentials(new LinkedHashMap<>());
    }

    public static Credentials of(Map<String, String> values) {
        Map<String, String> configured = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                configured.put(key, value.trim());
            }
        });
        return new Credentials(configured);
    }

    /** Default env file: ~/.config/pulsewire/.env */
    public static Path defaultEnvFile() {
        return Path.of(System.getProperty("user.home"), ".config", "pulsewire", ".env");
    }

    /**
     * Load every key from the env file, then overlay the named keys from the process environment.
     * A missing env file is not an error.
     */
    public static Credentials load(Path envFile, Map<String, String> environment, Collection<String> keys)
            throws ConfigException {
        Map<String, String> merged = new LinkedHashMap<>();
        if (envFile != null && Files.isRegularFile(envFile)) {
            try {
                merged.putAll(parseEnvFile(Files.readString(envFile)));
                log.debug("Read {} entries from {}", merged.size(), envFile);
            } catch (IOException e) {
                throw new ConfigException("Failed to read " + envFile + ": " + e.getMessage(), e);
            }
        }
        for (String key : keys) {
            String value = environment.get(key);
            if (value != null && !value.isBlank()) {
                merged.put(key, value);
            }
        }
        return of(merged);
    }

    /**
     * Drop the given switch keys whose value turns the feature off (0, false, no or off),
     * so collectors gated by them are reported unavailable rather than run.
     */
    public Credentials withoutSwitchedOff(Collection<String> switchKeys) {
        Map<String, String> kept = new LinkedHashMap<>(values);
        for (String key : switchKeys) {
            String value = kept.get(key);
            if (value != null && OFF_VALUES.contains(value.toLowerCase(Locale.ROOT))) {
                log.info("{} is switched off ({})", key, value);
                kept.remove(key);
            }
        }
        return new Credentials(kept);
    }

    /** Parse KEY=VALUE lines; blank lines, comments and an {@code export} prefix are allowed. */
    static Map<String, String> parseEnvFile(String content) {
        Map<String, String> env = new LinkedHashMap<>();
        for (String raw : content.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) {
                line = line.substring(7).trim();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                    || value.startsWith("'") && value.endsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            env.put(key, value);
        }
        return env;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** Keys with a configured value. */
    public Set<String> configuredKeys() {
        return values.keySet();
    }

    /** Masked form for display, e.g. {@code sk-a...9xyz}. */
    public static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.length() <= 8) {
            return "****";
        }
        return value.substring(0, 4) + "..." + value.substring(value.length() - 4);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Credentials{");
        values.forEach((k, v) -> sb.append(k).append('=').append(mask(v)).append(", "));
        if (!values.isEmpty()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}
