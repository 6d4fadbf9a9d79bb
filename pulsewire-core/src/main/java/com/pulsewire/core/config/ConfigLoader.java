package com.pulsewire.core.config;

import com.pulsewire.core.json.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads {@link PulseConfig} from YAML and checks what the type system cannot.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /** Default location: ~/.config/pulsewire/pulsewire.yaml */
    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".config", "pulsewire", "pulsewire.yaml");
    }

    public static PulseConfig load(Path path) throws ConfigException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        try {
            PulseConfig config = parse(Files.readString(path));
            log.info("Loaded config {} ({} collectors)", path, config.collectors().size());
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config " + path + ": " + e.getMessage(), e);
        }
    }

    public static PulseConfig parse(String yaml) throws ConfigException {
        PulseConfig config = null;
        try {
            if (yaml != null && !yaml.isBlank()) {
                config = Mappers.yaml().readValue(yaml, PulseConfig.class);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Invalid config: " + rootMessage(e), e);
        }
        if (config == null) {
            config = new PulseConfig(null, null, null, null, null, null, null);
        }
        validate(config);
        return config;
    }

    static void validate(PulseConfig config) throws ConfigException {
        Set<String> ids = new HashSet<>();
        for (CollectorRegistration registration : config.collectors()) {
            if (!ids.add(registration.id())) {
                throw new ConfigException("Duplicate collector id: " + registration.id());
            }
        }
        try {
            DepthTable table = DepthTable.from(config);
            for (CollectorRegistration registration : config.collectors()) {
                for (Depth depth : Depth.values()) {
                    table.resolve(depth, registration.id());
                }
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid depth settings: " + e.getMessage(), e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
