package com.pulsewire.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Response cache stored as one file per key, expiring after a fixed TTL.
 * Writes go to a temp file and are moved into place, so readers never see partial bodies.
 */
public class FileResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(FileResponseCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final Path directory;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public FileResponseCache(Path directory) {
        this(directory, DEFAULT_TTL, Clock.systemUTC());
    }

    public FileResponseCache(Path directory, Duration ttl, Clock clock) {
        this.directory = directory;
        this.ttl = ttl;
        this.clock = clock;
    }

    /** Default location: ~/.cache/pulsewire */
    public static Path defaultDirectory() {
        return Path.of(System.getProperty("user.home"), ".cache", "pulsewire");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<String> get(CacheKey key) {
        Path file = directory.resolve(key.fileName());
        synchronized (lockFor(key)) {
            try {
                Optional<Duration> age = ageOf(file);
                if (age.isEmpty()) {
                    return Optional.empty();
                }
                if (age.get().compareTo(ttl) > 0) {
                    log.debug("Cache entry {} expired ({} old)", key.fileName(), age.get());
                    return Optional.empty();
                }
                return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Failed to read cache entry {}: {}", key.fileName(), e.getMessage());
                return Optional.empty();
            }
        }
    }

    @Override
    public void put(CacheKey key, String body) {
        Path file = directory.resolve(key.fileName());
        synchronized (lockFor(key)) {
            Path temp = null;
            try {
                Files.createDirectories(directory);
                temp = Files.createTempFile(directory, key.namespace() + "_", ".tmp");
                Files.writeString(temp, body, StandardCharsets.UTF_8);
                try {
                    Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
                temp = null;
            } catch (IOException e) {
                log.warn("Failed to write cache entry {}: {}", key.fileName(), e.getMessage());
            } finally {
                if (temp != null) {
                    deleteQuietly(temp);
                }
            }
        }
    }

    /** Age of a key's entry, empty when absent. */
    public Optional<Duration> ageOf(CacheKey key) throws IOException {
        return ageOf(directory.resolve(key.fileName()));
    }

    /**
     * Delete entries of one namespace, or all entries when namespace is null.
     * @return number of files deleted
     */
    public int clear(String namespace) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        String glob = namespace != null ? namespace + "_*.json" : "*.json";
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, glob)) {
            for (Path file : files) {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                }
            }
        }
        log.info("Cleared {} cache entries from {}", deleted, directory);
        return deleted;
    }

    private Optional<Duration> ageOf(Path file) throws IOException {
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            Duration age = Duration.between(modified, clock.instant());
            return Optional.of(age.isNegative() ? Duration.ZERO : age);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    private Object lockFor(CacheKey key) {
        return locks.computeIfAbsent(key.fileName(), k -> new Object());
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", file, e.getMessage());
        }
    }
}
