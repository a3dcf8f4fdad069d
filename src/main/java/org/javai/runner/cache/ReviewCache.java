package org.javai.runner.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * File-backed cache of analysis results with a time-to-live.
 *
 * <p>Each entry is a JSON file named {@code review-<key>-<md5>.json} in the cache
 * directory, readable by the owner only. Expiry is lazy: an entry older than the TTL is
 * deleted the next time it is looked up. Concurrent writers to the same key are
 * last-write-wins at file granularity.</p>
 */
public class ReviewCache {

    private static final Logger logger = LogManager.getLogger(ReviewCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private static final String PREFIX = "review-";
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final boolean enabled;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock ttlLock = new ReentrantReadWriteLock();
    private Duration ttl = DEFAULT_TTL;

    ReviewCache(Path dir, boolean enabled, Clock clock) {
        this.dir = Objects.requireNonNull(dir, "dir must not be null");
        this.enabled = enabled;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Opens a cache rooted at {@code dir}, creating the directory when enabled.
     * A disabled cache never touches the file system.
     */
    public static ReviewCache open(Path dir, boolean enabled) throws IOException {
        return open(dir, enabled, Clock.systemUTC());
    }

    static ReviewCache open(Path dir, boolean enabled, Clock clock) throws IOException {
        if (enabled) {
            Files.createDirectories(dir);
        }
        return new ReviewCache(dir, enabled, clock);
    }

    /**
     * Looks up a live entry. Absent, unreadable, corrupt and expired entries are all
     * misses; corrupt and expired ones are deleted on the way.
     */
    public Optional<CacheEntry> getReview(long key) {
        if (!enabled) {
            return Optional.empty();
        }
        Path path = pathFor(key);
        CacheEntry entry;
        try {
            entry = mapper.readValue(Files.readString(path, StandardCharsets.UTF_8), CacheEntry.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            logger.warn("Deleting corrupt cache entry {}: {}", path.getFileName(), e.getOriginalMessage());
            deleteQuietly(path);
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Ignoring unreadable cache entry {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }

        if (entry.cachedAt() == null || Duration.between(entry.cachedAt(), clock.instant()).compareTo(ttl()) > 0) {
            deleteQuietly(path);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Stores {@code entry} under {@code key}, stamping the current time. The file is
     * written to a temporary sibling first and moved into place.
     *
     * @return the entry as stored
     */
    public CacheEntry setReview(long key, CacheEntry entry) throws IOException {
        Objects.requireNonNull(entry, "entry must not be null");
        CacheEntry stamped = entry.stamped(key, clock.instant());
        if (!enabled) {
            return stamped;
        }

        byte[] json;
        try {
            json = mapper.writeValueAsBytes(stamped);
        } catch (JsonProcessingException e) {
            throw new IOException("failed to serialize cache entry for key " + key, e);
        }

        Path target = pathFor(key);
        Path temp = createOwnerOnlyTemp();
        try {
            Files.write(temp, json);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        return stamped;
    }

    public void invalidate(long key) {
        if (enabled) {
            deleteQuietly(pathFor(key));
        }
    }

    /**
     * Removes every file in the cache directory. Files that cannot be deleted are logged
     * and skipped.
     *
     * @throws IOException if the directory itself cannot be listed
     */
    public void clear() throws IOException {
        if (!enabled) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
            for (Path file : files) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    logger.warn("Failed to delete cache file {}: {}", file, e.getMessage());
                }
            }
        }
    }

    public void setTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        ttlLock.writeLock().lock();
        try {
            this.ttl = ttl;
        } finally {
            ttlLock.writeLock().unlock();
        }
    }

    public Duration ttl() {
        ttlLock.readLock().lock();
        try {
            return ttl;
        } finally {
            ttlLock.readLock().unlock();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path dir() {
        return dir;
    }

    Path pathFor(long key) {
        String name = PREFIX + key;
        return dir.resolve(name + "-" + md5Hex(name) + SUFFIX);
    }

    /**
     * Hex MD5 of {@code content}, for deriving cache keys from diffs. Not a security hash.
     */
    public static String contentHash(String content) {
        return md5Hex(content);
    }

    private Path createOwnerOnlyTemp() throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile(dir, PREFIX, ".tmp",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        }
        return Files.createTempFile(dir, PREFIX, ".tmp");
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete cache file {}: {}", path, e.getMessage());
        }
    }

    private static String md5Hex(String value) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is required by every Java platform", e);
        }
    }

    @Override
    public String toString() {
        return "ReviewCache[" + dir + (enabled ? "" : ", disabled") + ", ttl=" + ttl() + "]";
    }
}
