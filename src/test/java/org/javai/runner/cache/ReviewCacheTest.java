package org.javai.runner.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ReviewCacheTest {

    private static final Instant NOW = Instant.parse("2026-01-20T10:30:00Z");

    @TempDir
    Path dir;

    private ReviewCache cacheAt(Instant instant) throws IOException {
        return ReviewCache.open(dir, true, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void setThenGet_returnsStampedEntry() throws IOException {
        ReviewCache cache = cacheAt(NOW);

        CacheEntry stored = cache.setReview(42, CacheEntry.of(0, "LGTM", false, Duration.ofSeconds(12)));
        Optional<CacheEntry> hit = cache.getReview(42);

        assertThat(stored.cachedAt()).isEqualTo(NOW);
        assertThat(stored.key()).isEqualTo(42);
        assertThat(hit).contains(stored);
        assertThat(hit.get().originalDuration()).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    void getReview_unknownKey_isMiss() throws IOException {
        assertThat(cacheAt(NOW).getReview(7)).isEmpty();
    }

    @Test
    void getReview_expiredEntry_isMissAndDeleted() throws IOException {
        cacheAt(NOW).setReview(42, CacheEntry.of(42, "old", false, Duration.ZERO));
        ReviewCache later = cacheAt(NOW.plus(Duration.ofHours(25)));

        assertThat(later.getReview(42)).isEmpty();
        assertThat(later.pathFor(42)).doesNotExist();
    }

    @Test
    void getReview_withinTtl_isHit() throws IOException {
        cacheAt(NOW).setReview(42, CacheEntry.of(42, "fresh", false, Duration.ZERO));

        assertThat(cacheAt(NOW.plus(Duration.ofHours(23))).getReview(42)).isPresent();
    }

    @Test
    void setTtl_tinyTtl_expiresImmediately() throws IOException {
        cacheAt(NOW).setReview(1, CacheEntry.of(1, "gone soon", false, Duration.ZERO));
        ReviewCache cache = cacheAt(NOW.plusMillis(1));
        cache.setTtl(Duration.ofNanos(1));

        assertThat(cache.getReview(1)).isEmpty();
        assertThat(cache.ttl()).isEqualTo(Duration.ofNanos(1));
    }

    @Test
    void getReview_corruptFile_isMissAndDeleted() throws IOException {
        ReviewCache cache = cacheAt(NOW);
        Files.writeString(cache.pathFor(9), "{not json");

        assertThat(cache.getReview(9)).isEmpty();
        assertThat(cache.pathFor(9)).doesNotExist();
    }

    @Test
    void invalidate_removesEntry() throws IOException {
        ReviewCache cache = cacheAt(NOW);
        cache.setReview(3, CacheEntry.of(3, "x", false, Duration.ZERO));

        cache.invalidate(3);

        assertThat(cache.getReview(3)).isEmpty();
    }

    @Test
    void clear_removesEverything() throws IOException {
        ReviewCache cache = cacheAt(NOW);
        cache.setReview(1, CacheEntry.of(1, "a", false, Duration.ZERO));
        cache.setReview(2, CacheEntry.of(2, "b", true, Duration.ZERO));

        cache.clear();

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void disabledCache_neverHitsAndWritesNothing() throws IOException {
        Path sub = dir.resolve("never-created");
        ReviewCache cache = ReviewCache.open(sub, false);

        cache.setReview(1, CacheEntry.of(1, "a", false, Duration.ZERO));

        assertThat(cache.isEnabled()).isFalse();
        assertThat(cache.getReview(1)).isEmpty();
        assertThat(sub).doesNotExist();
    }

    @Test
    void pathFor_isStablePerKeyAndDistinctAcrossKeys() throws IOException {
        ReviewCache cache = cacheAt(NOW);

        assertThat(cache.pathFor(5)).isEqualTo(cache.pathFor(5));
        assertThat(cache.pathFor(5)).isNotEqualTo(cache.pathFor(50));
        assertThat(cache.pathFor(5).getFileName().toString()).matches("review-5-[0-9a-f]{32}\\.json");
    }

    @Test
    void setReview_leavesNoTemporaryFiles() throws IOException {
        ReviewCache cache = cacheAt(NOW);
        cache.setReview(1, CacheEntry.of(1, "a", false, Duration.ZERO));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).singleElement().isEqualTo(cache.pathFor(1));
        }
    }

    @Test
    void contentHash_isMd5Hex() {
        assertThat(ReviewCache.contentHash("")).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    }
}
