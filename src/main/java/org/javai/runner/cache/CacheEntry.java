package org.javai.runner.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached analysis result.
 *
 * @param key the request's cache key (for example a pull request number)
 * @param payload the captured analysis output
 * @param partial whether the output came from a partial fallback
 * @param cachedAt when the entry was written; stamped by the cache
 * @param originalDuration how long the analysis that produced it took
 */
public record CacheEntry(long key, String payload, boolean partial, Instant cachedAt, Duration originalDuration) {

    public static CacheEntry of(long key, String payload, boolean partial, Duration originalDuration) {
        return new CacheEntry(key, payload, partial, null, originalDuration);
    }

    CacheEntry stamped(long key, Instant now) {
        return new CacheEntry(key, payload, partial, now, originalDuration);
    }
}
