package org.javai.runner.fallback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunRequest;
import org.javai.runner.cache.CacheEntry;
import org.javai.runner.cache.ReviewCache;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.ErrorCode;
import org.javai.runner.classify.FallbackAction;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.ops.OpReporter;

import java.util.EnumMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Turns a terminal classified failure into a degraded result where policy allows it.
 *
 * <p>{@code SKIP}, {@code CACHE} and {@code PARTIAL} produce a result the caller reports
 * as success with an explicit marker. {@code FAIL} and {@code RETRY} produce nothing: the
 * caller propagates the original error. Every call is counted, whatever the action.</p>
 */
public class FallbackHandler {

    private static final Logger logger = LogManager.getLogger(FallbackHandler.class);

    static final String SKIPPED_OUTPUT = "Analysis skipped due to API unavailability; the pipeline was not blocked";
    static final String NO_CACHE_OUTPUT = "No cached result available";
    static final String PARTIAL_OUTPUT = "Partial analysis completed";

    private final ReviewCache cache;
    private final OpReporter reporter;

    private final AtomicLong total = new AtomicLong();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final EnumMap<FallbackAction, Long> byAction = new EnumMap<>(FallbackAction.class);
    private final EnumMap<ErrorCode, Long> byErrorCode = new EnumMap<>(ErrorCode.class);

    /**
     * @param cache source for the {@code CACHE} action; null disables cache lookups
     */
    public FallbackHandler(ReviewCache cache, OpReporter reporter) {
        this.cache = cache;
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public Optional<FallbackResult> handle(RunContext ctx, ClassifiedError error, RunRequest request) {
        return handle(ctx, error, request, null);
    }

    /**
     * @param availableOutput output captured before the failure, used by {@code PARTIAL}
     * @return the degraded result, or empty if the error must propagate
     */
    public Optional<FallbackResult> handle(RunContext ctx, ClassifiedError error, RunRequest request,
                                           String availableOutput) {
        Objects.requireNonNull(error, "error must not be null");
        record(error);
        reporter.reportFallback(request == null ? null : request.id(), error);

        return switch (error.action()) {
            case RETRY, FAIL -> Optional.empty();
            case SKIP -> Optional.of(FallbackResult.skipped(
                    "Claude API unavailable: " + error.code() + " - " + error.message(), SKIPPED_OUTPUT));
            case CACHE -> Optional.of(fromCache(ctx, request));
            case PARTIAL -> Optional.of(FallbackResult.partial(
                    availableOutput == null || availableOutput.isBlank() ? PARTIAL_OUTPUT : availableOutput,
                    "Returning partial results: " + error.message()));
        };
    }

    /**
     * A copy of the counters; later activity does not change it.
     */
    public FallbackMetrics metrics() {
        lock.readLock().lock();
        try {
            return new FallbackMetrics(total.get(), byAction, byErrorCode);
        } finally {
            lock.readLock().unlock();
        }
    }

    private FallbackResult fromCache(RunContext ctx, RunRequest request) {
        if (cache != null && request != null && request.cacheKey().isPresent() && !ctx.isDone()) {
            Optional<CacheEntry> hit = cache.getReview(request.cacheKey().getAsLong());
            if (hit.isPresent()) {
                CacheEntry entry = hit.get();
                logger.info("Serving cached result for {} from {}", request.id(), entry.cachedAt());
                return FallbackResult.fromCache(entry.payload(), "Serving cached result from " + entry.cachedAt());
            }
        }
        return FallbackResult.skipped("Cache miss during fallback: no cached result", NO_CACHE_OUTPUT);
    }

    private void record(ClassifiedError error) {
        total.incrementAndGet();
        lock.writeLock().lock();
        try {
            byAction.merge(error.action(), 1L, Long::sum);
            byErrorCode.merge(error.code(), 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
