package org.javai.runner.fallback;

import org.javai.runner.RunRequest;
import org.javai.runner.cache.CacheEntry;
import org.javai.runner.cache.ReviewCache;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.ErrorCode;
import org.javai.runner.classify.FallbackAction;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.ops.OpReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class FallbackHandlerTest {

    @TempDir
    Path dir;

    private ReviewCache cache;
    private List<ClassifiedError> reported;
    private FallbackHandler handler;
    private final RunRequest request = RunRequest.builder("code-review").id("review-42").cacheKey(42).build();

    @BeforeEach
    void setUp() throws IOException {
        cache = ReviewCache.open(dir, true);
        reported = new ArrayList<>();
        OpReporter reporter = new OpReporter() {
            @Override
            public void reportFallback(String operation, ClassifiedError error) {
                reported.add(error);
            }
        };
        handler = new FallbackHandler(cache, reporter);
    }

    private static ClassifiedError error(ErrorCode code, FallbackAction action) {
        return new ClassifiedError(code, "boom", action == FallbackAction.RETRY, action);
    }

    @Test
    void skip_returnsSkippedResultWithReason() {
        Optional<FallbackResult> result = handler.handle(RunContext.background(),
                error(ErrorCode.UNAUTHORIZED, FallbackAction.SKIP), request);

        assertThat(result).hasValueSatisfying(r -> {
            assertThat(r.skipped()).isTrue();
            assertThat(r.partial()).isFalse();
            assertThat(r.reason()).isEqualTo("Claude API unavailable: UNAUTHORIZED - boom");
            assertThat(r.output()).isEqualTo(FallbackHandler.SKIPPED_OUTPUT);
        });
    }

    @Test
    void retryAndFail_returnNothing() {
        assertThat(handler.handle(RunContext.background(), error(ErrorCode.RATE_LIMITED, FallbackAction.RETRY), request))
                .isEmpty();
        assertThat(handler.handle(RunContext.background(), error(ErrorCode.UNKNOWN, FallbackAction.FAIL), request))
                .isEmpty();
    }

    @Test
    void cache_hit_servesCachedPayload() throws IOException {
        cache.setReview(42, CacheEntry.of(42, "cached review", false, Duration.ofSeconds(3)));

        Optional<FallbackResult> result = handler.handle(RunContext.background(),
                error(ErrorCode.SERVER_ERROR, FallbackAction.CACHE), request);

        assertThat(result).hasValueSatisfying(r -> {
            assertThat(r.cached()).isTrue();
            assertThat(r.skipped()).isFalse();
            assertThat(r.output()).isEqualTo("cached review");
        });
    }

    @Test
    void cache_miss_degradesToSkip() {
        Optional<FallbackResult> result = handler.handle(RunContext.background(),
                error(ErrorCode.SERVER_ERROR, FallbackAction.CACHE), request);

        assertThat(result).hasValueSatisfying(r -> {
            assertThat(r.skipped()).isTrue();
            assertThat(r.reason()).startsWith("Cache miss during fallback");
            assertThat(r.output()).isEqualTo(FallbackHandler.NO_CACHE_OUTPUT);
        });
    }

    @Test
    void cache_withoutCacheConfigured_degradesToSkip() {
        FallbackHandler noCache = new FallbackHandler(null, OpReporter.noOp());

        assertThat(noCache.handle(RunContext.background(), error(ErrorCode.SERVER_ERROR, FallbackAction.CACHE), request))
                .hasValueSatisfying(r -> assertThat(r.skipped()).isTrue());
    }

    @Test
    void partial_usesAvailableOutputOrPlaceholder() {
        ClassifiedError tooLarge = error(ErrorCode.CONTENT_TOO_LARGE, FallbackAction.PARTIAL);

        FallbackResult withOutput = handler.handle(RunContext.background(), tooLarge, request, "half a review").orElseThrow();
        FallbackResult withoutOutput = handler.handle(RunContext.background(), tooLarge, request).orElseThrow();

        assertThat(withOutput.partial()).isTrue();
        assertThat(withOutput.output()).isEqualTo("half a review");
        assertThat(withOutput.reason()).isEqualTo("Returning partial results: boom");
        assertThat(withoutOutput.output()).isEqualTo(FallbackHandler.PARTIAL_OUTPUT);
    }

    @Test
    void metrics_countEveryCallByActionAndCode() {
        handler.handle(RunContext.background(), error(ErrorCode.UNAUTHORIZED, FallbackAction.SKIP), request);
        handler.handle(RunContext.background(), error(ErrorCode.UNAUTHORIZED, FallbackAction.SKIP), request);
        handler.handle(RunContext.background(), error(ErrorCode.RATE_LIMITED, FallbackAction.RETRY), request);

        FallbackMetrics metrics = handler.metrics();

        assertThat(metrics.total()).isEqualTo(3);
        assertThat(metrics.count(FallbackAction.SKIP)).isEqualTo(2);
        assertThat(metrics.count(FallbackAction.RETRY)).isEqualTo(1);
        assertThat(metrics.count(FallbackAction.PARTIAL)).isZero();
        assertThat(metrics.count(ErrorCode.UNAUTHORIZED)).isEqualTo(2);
        assertThat(metrics.rate(6)).isEqualTo(0.5);
        assertThat(metrics.rate(0)).isZero();
        assertThat(reported).hasSize(3);
    }

    @Test
    void metrics_snapshotIsUnaffectedByLaterCalls() {
        handler.handle(RunContext.background(), error(ErrorCode.UNAUTHORIZED, FallbackAction.SKIP), request);
        FallbackMetrics snapshot = handler.metrics();

        handler.handle(RunContext.background(), error(ErrorCode.UNAUTHORIZED, FallbackAction.SKIP), request);

        assertThat(snapshot.total()).isEqualTo(1);
        assertThat(snapshot.count(FallbackAction.SKIP)).isEqualTo(1);
        assertThatThrownBy(() -> snapshot.byAction().put(FallbackAction.FAIL, 1L))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
