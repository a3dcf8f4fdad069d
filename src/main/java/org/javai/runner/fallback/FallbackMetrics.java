package org.javai.runner.fallback;

import org.javai.runner.classify.ErrorCode;
import org.javai.runner.classify.FallbackAction;

import java.util.Map;

/**
 * Immutable snapshot of fallback counters.
 *
 * @param total every failure handed to the fallback handler
 * @param byAction counts per fallback action; absent actions were never taken
 * @param byErrorCode counts per error code; absent codes never occurred
 */
public record FallbackMetrics(long total, Map<FallbackAction, Long> byAction, Map<ErrorCode, Long> byErrorCode) {

    public FallbackMetrics {
        byAction = Map.copyOf(byAction);
        byErrorCode = Map.copyOf(byErrorCode);
    }

    public long count(FallbackAction action) {
        return byAction.getOrDefault(action, 0L);
    }

    public long count(ErrorCode code) {
        return byErrorCode.getOrDefault(code, 0L);
    }

    /**
     * Share of {@code totalRuns} that needed a fallback, zero when nothing ran.
     */
    public double rate(long totalRuns) {
        return totalRuns <= 0 ? 0.0 : (double) total / totalRuns;
    }
}
