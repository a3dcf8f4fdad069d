package org.javai.runner.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff policy.
 *
 * <p>The delay before retry {@code n} (1-based) is
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)}.</p>
 *
 * @param maxRetries retries after the first attempt, so at most {@code maxRetries + 1} attempts
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound for any delay
 * @param multiplier growth factor between consecutive delays
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {

    private static final RetryPolicy DEFAULTS =
            new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
    }

    /**
     * Three retries starting at one second, doubling, capped at ten seconds.
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before retry {@code attempt}; zero for {@code attempt <= 0}.
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        double nanos = initialDelay.toNanos();
        double cap = maxDelay.toNanos();
        if (nanos >= cap) {
            return maxDelay;
        }
        for (int i = 1; i < attempt; i++) {
            nanos *= multiplier;
            if (nanos >= cap) {
                return maxDelay;
            }
        }
        return Duration.ofNanos((long) nanos);
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier);
    }
}
