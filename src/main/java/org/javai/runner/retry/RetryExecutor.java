package org.javai.runner.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.DefaultErrorClassifier;
import org.javai.runner.classify.ErrorClassifier;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs work with retry and exponential backoff.
 *
 * <p>Every checked failure is classified. A non-retryable failure is rethrown unchanged at
 * once; a retryable one is retried after the policy's delay until the attempts run out,
 * at which point {@link RunnerError#MAX_RETRIES_EXCEEDED} is thrown with the last failure
 * as its cause. Runtime exceptions are defects and propagate without classification.
 * Backoff sleeps honor the context: if it ends during a sleep, the context's error is
 * thrown instead of the retried one.</p>
 *
 * <pre>{@code
 * RetryExecutor retry = RetryExecutor.builder()
 *     .policy(RetryPolicy.defaults())
 *     .reporter(reporter)
 *     .build();
 *
 * String output = retry.execute(ctx, "review-42", () -> runOnce(ctx));
 * }</pre>
 */
public final class RetryExecutor {

    private static final Logger logger = LogManager.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final OpReporter reporter;
    private final Sleeper sleeper;

    private RetryExecutor(Builder builder) {
        this.policy = builder.policy;
        this.classifier = builder.classifier;
        this.reporter = builder.reporter;
        this.sleeper = builder.sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs {@code work} until it succeeds, fails terminally, or attempts run out.
     *
     * @param operation name used when reporting retries
     * @throws E the first non-retryable failure, unchanged
     * @throws RunnerException {@link RunnerError#MAX_RETRIES_EXCEEDED} on exhaustion, or the
     *         context's error if it ends between attempts
     */
    public <T, E extends Exception> T execute(RunContext ctx, String operation, ThrowingSupplier<T, E> work)
            throws RunnerException, E {
        Objects.requireNonNull(ctx, "ctx must not be null");
        Objects.requireNonNull(work, "work must not be null");

        Exception lastError = null;
        ClassifiedError lastClassified = null;

        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            if (attempt > 0) {
                Duration delay = calculateDelay(attempt);
                reporter.reportRetryAttempt(operation, lastClassified, attempt, delay);
                sleeper.sleep(ctx, delay);
            }
            ctx.throwIfDone();

            try {
                return work.get();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                ClassifiedError classified = classifier.classify(e);
                if (!classified.retryable()) {
                    logger.debug("[{}] attempt {} failed terminally: {}", operation, attempt + 1, classified);
                    throw RetryExecutor.<E>rethrowable(e);
                }
                logger.debug("[{}] attempt {} failed, retryable: {}", operation, attempt + 1, classified);
                lastError = e;
                lastClassified = classified;
            }
        }

        reporter.reportRetryExhausted(operation, lastClassified, policy.maxAttempts());
        throw new RunnerException(RunnerError.MAX_RETRIES_EXCEEDED,
                RunnerError.MAX_RETRIES_EXCEEDED.defaultMessage() + ": " + lastError.getMessage(), lastError);
    }

    /**
     * Delay before retry {@code attempt}: {@code min(initial * multiplier^(attempt-1), max)},
     * zero for {@code attempt <= 0}.
     */
    public Duration calculateDelay(int attempt) {
        return policy.delayFor(attempt);
    }

    public RetryPolicy policy() {
        return policy;
    }

    // Only checked exceptions thrown by work.get() reach here, so they are instances of E.
    @SuppressWarnings("unchecked")
    private static <E extends Exception> E rethrowable(Exception e) {
        return (E) e;
    }

    public static final class Builder {
        private RetryPolicy policy = RetryPolicy.defaults();
        private ErrorClassifier classifier = new DefaultErrorClassifier();
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = Sleeper.contextual();

        private Builder() {}

        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        // Package-private for testing.
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
