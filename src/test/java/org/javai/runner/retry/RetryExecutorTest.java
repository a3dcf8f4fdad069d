package org.javai.runner.retry;

import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.ErrorCode;
import org.javai.runner.concurrent.RunContext;
import org.javai.runner.ops.OpReporter;
import org.javai.runner.process.ProcessFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryExecutorTest {

    private List<RetryAttempt> reportedRetries;
    private List<RetryExhausted> reportedExhausted;
    private List<Duration> sleeps;
    private OpReporter reporter;

    record RetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {}
    record RetryExhausted(String operation, ClassifiedError error, int totalAttempts) {}

    @BeforeEach
    void setUp() {
        reportedRetries = new ArrayList<>();
        reportedExhausted = new ArrayList<>();
        sleeps = new ArrayList<>();

        reporter = new OpReporter() {
            @Override
            public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
                reportedRetries.add(new RetryAttempt(operation, error, attemptNumber, delay));
            }

            @Override
            public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts) {
                reportedExhausted.add(new RetryExhausted(operation, error, totalAttempts));
            }
        };
    }

    private RetryExecutor executor(RetryPolicy policy) {
        return RetryExecutor.builder()
                .policy(policy)
                .reporter(reporter)
                .sleeper((ctx, delay) -> sleeps.add(delay))
                .build();
    }

    @Test
    void calculateDelay_growsExponentiallyAndCaps() {
        RetryExecutor retry = executor(RetryPolicy.defaults());

        assertThat(retry.calculateDelay(0)).isEqualTo(Duration.ZERO);
        assertThat(retry.calculateDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(retry.calculateDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(retry.calculateDelay(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(retry.calculateDelay(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(retry.calculateDelay(100)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void execute_success_noRetries() throws Exception {
        String result = executor(RetryPolicy.defaults())
                .execute(RunContext.background(), "op", () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(reportedRetries).isEmpty();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_retriesTransientFailureUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor(RetryPolicy.defaults()).execute(RunContext.background(), "review-1", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("503 service unavailable");
            }
            return "third time lucky";
        });

        assertThat(result).isEqualTo("third time lucky");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(reportedRetries).extracting(RetryAttempt::attemptNumber).containsExactly(1, 2);
        assertThat(reportedRetries.get(0).error().code()).isEqualTo(ErrorCode.SERVER_ERROR);
        assertThat(reportedRetries.get(0).operation()).isEqualTo("review-1");
    }

    @Test
    void execute_exhaustion_makesMaxRetriesPlusOneAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        RetryExecutor retry = executor(RetryPolicy.defaults());

        assertThatThrownBy(() -> retry.execute(RunContext.background(), "op", () -> {
            attempts.incrementAndGet();
            throw new ProcessFailedException(1, "429 rate limit");
        }))
                .isInstanceOfSatisfying(RunnerException.class, re -> {
                    assertThat(re.error()).isEqualTo(RunnerError.MAX_RETRIES_EXCEEDED);
                    assertThat(re.getCause()).isInstanceOf(ProcessFailedException.class);
                    assertThat(re.getMessage()).startsWith("max retries exceeded: ").contains("429");
                });

        assertThat(attempts.get()).isEqualTo(4);
        assertThat(reportedRetries).hasSize(3);
        assertThat(reportedExhausted).singleElement().satisfies(ex -> {
            assertThat(ex.totalAttempts()).isEqualTo(4);
            assertThat(ex.error().code()).isEqualTo(ErrorCode.RATE_LIMITED);
        });
    }

    @Test
    void execute_nonRetryableFailure_rethrownUnchangedImmediately() {
        AtomicInteger attempts = new AtomicInteger();
        ProcessFailedException unauthorized = new ProcessFailedException(1, "401 Unauthorized");

        assertThatThrownBy(() -> executor(RetryPolicy.defaults()).execute(RunContext.background(), "op", () -> {
            attempts.incrementAndGet();
            throw unauthorized;
        })).isSameAs(unauthorized);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(reportedRetries).isEmpty();
        assertThat(reportedExhausted).isEmpty();
    }

    @Test
    void execute_runtimeException_propagatesWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor(RetryPolicy.defaults()).execute(RunContext.background(), "op", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class).hasMessage("bug");

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_cancelledContext_failsBeforeFirstAttempt() {
        RunContext ctx = RunContext.background().withCancel();
        ctx.cancel();
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor(RetryPolicy.defaults()).execute(ctx, "op", () -> {
            attempts.incrementAndGet();
            return "never";
        }))
                .isInstanceOfSatisfying(RunnerException.class, e -> assertThat(e.error()).isEqualTo(RunnerError.CANCELLED));

        assertThat(attempts.get()).isZero();
    }

    @Test
    void execute_contextEndsDuringBackoff_throwsContextError() {
        RunContext ctx = RunContext.background().withCancel();
        RetryExecutor retry = RetryExecutor.builder()
                .policy(RetryPolicy.defaults())
                .sleeper((c, delay) -> {
                    ctx.cancel();
                    c.throwIfDone();
                })
                .build();

        assertThatThrownBy(() -> retry.execute(ctx, "op", () -> {
            throw new IOException("connection reset");
        }))
                .isInstanceOfSatisfying(RunnerException.class, e -> assertThat(e.error()).isEqualTo(RunnerError.CANCELLED));
    }

    @Test
    void execute_noRetryPolicy_singleAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor(RetryPolicy.noRetry()).execute(RunContext.background(), "op", () -> {
            attempts.incrementAndGet();
            throw new IOException("flaky");
        }))
                .isInstanceOfSatisfying(RunnerException.class, e -> assertThat(e.error()).isEqualTo(RunnerError.MAX_RETRIES_EXCEEDED));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }
}
