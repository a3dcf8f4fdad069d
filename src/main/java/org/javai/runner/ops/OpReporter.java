package org.javai.runner.ops;

import org.javai.runner.classify.ClassifiedError;

import java.time.Duration;

/**
 * Receives operational events from the runner for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 * Every method defaults to a no-op so implementations override only what they need.
 */
public interface OpReporter {

	/**
	 * Reports that a failed attempt is about to be retried.
	 *
	 * @param operation what was being run, usually the request id
	 * @param error the classified failure of the previous attempt
	 * @param attemptNumber the attempt about to start (1-based count of retries)
	 * @param delay the backoff before that attempt
	 */
	default void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
	}

	/**
	 * Reports that every allowed attempt failed.
	 */
	default void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts) {
	}

	/**
	 * Reports that a terminal failure went through the fallback handler.
	 */
	default void reportFallback(String operation, ClassifiedError error) {
	}

	/**
	 * Reports that a subprocess was killed for exceeding its time limit.
	 */
	default void reportTimeout(String operation, Duration timeout) {
	}

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static OpReporter noOp() {
		return new OpReporter() {
		};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static OpReporter composite(OpReporter... reporters) {
		return CompositeOpReporter.of(reporters);
	}
}
