package org.javai.runner.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.FallbackAction;
import org.javai.runner.ops.OpReporter;

import java.time.Duration;

/**
 * Reports runner events through Log4j2, one marker per event type.
 *
 * <p>Fallback events are logged at a level that reflects how much was lost:</p>
 * <ul>
 *   <li>{@code FAIL} → ERROR</li>
 *   <li>{@code SKIP}, {@code CACHE}, {@code PARTIAL} → WARN</li>
 *   <li>{@code RETRY} → INFO</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker FALLBACK_MARKER = MarkerManager.getMarker("FALLBACK");
	private static final Marker TIMEOUT_MARKER = MarkerManager.getMarker("TIMEOUT");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.runner.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry attempt {} for [{}] in {} ms. Code: {}, Message: {}",
				attemptNumber, operation, delay.toMillis(), error.code(), error.message());
	}

	@Override
	public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retries exhausted for [{}] after {} attempts. Code: {}, Message: {}",
				operation, totalAttempts, error.code(), error.message());
	}

	@Override
	public void reportFallback(String operation, ClassifiedError error) {
		logger.atLevel(levelFor(error.action()))
			.withMarker(FALLBACK_MARKER)
			.log("Fallback {} for [{}]. Code: {}, retryable={}, Message: {}",
				error.action(), operation, error.code(), error.retryable(), error.message());
	}

	@Override
	public void reportTimeout(String operation, Duration timeout) {
		logger.atWarn()
			.withMarker(TIMEOUT_MARKER)
			.log("Watchdog killed [{}] after {} ms", operation, timeout.toMillis());
	}

	private static Level levelFor(FallbackAction action) {
		return switch (action) {
			case FAIL -> Level.ERROR;
			case SKIP, CACHE, PARTIAL -> Level.WARN;
			case RETRY -> Level.INFO;
		};
	}
}
