package org.javai.runner.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Reports runner events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object with an {@code eventType}, a timestamp and a tracking
 * key built from an optional namespace and the operation name.</p>
 *
 * <pre>{@code
 * {"eventType":"fallback","timestamp":"2026-01-20T10:30:00Z","trackingKey":"ci.review-42","code":"RATE_LIMITED","action":"RETRY",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.runner.Metrics";

	private final ObjectMapper mapper = new ObjectMapper();
	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace prefix for tracking keys, may be null or blank
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	// Package-private for testing.
	MetricsOpReporter(String namespace, Logger logger) {
		this(namespace, logger, Clock.systemUTC());
	}

	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		ObjectNode event = event("retry_attempt", operation, error);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts) {
		ObjectNode event = event("retry_exhausted", operation, error);
		event.put("totalAttempts", totalAttempts);
		emit(event);
	}

	@Override
	public void reportFallback(String operation, ClassifiedError error) {
		ObjectNode event = event("fallback", operation, error);
		event.put("action", error.action().name());
		event.put("retryable", error.retryable());
		event.put("message", error.message());
		emit(event);
	}

	@Override
	public void reportTimeout(String operation, Duration timeout) {
		ObjectNode event = event("timeout", operation, null);
		event.put("timeoutMs", timeout.toMillis());
		emit(event);
	}

	String buildTrackingKey(String operation) {
		String op = operation == null ? "unknown" : operation;
		return namespace == null ? op : namespace + "." + op;
	}

	private ObjectNode event(String type, String operation, ClassifiedError error) {
		ObjectNode node = mapper.createObjectNode();
		node.put("eventType", type);
		node.put("timestamp", clock.instant().toString());
		node.put("trackingKey", buildTrackingKey(operation));
		node.put("operation", operation);
		if (error != null) {
			node.put("code", error.code().name());
		}
		return node;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize {} event: {}", event.path("eventType").asText(), e.getMessage());
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
