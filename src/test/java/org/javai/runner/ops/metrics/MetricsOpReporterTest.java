package org.javai.runner.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.runner.classify.ClassifiedError;
import org.javai.runner.classify.ErrorCode;
import org.javai.runner.classify.FallbackAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsOpReporterTest {

	private static final Instant NOW = Instant.parse("2026-01-20T10:30:00Z");

	private final ObjectMapper mapper = new ObjectMapper();
	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsOpReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsOpReporter(null, capturingLogger, Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private JsonNode onlyEvent() throws Exception {
		assertThat(capturedMessages).hasSize(1);
		return mapper.readTree(capturedMessages.get(0));
	}

	@Test
	void reportRetryAttempt_emitsRetryAttemptEvent() throws Exception {
		ClassifiedError error = new ClassifiedError(ErrorCode.RATE_LIMITED, "429", true, FallbackAction.RETRY);

		reporter.reportRetryAttempt("review-42", error, 2, Duration.ofMillis(2000));

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(event.get("timestamp").asText()).isEqualTo("2026-01-20T10:30:00Z");
		assertThat(event.get("trackingKey").asText()).isEqualTo("review-42");
		assertThat(event.get("code").asText()).isEqualTo("RATE_LIMITED");
		assertThat(event.get("attemptNumber").asInt()).isEqualTo(2);
		assertThat(event.get("delayMs").asLong()).isEqualTo(2000);
	}

	@Test
	void reportRetryExhausted_emitsTotalAttempts() throws Exception {
		ClassifiedError error = new ClassifiedError(ErrorCode.SERVER_ERROR, "503", true, FallbackAction.RETRY);

		reporter.reportRetryExhausted("review-42", error, 4);

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(event.get("totalAttempts").asInt()).isEqualTo(4);
	}

	@Test
	void reportFallback_includesActionAndEscapedMessage() throws Exception {
		ClassifiedError error = new ClassifiedError(ErrorCode.UNAUTHORIZED, "bad \"key\"\nretry later", false,
				FallbackAction.SKIP);

		reporter.reportFallback("review-42", error);

		String json = capturedMessages.get(0);
		assertThat(json).doesNotContain("\n");
		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("fallback");
		assertThat(event.get("action").asText()).isEqualTo("SKIP");
		assertThat(event.get("retryable").asBoolean()).isFalse();
		assertThat(event.get("message").asText()).isEqualTo("bad \"key\"\nretry later");
	}

	@Test
	void reportTimeout_hasNoErrorCode() throws Exception {
		reporter.reportTimeout("claude#1234", Duration.ofSeconds(300));

		JsonNode event = onlyEvent();
		assertThat(event.get("eventType").asText()).isEqualTo("timeout");
		assertThat(event.get("timeoutMs").asLong()).isEqualTo(300_000);
		assertThat(event.has("code")).isFalse();
	}

	@Test
	void namespace_prependsToTrackingKey() {
		MetricsOpReporter namespaced = new MetricsOpReporter("ci", capturingLogger);

		assertThat(namespaced.buildTrackingKey("review-42")).isEqualTo("ci.review-42");
		assertThat(new MetricsOpReporter("  ", capturingLogger).buildTrackingKey("review-42")).isEqualTo("review-42");
		assertThat(reporter.buildTrackingKey(null)).isEqualTo("unknown");
	}

	@Test
	void events_areLoggedAtInfo() {
		reporter.reportTimeout("op", Duration.ofSeconds(1));

		assertThat(capturingLogger.levels).containsExactly(Level.INFO);
	}

	static class CapturingLogger extends LegacyAbstractLogger {

		private final List<String> messages;
		final List<Level> levels = new ArrayList<>();

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "capturing";
		}

		@Override
		public boolean isTraceEnabled() {
			return true;
		}

		@Override
		public boolean isDebugEnabled() {
			return true;
		}

		@Override
		public boolean isInfoEnabled() {
			return true;
		}

		@Override
		public boolean isWarnEnabled() {
			return true;
		}

		@Override
		public boolean isErrorEnabled() {
			return true;
		}

		@Override
		protected String getFullyQualifiedCallerName() {
			return null;
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			levels.add(level);
			messages.add(messagePattern);
		}
	}
}
