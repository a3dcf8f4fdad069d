package org.javai.runner.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.classify.ClassifiedError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. A reporter that throws is logged and
 * skipped so the remaining reporters still run.</p>
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("ci"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger logger = LogManager.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		fanOut("reportRetryAttempt", r -> r.reportRetryAttempt(operation, error, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts) {
		fanOut("reportRetryExhausted", r -> r.reportRetryExhausted(operation, error, totalAttempts));
	}

	@Override
	public void reportFallback(String operation, ClassifiedError error) {
		fanOut("reportFallback", r -> r.reportFallback(operation, error));
	}

	@Override
	public void reportTimeout(String operation, Duration timeout) {
		fanOut("reportTimeout", r -> r.reportTimeout(operation, timeout));
	}

	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				logger.warn("OpReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
			}
		}
	}

	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Adds the reporter only when {@code condition} holds.
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
