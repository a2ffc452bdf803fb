package org.javai.retry.ops;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.of(
 *     new Log4jRetryReporter(),
 *     new MetricsRetryReporter("myapp")
 * );
 *
 * // Or using the builder for more control:
 * RetryReporter reporter = CompositeRetryReporter.builder()
 *     .add(new Log4jRetryReporter())
 *     .addIf(metricsEnabled, new MetricsRetryReporter())
 *     .build();
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetryAttempt(String operation, int attempt, Throwable error, Duration delay) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(operation, attempt, error, delay));
	}

	@Override
	public void reportRetriesExhausted(String operation, int attempts, Throwable error) {
		fanOut("reportRetriesExhausted", reporter -> reporter.reportRetriesExhausted(operation, attempts, error));
	}

	@Override
	public void reportUnretryable(String operation, int attempt, Throwable error) {
		fanOut("reportUnretryable", reporter -> reporter.reportUnretryable(operation, attempt, error));
	}

	@Override
	public void reportCancelled(String operation, int attempts, Throwable error) {
		fanOut("reportCancelled", reporter -> reporter.reportCancelled(operation, attempts, error));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<RetryReporter> call) {
		for (RetryReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				LOG.warn("RetryReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeRetryReporter}.
	 */
	public static final class Builder {
		private final List<RetryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null is ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(RetryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Adds multiple reporters to the composite.
		 *
		 * @param reporters the reporters to add
		 * @return this builder
		 */
		public Builder addAll(Collection<? extends RetryReporter> reporters) {
			for (RetryReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, RetryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeRetryReporter build() {
			return new CompositeRetryReporter(reporters);
		}
	}
}
