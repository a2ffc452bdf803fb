package org.javai.retry.ops.log4j;

import java.time.Duration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retry.ops.RetryReporter;

/**
 * Reports retry events using Log4j2 logging.
 *
 * <p>Events are logged with a marker per event kind and a level reflecting how much attention
 * they deserve:
 * <ul>
 *   <li>{@code RETRY} → INFO</li>
 *   <li>{@code RETRY_EXHAUSTED} → WARN, with the last failure attached</li>
 *   <li>{@code RETRY_ABORTED} → WARN, with the rejected failure attached</li>
 *   <li>{@code RETRY_CANCELLED} → DEBUG</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker RETRY_ABORTED_MARKER = MarkerManager.getMarker("RETRY_ABORTED");
	static final Marker RETRY_CANCELLED_MARKER = MarkerManager.getMarker("RETRY_CANCELLED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.retry.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, int attempt, Throwable error, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed, retrying in {} ms. Error: {}",
				attempt,
				operation,
				delay.toMillis(),
				describe(error));
	}

	@Override
	public void reportRetriesExhausted(String operation, int attempts, Throwable error) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.withThrowable(error)
			.log("Retries exhausted for operation [{}] after {} attempts. Error: {}",
				operation,
				attempts,
				describe(error));
	}

	@Override
	public void reportUnretryable(String operation, int attempt, Throwable error) {
		logger.atWarn()
			.withMarker(RETRY_ABORTED_MARKER)
			.withThrowable(error)
			.log("Attempt {} of operation [{}] failed with an unretryable error: {}",
				attempt,
				operation,
				describe(error));
	}

	@Override
	public void reportCancelled(String operation, int attempts, Throwable error) {
		logger.atDebug()
			.withMarker(RETRY_CANCELLED_MARKER)
			.log("Operation [{}] cancelled after {} attempts: {}",
				operation,
				attempts,
				describe(error));
	}

	private static String describe(Throwable error) {
		String message = error.getMessage();
		return message != null
				? error.getClass().getSimpleName() + ": " + message
				: error.getClass().getName();
	}
}
