package org.javai.retry.ops.metrics;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.retry.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event becomes one JSON object, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the operation name, prefixed by an optional namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.FetchUser","attempt":0,"delayMs":1000,"errorType":"java.net.SocketTimeoutException","message":"Read timed out"}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jRetryReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsRetryReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retry.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger LOG = LoggerFactory.getLogger(MetricsRetryReporter.class);

	private final ObjectMapper mapper = new ObjectMapper();
	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, int attempt, Throwable error, Duration delay) {
		ObjectNode event = event("retry_attempt", operation, error);
		event.put("attempt", attempt);
		event.put("delayMs", delay.toMillis());
		emit(event);
	}

	@Override
	public void reportRetriesExhausted(String operation, int attempts, Throwable error) {
		ObjectNode event = event("retry_exhausted", operation, error);
		event.put("totalAttempts", attempts);
		emit(event);
	}

	@Override
	public void reportUnretryable(String operation, int attempt, Throwable error) {
		ObjectNode event = event("retry_aborted", operation, error);
		event.put("attempt", attempt);
		emit(event);
	}

	@Override
	public void reportCancelled(String operation, int attempts, Throwable error) {
		ObjectNode event = event("retry_cancelled", operation, error);
		event.put("totalAttempts", attempts);
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	/**
	 * Renders an event as a single JSON line. Package-private for testing.
	 */
	String toJson(ObjectNode event) throws JsonProcessingException {
		return mapper.writeValueAsString(event);
	}

	private ObjectNode event(String eventType, String operation, Throwable error) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(operation));
		event.put("errorType", error.getClass().getName());
		if (error.getMessage() != null) {
			event.put("message", error.getMessage());
		}
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(toJson(event));
		} catch (JsonProcessingException e) {
			// Reporting must not break the retry loop
			LOG.debug("Dropping {} metrics event", event.path("eventType").asText(), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
