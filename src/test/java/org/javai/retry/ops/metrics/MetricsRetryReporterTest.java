package org.javai.retry.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.retry.ops.CapturingAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.*;

class MetricsRetryReporterTest {

	private static final String LOGGER_NAME = "test.retry.metrics";
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private final ObjectMapper mapper = new ObjectMapper();
	private CapturingAppender appender;
	private MetricsRetryReporter reporter;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attachTo(LOGGER_NAME);
		reporter = new MetricsRetryReporter(null, LoggerFactory.getLogger(LOGGER_NAME), CLOCK);
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void reportRetryAttempt_emitsJsonLine() throws Exception {
		reporter.reportRetryAttempt("FetchUser", 2, new SocketTimeoutException("Read timed out"), Duration.ofMillis(1500));

		JsonNode json = singleJson();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("FetchUser");
		assertThat(json.get("attempt").asInt()).isEqualTo(2);
		assertThat(json.get("delayMs").asLong()).isEqualTo(1500L);
		assertThat(json.get("errorType").asText()).isEqualTo("java.net.SocketTimeoutException");
		assertThat(json.get("message").asText()).isEqualTo("Read timed out");
	}

	@Test
	void reportRetriesExhausted_emitsTotalAttempts() throws Exception {
		reporter.reportRetriesExhausted("FetchUser", 3, new IOException("down"));

		JsonNode json = singleJson();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(3);
	}

	@Test
	void reportUnretryable_and_reportCancelled_emitEvents() throws Exception {
		reporter.reportUnretryable("FetchUser", 0, new IllegalArgumentException());
		reporter.reportCancelled("FetchUser", 4, new CancellationException("stop"));

		assertThat(appender.messages()).hasSize(2);
		JsonNode aborted = mapper.readTree(appender.messages().get(0));
		JsonNode cancelled = mapper.readTree(appender.messages().get(1));
		assertThat(aborted.get("eventType").asText()).isEqualTo("retry_aborted");
		assertThat(aborted.has("message")).isFalse();
		assertThat(cancelled.get("eventType").asText()).isEqualTo("retry_cancelled");
		assertThat(cancelled.get("totalAttempts").asInt()).isEqualTo(4);
	}

	@Test
	void namespace_prependsToTrackingKey() {
		MetricsRetryReporter namespaced = new MetricsRetryReporter(" myapp ", LoggerFactory.getLogger(LOGGER_NAME), CLOCK);

		assertThat(namespaced.buildTrackingKey("order.fetch")).isEqualTo("myapp.order.fetch");
	}

	@Test
	void blankNamespace_isIgnored() {
		MetricsRetryReporter blank = new MetricsRetryReporter("  ", LoggerFactory.getLogger(LOGGER_NAME), CLOCK);

		assertThat(blank.buildTrackingKey("order.fetch")).isEqualTo("order.fetch");
	}

	@Test
	void specialCharacters_areEscaped() throws Exception {
		reporter.reportRetriesExhausted("Op", 1, new IOException("quote \" and\nnewline"));

		String line = appender.messages().get(0);
		assertThat(line).doesNotContain("\n");
		assertThat(mapper.readTree(line).get("message").asText()).isEqualTo("quote \" and\nnewline");
	}

	private JsonNode singleJson() throws Exception {
		assertThat(appender.messages()).hasSize(1);
		return mapper.readTree(appender.messages().get(0));
	}
}
