package org.javai.retry.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.javai.retry.ops.CapturingAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.*;

class Log4jRetryReporterTest {

	private static final String LOGGER_NAME = "test.retry.log4j";

	private CapturingAppender appender;
	private Log4jRetryReporter reporter;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attachTo(LOGGER_NAME);
		reporter = new Log4jRetryReporter(LOGGER_NAME);
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void reportRetryAttempt_logsInfoWithRetryMarker() {
		reporter.reportRetryAttempt("FetchUser", 1, new SocketTimeoutException("Read timed out"), Duration.ofMillis(1500));

		LogEvent event = singleEvent();
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMarker()).isEqualTo(Log4jRetryReporter.RETRY_MARKER);
		assertThat(event.getMessage().getFormattedMessage())
				.contains("Attempt 1")
				.contains("[FetchUser]")
				.contains("1500 ms")
				.contains("SocketTimeoutException: Read timed out");
	}

	@Test
	void reportRetriesExhausted_logsWarnWithThrowable() {
		IOException error = new IOException("down");

		reporter.reportRetriesExhausted("FetchUser", 3, error);

		LogEvent event = singleEvent();
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker()).isEqualTo(Log4jRetryReporter.RETRY_EXHAUSTED_MARKER);
		assertThat(event.getThrown()).isSameAs(error);
		assertThat(event.getMessage().getFormattedMessage()).contains("after 3 attempts");
	}

	@Test
	void reportUnretryable_logsWarnWithAbortedMarker() {
		reporter.reportUnretryable("FetchUser", 0, new IllegalArgumentException("bad id"));

		LogEvent event = singleEvent();
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker()).isEqualTo(Log4jRetryReporter.RETRY_ABORTED_MARKER);
		assertThat(event.getMessage().getFormattedMessage()).contains("unretryable").contains("bad id");
	}

	@Test
	void reportCancelled_logsDebug() {
		reporter.reportCancelled("FetchUser", 2, new CancellationException("shutdown"));

		LogEvent event = singleEvent();
		assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
		assertThat(event.getMarker()).isEqualTo(Log4jRetryReporter.RETRY_CANCELLED_MARKER);
		assertThat(event.getMessage().getFormattedMessage()).contains("cancelled after 2 attempts");
	}

	@Test
	void errorWithoutMessage_usesClassName() {
		reporter.reportUnretryable("Op", 0, new IllegalStateException());

		assertThat(singleEvent().getMessage().getFormattedMessage()).contains("java.lang.IllegalStateException");
	}

	private LogEvent singleEvent() {
		assertThat(appender.events()).hasSize(1);
		return appender.events().get(0);
	}
}
