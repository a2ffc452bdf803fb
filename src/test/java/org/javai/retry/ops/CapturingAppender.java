package org.javai.retry.ops;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

/**
 * Collects events logged to a single Log4j2 logger. Shared by the reporter tests.
 */
public final class CapturingAppender extends AbstractAppender {

	private final List<LogEvent> events = new CopyOnWriteArrayList<>();
	private final Logger logger;

	private CapturingAppender(Logger logger) {
		super("capture-" + logger.getName(), null, null, true, Property.EMPTY_ARRAY);
		this.logger = logger;
	}

	/**
	 * Attaches a new appender to the named logger and enables all levels on it.
	 */
	public static CapturingAppender attachTo(String loggerName) {
		Logger logger = (Logger) LogManager.getLogger(loggerName);
		CapturingAppender appender = new CapturingAppender(logger);
		appender.start();
		logger.addAppender(appender);
		logger.setLevel(Level.ALL);
		return appender;
	}

	public void detach() {
		logger.removeAppender(this);
		stop();
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return events;
	}

	public List<String> messages() {
		return events.stream().map(e -> e.getMessage().getFormattedMessage()).toList();
	}
}
