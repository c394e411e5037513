package org.javai.status.log.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.status.log.LogSeverity;
import org.javai.status.log.LogSink;
import org.javai.status.log.SourceLocation;

/**
 * Emits records through Log4j2. This is the sink fatal checks use unless another is configured.
 *
 * <p>Severities map to Log4j levels as follows:
 * <ul>
 *   <li>{@code FATAL} → FATAL</li>
 *   <li>{@code ERROR} → ERROR</li>
 *   <li>{@code WARNING} → WARN</li>
 *   <li>{@code INFO} → INFO</li>
 * </ul>
 *
 * <p>Every record carries the {@code CHECK} marker, and the checked call site is attached
 * as the event's location so layouts using {@code %F:%L} print the caller rather than
 * this class.
 */
public class Log4jLogSink implements LogSink {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.status.Check";

	private static final Marker CHECK_MARKER = MarkerManager.getMarker("CHECK");

	private final Logger logger;

	/**
	 * Creates a Log4jLogSink using the default logger name.
	 */
	public Log4jLogSink() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a Log4jLogSink with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jLogSink(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jLogSink with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jLogSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void emit(LogSeverity severity, String message, SourceLocation location) {
		logger.atLevel(levelFor(severity))
			.withMarker(CHECK_MARKER)
			.withLocation(location.toStackTraceElement())
			.log("[{}] {}", location, message);
	}

	static Level levelFor(LogSeverity severity) {
		return switch (severity) {
			case FATAL -> Level.FATAL;
			case ERROR -> Level.ERROR;
			case WARNING -> Level.WARN;
			case INFO -> Level.INFO;
		};
	}
}
