package org.javai.status.log.slf4j;

import org.javai.status.log.LogSeverity;
import org.javai.status.log.LogSink;
import org.javai.status.log.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Emits records via SLF4J, for applications that route their logging through it.
 *
 * <p>SLF4J has no fatal level: {@code FATAL} records are logged at ERROR with the
 * {@code FATAL} marker so backends can still tell them apart.</p>
 */
public class Slf4jLogSink implements LogSink {

	private static final Marker FATAL_MARKER = MarkerFactory.getMarker("FATAL");

	private final Logger logger;

	/**
	 * Creates a Slf4jLogSink using the default logger name.
	 */
	public Slf4jLogSink() {
		this(LoggerFactory.getLogger("org.javai.status.Check"));
	}

	/**
	 * Creates a Slf4jLogSink with a specific logger instance.
	 *
	 * @param logger the SLF4J logger to use
	 */
	public Slf4jLogSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void emit(LogSeverity severity, String message, SourceLocation location) {
		switch (severity) {
			case FATAL -> logger.error(FATAL_MARKER, "[{}] {}", location, message);
			case ERROR -> logger.error("[{}] {}", location, message);
			case WARNING -> logger.warn("[{}] {}", location, message);
			case INFO -> logger.info("[{}] {}", location, message);
		}
	}
}
