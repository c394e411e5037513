package org.javai.status.log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link LogSink} that delegates to multiple sinks.
 *
 * <p>Every configured sink receives every record. If a sink throws, the failure is
 * written to stderr and the remaining sinks still run, so a broken sink cannot keep
 * a fatal record from reaching the others.</p>
 *
 * <pre>{@code
 * LogSink sink = CompositeLogSink.of(
 *     new Log4jLogSink(),
 *     new Slf4jLogSink()
 * );
 * }</pre>
 */
public final class CompositeLogSink implements LogSink {

	private final List<LogSink> sinks;

	private CompositeLogSink(List<LogSink> sinks) {
		this.sinks = List.copyOf(sinks);
	}

	/**
	 * Creates a composite sink from the given sinks.
	 *
	 * @param sinks the sinks to delegate to
	 * @return a composite that fans out to all given sinks
	 */
	public static CompositeLogSink of(LogSink... sinks) {
		return new CompositeLogSink(Arrays.asList(sinks));
	}

	/**
	 * Creates a composite sink from a collection of sinks.
	 *
	 * @param sinks the sinks to delegate to
	 * @return a composite that fans out to all given sinks
	 */
	public static CompositeLogSink of(Collection<? extends LogSink> sinks) {
		return new CompositeLogSink(new ArrayList<>(sinks));
	}

	@Override
	public void emit(LogSeverity severity, String message, SourceLocation location) {
		for (LogSink sink : sinks) {
			try {
				sink.emit(severity, message, location);
			} catch (Exception e) {
				System.err.println("LogSink.emit failed for " +
					sink.getClass().getName() + ": " + e.getMessage());
			}
		}
	}

	/**
	 * Returns the number of sinks in this composite.
	 */
	public int size() {
		return sinks.size();
	}
}
