package org.javai.status.log;

/**
 * Receives severity-tagged records from the fatal-check machinery.
 *
 * <p>Implementations must be safe to call from several threads at once; the
 * checking code adds no locking of its own around {@link #emit}.</p>
 */
@FunctionalInterface
public interface LogSink {

    /**
     * Emits one record.
     *
     * @param severity the record's severity
     * @param message the message
     * @param location the call site the record originates from
     */
    void emit(LogSeverity severity, String message, SourceLocation location);

    /**
     * A sink that discards everything. Useful for testing.
     */
    static LogSink noOp() {
        return (severity, message, location) -> {};
    }

    /**
     * Creates a sink that fans out to all given sinks.
     *
     * @param sinks the sinks to delegate to
     * @return a composite sink
     */
    static LogSink composite(LogSink... sinks) {
        return CompositeLogSink.of(sinks);
    }
}
