package org.javai.status.log;

/**
 * Severity of a record handed to a {@link LogSink}.
 */
public enum LogSeverity {
    /** Progress of the application. */
    INFO,

    /** A potentially harmful situation. */
    WARNING,

    /** An error the application may survive. */
    ERROR,

    /** A violated invariant; the process terminates after the record is emitted. */
    FATAL
}
