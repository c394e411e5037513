package org.javai.status.check;

import java.util.Objects;
import java.util.function.Supplier;
import org.javai.status.log.LogSeverity;
import org.javai.status.log.LogSink;
import org.javai.status.log.SourceLocation;
import org.javai.status.log.log4j.Log4jLogSink;

/**
 * Evaluates invariants and terminates the process when one does not hold.
 *
 * <p>A failed check emits exactly one {@link LogSeverity#FATAL} record, carrying the
 * message and the call site, to the configured {@link LogSink} and then hands control
 * to the {@link Terminator}. The transition is irreversible: a failed check never
 * returns to its caller and is never turned into a {@link org.javai.status.Status}.</p>
 *
 * <p>Instances are immutable and may be shared between threads. Concurrent failures
 * rely on the sink to serialise their records.</p>
 *
 * <pre>{@code
 * Check.install(FatalChecker.builder()
 *     .sink(new Slf4jLogSink())
 *     .exitCode(70)
 *     .build());
 * }</pre>
 */
public final class FatalChecker {

    public static final int DEFAULT_EXIT_CODE = 1;

    /**
     * System property that turns debug checks on or off ({@code true}/{@code false}).
     * When absent, debug checks run iff assertions are enabled for this package.
     */
    public static final String DEBUG_CHECKS_PROPERTY = "org.javai.status.debugChecks";

    private final LogSink sink;
    private final Terminator terminator;
    private final int exitCode;
    private final boolean debugChecks;

    private FatalChecker(LogSink sink, Terminator terminator, int exitCode, boolean debugChecks) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.terminator = Objects.requireNonNull(terminator, "terminator must not be null");
        this.exitCode = exitCode;
        this.debugChecks = debugChecks;
    }

    /**
     * Creates a checker logging through {@link Log4jLogSink} and exiting with status 1.
     */
    public static FatalChecker defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Does nothing if {@code condition} holds; otherwise fails with {@code message}.
     */
    public void check(boolean condition, String message) {
        if (!condition) {
            fail(message, SourceLocation.capture());
        }
    }

    /**
     * Like {@link #check(boolean, String)}, building the message only on failure.
     */
    public void check(boolean condition, Supplier<String> message) {
        if (!condition) {
            fail(message.get(), SourceLocation.capture());
        }
    }

    /**
     * Fails unconditionally at the caller's location.
     */
    public void fail(String message) {
        fail(message, SourceLocation.capture());
    }

    /**
     * Emits the fatal record and terminates. Does not return.
     *
     * @param message what invariant was violated
     * @param location the call site to report
     */
    public void fail(String message, SourceLocation location) {
        String record = "Check failed: " + (message == null || message.isEmpty() ? "<no message>" : message);
        try {
            sink.emit(LogSeverity.FATAL, record, location);
        } catch (RuntimeException e) {
            // A broken sink must not keep the process alive or hide the reason.
            System.err.println("FATAL " + location + ": " + record + " (log sink failed: " + e + ")");
        } finally {
            // Runs even when the sink throws an Error.
            terminator.terminate(exitCode);
            Runtime.getRuntime().halt(exitCode);
        }
    }

    public boolean debugChecksEnabled() {
        return debugChecks;
    }

    public LogSink sink() {
        return sink;
    }

    public Terminator terminator() {
        return terminator;
    }

    public int exitCode() {
        return exitCode;
    }

    public Builder toBuilder() {
        return new Builder()
                .sink(sink)
                .terminator(terminator)
                .exitCode(exitCode)
                .debugChecks(debugChecks);
    }

    private static boolean debugChecksByDefault() {
        String configured = System.getProperty(DEBUG_CHECKS_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return Boolean.parseBoolean(configured.trim());
        }
        return FatalChecker.class.desiredAssertionStatus();
    }

    public static final class Builder {
        private LogSink sink;
        private Terminator terminator = Terminator.exit();
        private int exitCode = DEFAULT_EXIT_CODE;
        private Boolean debugChecks;

        private Builder() {}

        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            return this;
        }

        public Builder terminator(Terminator terminator) {
            this.terminator = Objects.requireNonNull(terminator, "terminator must not be null");
            return this;
        }

        public Builder exitCode(int exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder debugChecks(boolean enabled) {
            this.debugChecks = enabled;
            return this;
        }

        public FatalChecker build() {
            return new FatalChecker(
                    sink != null ? sink : new Log4jLogSink(),
                    terminator,
                    exitCode,
                    debugChecks != null ? debugChecks : debugChecksByDefault());
        }
    }
}
