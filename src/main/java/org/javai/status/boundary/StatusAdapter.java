package org.javai.status.boundary;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.status.AStatusOrElse;
import org.javai.status.Status;
import org.javai.status.StatusCode;
import org.javai.status.check.Check;

/**
 * Adapts code that reports failure by throwing to the {@link AStatusOrElse} contract.
 *
 * <p>This is the single point where exceptions are translated into statuses. The work
 * runs unchanged; a normal return (a value, or a status the work built itself) passes
 * through as is, and any {@link Exception} it throws is caught, mapped to a
 * {@link StatusCode} by the configured {@link StatusCodeMapper} and returned as a
 * failing {@link Status} whose message is the exception's description.</p>
 *
 * <p>{@link Error}s are not caught. This includes the termination of a failed
 * {@link Check}, which must never turn into a status.</p>
 *
 * <p>The adapter holds no mutable state, adds no logging and never retries;
 * a single instance can be shared by any number of threads.</p>
 *
 * <pre>{@code
 * StatusAdapter adapter = StatusAdapter.withDefaults();
 *
 * BiFunction<Integer, Integer, AStatusOrElse<Float>> safeDivide = adapter.adapt(Calculator::divide);
 * StatusOr<Float> quotient = StatusOr.of(safeDivide.apply(5, 0));   // ZERO_DIVISION
 *
 * Status deleted = adapter.run(() -> Files.delete(path));
 * }</pre>
 */
public final class StatusAdapter {

    private static final StatusAdapter DEFAULT = new StatusAdapter(ExceptionMappingTable.defaults(), true);

    private final StatusCodeMapper mapper;
    private final boolean includeStackTrace;

    /**
     * Returns an adapter using {@link ExceptionMappingTable#defaults()} that records
     * stack traces in the status payload.
     */
    public static StatusAdapter withDefaults() {
        return DEFAULT;
    }

    public static StatusAdapter of(StatusCodeMapper mapper) {
        return new StatusAdapter(mapper, true);
    }

    public static StatusAdapter of(StatusCodeMapper mapper, boolean includeStackTrace) {
        return new StatusAdapter(mapper, includeStackTrace);
    }

    public StatusAdapter(StatusCodeMapper mapper, boolean includeStackTrace) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.includeStackTrace = includeStackTrace;
    }

    /**
     * Runs work that already honors the {@link AStatusOrElse} contract on its normal
     * paths but may still throw.
     *
     * @param work The work to execute
     * @return the work's own result, or a failure describing what it threw
     */
    public <T> AStatusOrElse<T> call(ThrowingSupplier<AStatusOrElse<T>, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        AStatusOrElse<T> result;
        try {
            result = work.get();
        } catch (Exception e) {
            return AStatusOrElse.fail(toStatus(e));
        }
        Check.check(result != null, "adapted function returned null instead of a value or a status");
        return result;
    }

    /**
     * Runs work that returns a plain value on success.
     *
     * @param work The work to execute
     * @return Ok with the value, or a failure describing what the work threw
     */
    public <T> AStatusOrElse<T> callValue(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return call(() -> AStatusOrElse.ok(work.get()));
    }

    /**
     * Runs a void operation.
     *
     * @param work The work to execute
     * @return {@link Status#OK}, or a failure describing what the work threw
     */
    public Status run(ThrowingRunnable<? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        try {
            work.run();
            return Status.OK;
        } catch (Exception e) {
            return toStatus(e);
        }
    }

    // Higher-order forms: wrap once, call many times.

    public <T> Supplier<AStatusOrElse<T>> adapt(ThrowingSupplier<AStatusOrElse<T>, ? extends Exception> f) {
        Objects.requireNonNull(f, "f must not be null");
        return () -> call(f);
    }

    public <A, T> Function<A, AStatusOrElse<T>> adapt(ThrowingFunction<A, AStatusOrElse<T>, ? extends Exception> f) {
        Objects.requireNonNull(f, "f must not be null");
        return argument -> call(() -> f.apply(argument));
    }

    public <A, B, T> BiFunction<A, B, AStatusOrElse<T>> adapt(
            ThrowingBiFunction<A, B, AStatusOrElse<T>, ? extends Exception> f) {
        Objects.requireNonNull(f, "f must not be null");
        return (first, second) -> call(() -> f.apply(first, second));
    }

    public Supplier<Status> adaptVoid(ThrowingRunnable<? extends Exception> f) {
        Objects.requireNonNull(f, "f must not be null");
        return () -> run(f);
    }

    private Status toStatus(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        StatusCode code = mapper.codeFor(e);
        Check.check(code != null && !code.isOk(),
                () -> "StatusCodeMapper produced " + code + " for " + e.getClass().getName());
        return Status.fromException(e, code, includeStackTrace);
    }
}
