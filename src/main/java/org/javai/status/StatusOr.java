package org.javai.status;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.status.check.Check;

/**
 * Holds either a value of type {@code T} or a non-OK {@link Status} explaining why
 * there is no value. Never both.
 *
 * <p>Check {@link #ok()} before calling {@link #val()}. Reading the value of a failed
 * {@code StatusOr} is a programming error and terminates the process through
 * {@link Check}; it is never reported as a recoverable status.</p>
 *
 * <pre>{@code
 * StatusOr<Float> quotient = StatusOr.of(divide(1, 0));
 * if (quotient.ok()) {
 *     System.out.println(quotient.val());
 * } else {
 *     System.out.println(quotient.status());
 * }
 * }</pre>
 *
 * <p>A {@code null} value is allowed and still counts as success.</p>
 *
 * @param <T> The type of the held value
 */
public final class StatusOr<T> {

    private final T value;
    private final Status status;

    private StatusOr(T value, Status status) {
        this.value = value;
        this.status = status;
    }

    /**
     * Creates a successful {@code StatusOr} holding a value.
     */
    public static <T> StatusOr<T> of(T value) {
        return new StatusOr<>(value, Status.OK);
    }

    /**
     * Creates a failed {@code StatusOr}. Passing an OK status fails the fatal check.
     */
    public static <T> StatusOr<T> of(Status status) {
        return fromStatus(status);
    }

    /**
     * Wraps the raw return of a function honoring the {@link AStatusOrElse} contract.
     */
    public static <T> StatusOr<T> of(AStatusOrElse<T> valueOrStatus) {
        Objects.requireNonNull(valueOrStatus, "valueOrStatus must not be null");
        return valueOrStatus.toStatusOr();
    }

    public static <T> StatusOr<T> fromStatus(Status status) {
        Objects.requireNonNull(status, "status must not be null");
        Check.check(!status.ok(), "StatusOr cannot be constructed from an OK status; use StatusOr.of(value)");
        return new StatusOr<>(null, status);
    }

    /**
     * Creates a failed {@code StatusOr} from an exception, see {@link Status#fromException(Throwable)}.
     */
    public static <T> StatusOr<T> fromException(Throwable t) {
        return fromStatus(Status.fromException(t));
    }

    public boolean ok() {
        return status.ok();
    }

    /**
     * Returns the held value.
     *
     * <p>Precondition: {@link #ok()}. Violating it terminates the process.</p>
     */
    public T val() {
        Check.check(ok(), () -> "StatusOr.val() called on a failed StatusOr: " + status);
        return value;
    }

    /**
     * Returns the failing status, or {@link Status#OK} when a value is present.
     */
    public Status status() {
        return status;
    }

    public T valueOr(T defaultValue) {
        return ok() ? value : defaultValue;
    }

    public T valueOrGet(Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier);
        return ok() ? value : supplier.get();
    }

    public <U> StatusOr<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        if (!ok()) {
            return new StatusOr<>(null, status);
        }
        return new StatusOr<>(mapper.apply(value), Status.OK);
    }

    public <U> StatusOr<U> flatMap(Function<? super T, StatusOr<U>> mapper) {
        Objects.requireNonNull(mapper);
        if (!ok()) {
            return new StatusOr<>(null, status);
        }
        return Objects.requireNonNull(mapper.apply(value), "mapper returned null");
    }

    /**
     * Converts back to the sealed return contract.
     */
    public AStatusOrElse<T> toStatusOrElse() {
        return ok() ? AStatusOrElse.ok(value) : AStatusOrElse.fail(status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatusOr<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && status.equals(other.status);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, status);
    }

    @Override
    public String toString() {
        return ok() ? "StatusOr[" + value + "]" : "StatusOr[" + status + "]";
    }
}
