package org.javai.status;

import java.util.Objects;
import java.util.function.Function;
import org.javai.status.check.Check;

/**
 * The return contract of a function that either produces a value or fails with a {@link Status}.
 * Either {@link Ok} carrying the value, or {@link Fail} carrying a non-OK status.
 *
 * <p>{@link #fold} makes callers handle both arms:</p>
 * <pre>{@code
 * String text = divide(6, 3).fold(
 *     quotient -> "result " + quotient,
 *     status -> "failed: " + status);
 * }</pre>
 *
 * <p>The type is sealed, so {@code instanceof} checks against {@link Ok} and
 * {@link Fail} cover every case:</p>
 * <pre>{@code
 * AStatusOrElse<Float> result = divide(6, 3);
 * if (result instanceof AStatusOrElse.Ok<Float> ok) {
 *     use(ok.value());
 * } else if (result instanceof AStatusOrElse.Fail<Float> fail) {
 *     report(fail.status());
 * }
 * }</pre>
 *
 * <p>A {@code Fail} built from an OK status violates the contract and fails the
 * fatal check: absence of a value is expressed only by a failing status.</p>
 *
 * @param <T> The type of the successful value
 */
public sealed interface AStatusOrElse<T> permits AStatusOrElse.Ok, AStatusOrElse.Fail {

    /**
     * The success arm.
     *
     * @param value the produced value
     */
    record Ok<T>(T value) implements AStatusOrElse<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Status status() {
            return Status.OK;
        }

        @Override
        public StatusOr<T> toStatusOr() {
            return StatusOr.of(value);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Status, ? extends R> onFail) {
            Objects.requireNonNull(onOk, "onOk must not be null");
            return onOk.apply(value);
        }
    }

    /**
     * The failure arm.
     *
     * @param status the failing status, never OK
     */
    record Fail<T>(Status status) implements AStatusOrElse<T> {

        public Fail {
            Objects.requireNonNull(status, "status must not be null");
            Check.check(!status.ok(), "AStatusOrElse.Fail requires a non-OK status");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public StatusOr<T> toStatusOr() {
            return StatusOr.fromStatus(status);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Status, ? extends R> onFail) {
            Objects.requireNonNull(onFail, "onFail must not be null");
            return onFail.apply(status);
        }
    }

    boolean isOk();

    /**
     * Returns the failing status, or {@link Status#OK} for the success arm.
     */
    Status status();

    /**
     * Wraps this raw return into the uniform {@link StatusOr} handle.
     */
    StatusOr<T> toStatusOr();

    /**
     * Applies {@code onOk} to the value or {@code onFail} to the status, whichever arm this is.
     */
    <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Status, ? extends R> onFail);

    // Static factories
    static <T> AStatusOrElse<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> AStatusOrElse<T> fail(Status status) {
        return new Fail<>(status);
    }
}
