package org.javai.status.check;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Static entry points for fatal invariant checks.
 *
 * <p>{@code check*} methods always evaluate their condition. When it does not hold,
 * the installed {@link FatalChecker} logs one FATAL record and terminates the process.
 * Use them where continuing would be worse than stopping, e.g. when internal state can
 * no longer be trusted. Failures the caller is expected to handle belong in a
 * {@link org.javai.status.Status} instead.</p>
 *
 * <p>{@code dcheck*} methods are debug-only: their conditions are not evaluated at all
 * unless debug checks are enabled, see {@link FatalChecker#DEBUG_CHECKS_PROPERTY}.</p>
 *
 * <pre>{@code
 * Check.check(index >= 0, "index must not be negative");
 * Config config = Check.checkNotNull(loadConfig(), "config");
 * Check.dcheck(() -> isSorted(entries), () -> "entries must be sorted");
 * }</pre>
 */
public final class Check {

    private static volatile FatalChecker checker = FatalChecker.defaults();

    private Check() {
    }

    /**
     * Replaces the checker used by all static checks.
     *
     * @param replacement the new checker
     * @return the previously installed checker
     */
    public static FatalChecker install(FatalChecker replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        FatalChecker previous = checker;
        checker = replacement;
        return previous;
    }

    public static FatalChecker checker() {
        return checker;
    }

    public static void check(boolean condition, String message) {
        checker.check(condition, message);
    }

    public static void check(boolean condition, Supplier<String> message) {
        checker.check(condition, message);
    }

    public static <T> T checkNotNull(T value, String name) {
        if (value == null) {
            checker.fail(name + " must not be null");
        }
        return value;
    }

    public static void checkEq(Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            checker.fail(expected + " is NOT equal to " + actual);
        }
    }

    public static void checkNe(Object first, Object second) {
        if (Objects.equals(first, second)) {
            checker.fail(first + " is equal to " + second);
        }
    }

    /**
     * Fails unconditionally. Marks code that must be unreachable.
     */
    public static void fatal(String message) {
        checker.fail(message);
    }

    // Debug-only

    public static boolean debugChecksEnabled() {
        return checker.debugChecksEnabled();
    }

    public static void dcheck(BooleanSupplier condition, Supplier<String> message) {
        FatalChecker current = checker;
        if (current.debugChecksEnabled() && !condition.getAsBoolean()) {
            current.fail(message.get());
        }
    }

    public static void dcheckEq(Object expected, Object actual) {
        if (checker.debugChecksEnabled()) {
            checkEq(expected, actual);
        }
    }

    public static void dcheckNe(Object first, Object second) {
        if (checker.debugChecksEnabled()) {
            checkNe(first, second);
        }
    }

    public static void dcheckNotNull(Object value, String name) {
        if (checker.debugChecksEnabled()) {
            checkNotNull(value, name);
        }
    }

    /**
     * Debug-only check that {@code value} is the numeric value of one of {@code enumType}'s constants.
     *
     * <pre>{@code
     * Check.dcheckInEnum(wireCode, StatusCode.class, StatusCode::value);
     * }</pre>
     */
    public static <E extends Enum<E>> void dcheckInEnum(int value, Class<E> enumType, ToIntFunction<? super E> valueOf) {
        FatalChecker current = checker;
        if (!current.debugChecksEnabled()) {
            return;
        }
        for (E constant : enumType.getEnumConstants()) {
            if (valueOf.applyAsInt(constant) == value) {
                return;
            }
        }
        current.fail("Value " + value + " is not a valid member of enum " + enumType.getSimpleName());
    }
}
