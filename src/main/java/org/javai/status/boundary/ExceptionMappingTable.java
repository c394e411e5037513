package org.javai.status.boundary;

import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.StreamCorruptedException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.zip.DataFormatException;
import java.util.zip.ZipException;
import org.javai.status.StatusCode;

/**
 * An explicit lookup table from exception types to {@link StatusCode}s.
 *
 * <p>Lookup starts at the thrown exception's own class and walks up its superclass
 * chain. At each class, the rules registered for exactly that class are tried in
 * registration order; the first class with a matching rule decides the code. A rule
 * may carry a predicate to refine by message or cause, e.g. to tell a division by
 * zero apart from other {@link ArithmeticException}s. If no class in the chain
 * matches, the fallback code ({@link StatusCode#UNKNOWN} by default) is returned.</p>
 *
 * <p>Tables are immutable. Extend the defaults through {@link #toBuilder()}:</p>
 * <pre>{@code
 * ExceptionMappingTable table = ExceptionMappingTable.defaults().toBuilder()
 *     .map(QuotaExceededException.class, StatusCode.RESOURCE_EXHAUSTED)
 *     .build();
 * }</pre>
 */
public final class ExceptionMappingTable implements StatusCodeMapper {

    private static final ExceptionMappingTable DEFAULTS = createDefaults();

    private final Map<Class<? extends Throwable>, List<Rule>> rules;
    private final StatusCode fallback;

    private ExceptionMappingTable(Map<Class<? extends Throwable>, List<Rule>> rules, StatusCode fallback) {
        Map<Class<? extends Throwable>, List<Rule>> copy = new LinkedHashMap<>();
        rules.forEach((type, typeRules) -> copy.put(type, List.copyOf(typeRules)));
        this.rules = copy;
        this.fallback = fallback;
    }

    /**
     * Returns the table covering common JDK exceptions.
     */
    public static ExceptionMappingTable defaults() {
        return DEFAULTS;
    }

    /**
     * Returns an empty builder: every exception maps to the fallback until rules are added.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder().fallback(fallback);
        rules.forEach((type, typeRules) -> builder.rules
                .computeIfAbsent(type, ignored -> new ArrayList<>())
                .addAll(typeRules));
        return builder;
    }

    @Override
    public StatusCode codeFor(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        for (Class<?> type = throwable.getClass(); type != null; type = type.getSuperclass()) {
            List<Rule> typeRules = rules.get(type);
            if (typeRules == null) {
                continue;
            }
            for (Rule rule : typeRules) {
                if (rule.condition().test(throwable)) {
                    return rule.code();
                }
            }
        }
        return fallback;
    }

    public StatusCode fallback() {
        return fallback;
    }

    /**
     * Returns true if the exception describes an arithmetic division by zero. The JDK
     * reports these as plain {@link ArithmeticException}s, distinguishable only by message.
     */
    public static boolean isDivisionByZero(Throwable t) {
        String message = t.getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("by zero") || normalized.contains("division undefined");
    }

    private static ExceptionMappingTable createDefaults() {
        return builder()
                // Arithmetic
                .map(ArithmeticException.class, ExceptionMappingTable::isDivisionByZero, StatusCode.ZERO_DIVISION)
                .map(ArithmeticException.class, StatusCode.OUT_OF_RANGE)
                // Argument and state errors
                .map(IllegalArgumentException.class, StatusCode.INVALID_ARGUMENT)
                .map(IllegalStateException.class, StatusCode.FAILED_PRECONDITION)
                .map(IndexOutOfBoundsException.class, StatusCode.OUT_OF_RANGE)
                .map(NoSuchElementException.class, StatusCode.NOT_FOUND)
                .map(UnsupportedOperationException.class, StatusCode.UNIMPLEMENTED)
                .map(NullPointerException.class, StatusCode.INTERNAL)
                .map(ClassCastException.class, StatusCode.INTERNAL)
                .map(ConcurrentModificationException.class, StatusCode.ABORTED)
                .map(SecurityException.class, StatusCode.PERMISSION_DENIED)
                // File system
                .map(FileNotFoundException.class, StatusCode.NOT_FOUND)
                .map(NoSuchFileException.class, StatusCode.NOT_FOUND)
                .map(FileAlreadyExistsException.class, StatusCode.ALREADY_EXISTS)
                .map(AccessDeniedException.class, StatusCode.PERMISSION_DENIED)
                .map(NotDirectoryException.class, StatusCode.FAILED_PRECONDITION)
                .map(DirectoryNotEmptyException.class, StatusCode.FAILED_PRECONDITION)
                .map(EOFException.class, StatusCode.OUT_OF_RANGE)
                // Corrupt data
                .map(StreamCorruptedException.class, StatusCode.DATA_LOSS)
                .map(ZipException.class, StatusCode.DATA_LOSS)
                .map(DataFormatException.class, StatusCode.DATA_LOSS)
                // Network
                .map(SocketTimeoutException.class, StatusCode.DEADLINE_EXCEEDED)
                .map(HttpTimeoutException.class, StatusCode.DEADLINE_EXCEEDED)
                .map(ConnectException.class, StatusCode.UNAVAILABLE)
                .map(UnknownHostException.class, StatusCode.UNAVAILABLE)
                // General IO: most likely transient
                .map(IOException.class, StatusCode.UNAVAILABLE)
                .map(UncheckedIOException.class, StatusCode.UNAVAILABLE)
                // Concurrency
                .map(TimeoutException.class, StatusCode.DEADLINE_EXCEEDED)
                .map(InterruptedException.class, StatusCode.CANCELLED)
                .map(CancellationException.class, StatusCode.CANCELLED)
                .map(RejectedExecutionException.class, StatusCode.RESOURCE_EXHAUSTED)
                .fallback(StatusCode.UNKNOWN)
                .build();
    }

    private record Rule(Predicate<Throwable> condition, StatusCode code) {
    }

    public static final class Builder {
        private final Map<Class<? extends Throwable>, List<Rule>> rules = new LinkedHashMap<>();
        private StatusCode fallback = StatusCode.UNKNOWN;

        private Builder() {}

        /**
         * Maps every exception of exactly {@code type} (and of subclasses without a
         * closer mapping) to {@code code}.
         */
        public Builder map(Class<? extends Throwable> type, StatusCode code) {
            return map(type, t -> true, code);
        }

        /**
         * Maps exceptions of {@code type} that satisfy {@code condition} to {@code code}.
         * Rules for the same type are tried in the order they were added.
         */
        public Builder map(Class<? extends Throwable> type, Predicate<Throwable> condition, StatusCode code) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
            rules.computeIfAbsent(type, ignored -> new ArrayList<>())
                    .add(new Rule(condition, requireFailure(code)));
            return this;
        }

        /**
         * Removes all rules registered for exactly {@code type}, so they can be replaced.
         */
        public Builder unmap(Class<? extends Throwable> type) {
            rules.remove(Objects.requireNonNull(type, "type must not be null"));
            return this;
        }

        /**
         * Sets the code for exceptions no rule matches.
         */
        public Builder fallback(StatusCode code) {
            this.fallback = requireFailure(code);
            return this;
        }

        public ExceptionMappingTable build() {
            return new ExceptionMappingTable(rules, fallback);
        }

        private static StatusCode requireFailure(StatusCode code) {
            Objects.requireNonNull(code, "code must not be null");
            if (code.isOk()) {
                throw new IllegalArgumentException("exceptions cannot map to " + StatusCode.OK);
            }
            return code;
        }
    }
}
