package org.javai.status;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.status.boundary.ExceptionMappingTable;

/**
 * The outcome of an operation: either success ({@link StatusCode#OK}) or a failure
 * described by a code, a human-readable message and an optional payload.
 *
 * <p>Functions that can fail in a recoverable way return a {@code Status} (or an
 * {@link AStatusOrElse}) instead of throwing. Callers branch on {@link #ok()}, which
 * only ever inspects the code.
 *
 * <p>Statuses are immutable and compare by code and message.
 *
 * @param code the status code
 * @param message a human-readable description, empty when there is nothing to say
 * @param payload additional key-value detail, such as the type of a translated exception
 */
public record Status(StatusCode code, String message, Map<String, String> payload) {

    /** Payload key holding the class name of the exception a status was built from. */
    public static final String EXCEPTION_TYPE = "exception.type";

    /** Payload key holding the formatted stack trace of the exception a status was built from. */
    public static final String EXCEPTION_STACK_TRACE = "exception.stackTrace";

    /** The success status. */
    public static final Status OK = new Status(StatusCode.OK, "", Map.of());

    public Status {
        Objects.requireNonNull(code, "code must not be null");
        message = message == null ? "" : message;
        if (payload == null) {
            payload = Map.of();
        } else {
            payload.forEach((key, value) -> {
                Objects.requireNonNull(key, "payload keys must not be null");
                Objects.requireNonNull(value, () -> "payload value for '" + key + "' must not be null");
            });
            payload = Map.copyOf(payload);
        }
    }

    /**
     * Creates a success status, equal to {@link #OK}.
     */
    public Status() {
        this(StatusCode.OK, "", Map.of());
    }

    public Status(StatusCode code, String message) {
        this(code, message, Map.of());
    }

    /**
     * Returns true iff the code is {@link StatusCode#OK}. The message is not consulted.
     */
    public boolean ok() {
        return code == StatusCode.OK;
    }

    /**
     * Looks up a single payload entry.
     *
     * @param key the payload key
     * @return the value, or empty if the payload has no such key
     */
    public Optional<String> payload(String key) {
        return Optional.ofNullable(payload.get(key));
    }

    /**
     * Returns a copy of this status with one more payload entry.
     */
    public Status withPayload(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, String> extended = new HashMap<>(payload);
        extended.put(key, value);
        return new Status(code, message, extended);
    }

    /**
     * Compares code and message. The payload is diagnostic detail and takes no part in equality.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Status other)) {
            return false;
        }
        return code == other.code && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        if (ok()) {
            return "OK";
        }
        return message.isEmpty() ? code.name() : code.name() + ": " + message;
    }

    // === Factories ===

    public static Status okStatus() {
        return OK;
    }

    public static Status fromStatusCode(StatusCode code) {
        return new Status(code, "");
    }

    /**
     * Creates a status from a code and message.
     *
     * <p>No validation is performed: an {@code OK} code with a message is legal and
     * still reports {@link #ok()}.
     */
    public static Status fromStatusCode(StatusCode code, String message) {
        return new Status(code, message);
    }

    /**
     * Creates a failure status from an exception, mapping its type through
     * {@link ExceptionMappingTable#defaults()} and recording its stack trace.
     */
    public static Status fromException(Throwable t) {
        return fromException(t, true);
    }

    public static Status fromException(Throwable t, boolean includeStackTrace) {
        Objects.requireNonNull(t, "throwable must not be null");
        return fromException(t, ExceptionMappingTable.defaults().codeFor(t), includeStackTrace);
    }

    /**
     * Creates a status for an exception whose code has already been determined.
     *
     * @param t the exception
     * @param code the code to attach
     * @param includeStackTrace whether to record the formatted stack trace in the payload
     * @return a status whose message is the exception's message, or its class name if it has none
     */
    public static Status fromException(Throwable t, StatusCode code, boolean includeStackTrace) {
        Objects.requireNonNull(t, "throwable must not be null");
        Map<String, String> payload = new HashMap<>();
        payload.put(EXCEPTION_TYPE, t.getClass().getName());
        if (includeStackTrace) {
            payload.put(EXCEPTION_STACK_TRACE, formatStackTrace(t));
        }
        return new Status(code, describe(t), payload);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    private static String formatStackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    // === Canonical errors ===

    public static Status cancelledError(String message) {
        return new Status(StatusCode.CANCELLED, message);
    }

    public static Status unknownError(String message) {
        return new Status(StatusCode.UNKNOWN, message);
    }

    public static Status invalidArgumentError(String message) {
        return new Status(StatusCode.INVALID_ARGUMENT, message);
    }

    public static Status deadlineExceededError(String message) {
        return new Status(StatusCode.DEADLINE_EXCEEDED, message);
    }

    public static Status notFoundError(String message) {
        return new Status(StatusCode.NOT_FOUND, message);
    }

    public static Status alreadyExistsError(String message) {
        return new Status(StatusCode.ALREADY_EXISTS, message);
    }

    public static Status permissionDeniedError(String message) {
        return new Status(StatusCode.PERMISSION_DENIED, message);
    }

    public static Status resourceExhaustedError(String message) {
        return new Status(StatusCode.RESOURCE_EXHAUSTED, message);
    }

    public static Status failedPreconditionError(String message) {
        return new Status(StatusCode.FAILED_PRECONDITION, message);
    }

    public static Status abortedError(String message) {
        return new Status(StatusCode.ABORTED, message);
    }

    public static Status outOfRangeError(String message) {
        return new Status(StatusCode.OUT_OF_RANGE, message);
    }

    public static Status unimplementedError(String message) {
        return new Status(StatusCode.UNIMPLEMENTED, message);
    }

    public static Status internalError(String message) {
        return new Status(StatusCode.INTERNAL, message);
    }

    public static Status unavailableError(String message) {
        return new Status(StatusCode.UNAVAILABLE, message);
    }

    public static Status dataLossError(String message) {
        return new Status(StatusCode.DATA_LOSS, message);
    }

    public static Status unauthenticatedError(String message) {
        return new Status(StatusCode.UNAUTHENTICATED, message);
    }

    public static Status zeroDivisionError(String message) {
        return new Status(StatusCode.ZERO_DIVISION, message);
    }
}
