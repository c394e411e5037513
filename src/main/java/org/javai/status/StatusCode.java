package org.javai.status;

import java.util.Optional;

/**
 * The closed set of status codes carried by a {@link Status}.
 *
 * <p>Codes 0 to 16 are the canonical codes shared with gRPC and Abseil, so a
 * status can cross process boundaries without translation. {@link #OK} is the
 * only code that denotes success.
 */
public enum StatusCode {

    /** Not an error; returned on success. */
    OK(0),

    /** The operation was cancelled, typically by the caller. */
    CANCELLED(1),

    /** Unknown error, for example an exception nothing more specific maps to. */
    UNKNOWN(2),

    /** The caller specified an invalid argument, independent of system state. */
    INVALID_ARGUMENT(3),

    /** The deadline expired before the operation could complete. */
    DEADLINE_EXCEEDED(4),

    /** Some requested entity (file, key, row) was not found. */
    NOT_FOUND(5),

    /** The entity a caller attempted to create already exists. */
    ALREADY_EXISTS(6),

    /** The caller is not permitted to execute the operation. */
    PERMISSION_DENIED(7),

    /** Some resource has been exhausted, such as a quota or a queue. */
    RESOURCE_EXHAUSTED(8),

    /** The system is not in a state required for the operation. */
    FAILED_PRECONDITION(9),

    /** The operation was aborted, typically due to a concurrency conflict. */
    ABORTED(10),

    /** The operation was attempted past the valid range. */
    OUT_OF_RANGE(11),

    /** The operation is not implemented or not supported. */
    UNIMPLEMENTED(12),

    /** An invariant expected by the underlying system has been broken. */
    INTERNAL(13),

    /** The service is currently unavailable; the condition is most likely transient. */
    UNAVAILABLE(14),

    /** Unrecoverable data loss or corruption. */
    DATA_LOSS(15),

    /** The request does not have valid authentication credentials. */
    UNAUTHENTICATED(16),

    /** An arithmetic division by zero. */
    ZERO_DIVISION(-1);

    private final int value;

    StatusCode(int value) {
        this.value = value;
    }

    /**
     * Returns the numeric value of this code.
     */
    public int value() {
        return value;
    }

    public boolean isOk() {
        return this == OK;
    }

    /**
     * Looks up the code for a numeric value.
     *
     * @param value the numeric value
     * @return the matching code, or empty if no code has that value
     */
    public static Optional<StatusCode> forValue(int value) {
        for (StatusCode code : values()) {
            if (code.value == value) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
