package org.javai.status;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StatusTest {

    @Test
    void okStatus_isOk() {
        Status status = Status.okStatus();

        assertThat(status.ok()).isTrue();
        assertThat(status.code()).isEqualTo(StatusCode.OK);
        assertThat(status.message()).isEmpty();
        assertThat(status).isEqualTo(Status.OK);
    }

    @Test
    void defaultConstructor_isOk() {
        assertThat(new Status()).isEqualTo(Status.OK);
        assertThat(new Status().ok()).isTrue();
    }

    @Test
    void fromStatusCode_failure_keepsCodeAndMessage() {
        for (StatusCode code : EnumSet.complementOf(EnumSet.of(StatusCode.OK))) {
            Status status = Status.fromStatusCode(code, "msg");

            assertThat(status.ok()).isFalse();
            assertThat(status.code()).isEqualTo(code);
            assertThat(status.message()).isEqualTo("msg");
        }
    }

    @Test
    void fromStatusCode_okWithMessage_isStillOk() {
        Status status = Status.fromStatusCode(StatusCode.OK, "all good, mostly");

        assertThat(status.ok()).isTrue();
        assertThat(status.message()).isEqualTo("all good, mostly");
    }

    @Test
    void nullMessage_isNormalizedToEmpty() {
        Status status = Status.fromStatusCode(StatusCode.NOT_FOUND, null);

        assertThat(status.message()).isEmpty();
        assertThat(status.payload()).isEmpty();
    }

    @Test
    void equality_isStructural() {
        assertThat(Status.notFoundError("missing"))
                .isEqualTo(Status.fromStatusCode(StatusCode.NOT_FOUND, "missing"))
                .hasSameHashCodeAs(Status.fromStatusCode(StatusCode.NOT_FOUND, "missing"))
                .isNotEqualTo(Status.notFoundError("other"))
                .isNotEqualTo(Status.internalError("missing"));
    }

    @Test
    void equality_ignoresPayload() {
        Status plain = Status.internalError("boom");

        assertThat(plain.withPayload("k", "v"))
                .isEqualTo(plain)
                .hasSameHashCodeAs(plain);
    }

    @Test
    void equality_sameExceptionFromDifferentCallSites_isEqual() {
        Status first = failFromFirstSite();
        Status second = failFromSecondSite();

        assertThat(first.payload(Status.EXCEPTION_STACK_TRACE)).isNotEqualTo(second.payload(Status.EXCEPTION_STACK_TRACE));
        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }

    @Test
    void payloadWithNullValue_isRejectedWithKeyInMessage() {
        Map<String, String> payload = new HashMap<>();
        payload.put("request", null);

        assertThatThrownBy(() -> new Status(StatusCode.INTERNAL, "boom", payload))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("request");
    }

    private static Status failFromFirstSite() {
        return Status.fromException(new IOException("disk error"));
    }

    private static Status failFromSecondSite() {
        return Status.fromException(new IOException("disk error"));
    }

    @Test
    void withPayload_doesNotModifyOriginal() {
        Status original = Status.internalError("boom");

        Status extended = original.withPayload("request", "42");

        assertThat(original.payload()).isEmpty();
        assertThat(extended.payload("request")).contains("42");
        assertThat(extended.payload("missing")).isEmpty();
    }

    @Test
    void payload_isImmutable() {
        Status status = new Status(StatusCode.INTERNAL, "boom", Map.of("a", "b"));

        assertThatThrownBy(() -> status.payload().put("c", "d"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toString_formats() {
        assertThat(Status.OK).hasToString("OK");
        assertThat(Status.invalidArgumentError("List is empty!")).hasToString("INVALID_ARGUMENT: List is empty!");
        assertThat(Status.fromStatusCode(StatusCode.ABORTED)).hasToString("ABORTED");
    }

    @Test
    void canonicalErrorFactories_useMatchingCodes() {
        assertThat(Status.cancelledError("m").code()).isEqualTo(StatusCode.CANCELLED);
        assertThat(Status.unknownError("m").code()).isEqualTo(StatusCode.UNKNOWN);
        assertThat(Status.invalidArgumentError("m").code()).isEqualTo(StatusCode.INVALID_ARGUMENT);
        assertThat(Status.deadlineExceededError("m").code()).isEqualTo(StatusCode.DEADLINE_EXCEEDED);
        assertThat(Status.notFoundError("m").code()).isEqualTo(StatusCode.NOT_FOUND);
        assertThat(Status.alreadyExistsError("m").code()).isEqualTo(StatusCode.ALREADY_EXISTS);
        assertThat(Status.permissionDeniedError("m").code()).isEqualTo(StatusCode.PERMISSION_DENIED);
        assertThat(Status.resourceExhaustedError("m").code()).isEqualTo(StatusCode.RESOURCE_EXHAUSTED);
        assertThat(Status.failedPreconditionError("m").code()).isEqualTo(StatusCode.FAILED_PRECONDITION);
        assertThat(Status.abortedError("m").code()).isEqualTo(StatusCode.ABORTED);
        assertThat(Status.outOfRangeError("m").code()).isEqualTo(StatusCode.OUT_OF_RANGE);
        assertThat(Status.unimplementedError("m").code()).isEqualTo(StatusCode.UNIMPLEMENTED);
        assertThat(Status.internalError("m").code()).isEqualTo(StatusCode.INTERNAL);
        assertThat(Status.unavailableError("m").code()).isEqualTo(StatusCode.UNAVAILABLE);
        assertThat(Status.dataLossError("m").code()).isEqualTo(StatusCode.DATA_LOSS);
        assertThat(Status.unauthenticatedError("m").code()).isEqualTo(StatusCode.UNAUTHENTICATED);
        assertThat(Status.zeroDivisionError("m").code()).isEqualTo(StatusCode.ZERO_DIVISION);
    }

    @Test
    void fromException_mapsTypeAndKeepsDescription() {
        Status status = Status.fromException(new FileNotFoundException("test.txt (No such file or directory)"));

        assertThat(status.ok()).isFalse();
        assertThat(status.code()).isEqualTo(StatusCode.NOT_FOUND);
        assertThat(status.message()).isEqualTo("test.txt (No such file or directory)");
        assertThat(status.payload(Status.EXCEPTION_TYPE)).contains(FileNotFoundException.class.getName());
        assertThat(status.payload(Status.EXCEPTION_STACK_TRACE)).hasValueSatisfying(
                trace -> assertThat(trace).contains("FileNotFoundException"));
    }

    @Test
    void fromException_withoutStackTrace() {
        Status status = Status.fromException(new IllegalStateException("closed"), false);

        assertThat(status.code()).isEqualTo(StatusCode.FAILED_PRECONDITION);
        assertThat(status.payload(Status.EXCEPTION_STACK_TRACE)).isEmpty();
    }

    @Test
    void fromException_withoutMessage_usesClassName() {
        Status status = Status.fromException(new UnsupportedOperationException(), false);

        assertThat(status.code()).isEqualTo(StatusCode.UNIMPLEMENTED);
        assertThat(status.message()).isEqualTo(UnsupportedOperationException.class.getName());
    }
}
