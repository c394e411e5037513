package org.javai.status;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class StatusCodeTest {

    @Test
    void ok_isTheOnlySuccessCode() {
        assertThat(Arrays.stream(StatusCode.values()).filter(StatusCode::isOk))
                .containsExactly(StatusCode.OK);
        assertThat(StatusCode.OK.value()).isZero();
    }

    @Test
    void canonicalCodes_haveCanonicalValues() {
        assertThat(StatusCode.CANCELLED.value()).isEqualTo(1);
        assertThat(StatusCode.INVALID_ARGUMENT.value()).isEqualTo(3);
        assertThat(StatusCode.NOT_FOUND.value()).isEqualTo(5);
        assertThat(StatusCode.INTERNAL.value()).isEqualTo(13);
        assertThat(StatusCode.UNAUTHENTICATED.value()).isEqualTo(16);
        assertThat(StatusCode.ZERO_DIVISION.value()).isEqualTo(-1);
    }

    @Test
    void values_areUnique() {
        Set<Integer> values = Arrays.stream(StatusCode.values())
                .map(StatusCode::value)
                .collect(Collectors.toSet());

        assertThat(values).hasSize(StatusCode.values().length);
    }

    @Test
    void forValue_findsCode() {
        assertThat(StatusCode.forValue(5)).contains(StatusCode.NOT_FOUND);
        assertThat(StatusCode.forValue(-1)).contains(StatusCode.ZERO_DIVISION);
    }

    @Test
    void forValue_unknownValue_isEmpty() {
        assertThat(StatusCode.forValue(999)).isEmpty();
    }
}
