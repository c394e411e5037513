package org.javai.status.examples;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.status.AStatusOrElse;
import org.javai.status.StatusCode;
import org.javai.status.StatusOr;
import org.javai.status.boundary.ExceptionMappingTable;
import org.javai.status.boundary.StatusAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Demonstrates parsing JSON with ObjectMapper through the status adapter.
 */
public class JsonParsingTest {

    record User(String name, int age) {}

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    @Test
    void validJson_parsesSuccessfully() {
        String json = """
            {"name": "Alice", "age": 30}
            """;

        StatusOr<User> user = StatusOr.of(StatusAdapter.withDefaults()
                .callValue(() -> objectMapper.readValue(json, User.class)));

        assertThat(user.ok()).isTrue();
        assertThat(user.val()).isEqualTo(new User("Alice", 30));
    }

    @Test
    void invalidJson_withDefaults_isTreatedAsIoFailure() {
        AStatusOrElse<User> result = StatusAdapter.withDefaults()
                .callValue(() -> objectMapper.readValue("not valid json", User.class));

        assertThat(result.isOk()).isFalse();
        assertThat(result.status().code()).isEqualTo(StatusCode.UNAVAILABLE);
        assertThat(result.status().message()).contains("Unrecognized token");
    }

    @Test
    void invalidJson_withExtendedTable_isInvalidArgument() {
        StatusAdapter adapter = StatusAdapter.of(ExceptionMappingTable.defaults().toBuilder()
                .map(JsonProcessingException.class, StatusCode.INVALID_ARGUMENT)
                .build());

        AStatusOrElse<User> result = adapter.callValue(() -> objectMapper.readValue("not valid json", User.class));

        assertThat(result.status().code()).isEqualTo(StatusCode.INVALID_ARGUMENT);
    }
}
