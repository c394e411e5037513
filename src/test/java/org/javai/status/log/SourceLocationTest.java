package org.javai.status.log;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SourceLocationTest {

    @Test
    void capture_returnsCallingFrame() {
        SourceLocation location = SourceLocation.capture();

        assertThat(location.className()).isEqualTo(SourceLocationTest.class.getName());
        assertThat(location.methodName()).isEqualTo("capture_returnsCallingFrame");
        assertThat(location.fileName()).isEqualTo("SourceLocationTest.java");
        assertThat(location.lineNumber()).isPositive();
    }

    @Test
    void toString_isFileAndLine() {
        assertThat(new SourceLocation("a.B", "m", "B.java", 12)).hasToString("B.java:12");
        assertThat(new SourceLocation("a.B", "m", null, -1)).hasToString("a.B");
    }

    @Test
    void toStackTraceElement_carriesAllParts() {
        StackTraceElement element = new SourceLocation("a.B", "m", "B.java", 12).toStackTraceElement();

        assertThat(element.getClassName()).isEqualTo("a.B");
        assertThat(element.getMethodName()).isEqualTo("m");
        assertThat(element.getFileName()).isEqualTo("B.java");
        assertThat(element.getLineNumber()).isEqualTo(12);
    }
}
