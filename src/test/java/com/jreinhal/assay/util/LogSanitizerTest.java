package com.jreinhal.assay.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("querySummary()")
    class QuerySummaryTest {
        @Test
        @DisplayName("Should return len=0 and id=none for null query")
        void shouldHandleNull() {
            assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,id=none]");
        }

        @Test
        @DisplayName("Should return length and hash, never the text")
        void shouldReturnLengthAndHash() {
            String result = LogSanitizer.querySummary("flexural strength of resin A");
            assertThat(result).startsWith("[len=28,id=").endsWith("]");
            assertThat(result).doesNotContain("flexural");
        }

        @Test
        @DisplayName("Should return consistent hash for same input")
        void shouldBeConsistent() {
            assertThat(LogSanitizer.querySummary("hello")).isEqualTo(LogSanitizer.querySummary("hello"));
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should return empty string for null input")
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }

        @Test
        @DisplayName("Should replace newlines and strip control characters")
        void shouldStripLineBreaksAndControls() {
            assertThat(LogSanitizer.sanitize("line1\r\nline2")).isEqualTo("line1 line2");
            assertThat(LogSanitizer.sanitize("inject\u0000ed")).isEqualTo("injected");
        }

        @Test
        @DisplayName("Should cap long values")
        void shouldCapLength() {
            String result = LogSanitizer.sanitize("x".repeat(500));
            assertThat(result).hasSize(123).endsWith("...");
        }
    }

    @Test
    @DisplayName("scopeSummary() should report only the project count")
    void scopeSummaryReportsCount() {
        assertThat(LogSanitizer.scopeSummary(List.of())).isEqualTo("[projects=0]");
        assertThat(LogSanitizer.scopeSummary(List.of("p1", "p2"))).isEqualTo("[projects=2]");
    }
}
