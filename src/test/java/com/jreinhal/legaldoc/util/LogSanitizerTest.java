package com.jreinhal.legaldoc.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("querySummary()")
    class QuerySummaryTest {
        @Test
        @DisplayName("Should return zero length and no id for null query")
        void shouldHandleNull() {
            assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,terms=0,id=none]");
        }

        @Test
        @DisplayName("Should never contain the query text")
        void shouldNotLeakQueryText() {
            String result = LogSanitizer.querySummary("Can my landlord evict me under Section 21?");
            assertThat(result).startsWith("[len=42,terms=").endsWith("]");
            assertThat(result).doesNotContain("landlord", "Section");
        }

        @Test
        @DisplayName("Should return the same summary for the same query")
        void shouldBeConsistent() {
            assertThat(LogSanitizer.querySummary("Article 21"))
                    .isEqualTo(LogSanitizer.querySummary("Article 21"));
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
        @DisplayName("Should keep a filename unchanged")
        void shouldPassThroughNormalText() {
            assertThat(LogSanitizer.sanitize("constitution-2024.pdf")).isEqualTo("constitution-2024.pdf");
        }

        @Test
        @DisplayName("Should flatten line breaks so a value cannot start a new log line")
        void shouldReplaceNewlines() {
            assertThat(LogSanitizer.sanitize("conv-1\r\nINFO forged")).isEqualTo("conv-1 INFO forged");
        }

        @Test
        @DisplayName("Should strip control characters")
        void shouldStripControlChars() {
            assertThat(LogSanitizer.sanitize("inject\u0000ed")).isEqualTo("injected");
            assertThat(LogSanitizer.sanitize("esc\u001B[31mred")).isEqualTo("esc[31mred");
        }

        @Test
        @DisplayName("Should cap long values")
        void shouldTruncate() {
            String longMessage = "x".repeat(500);
            assertThat(LogSanitizer.sanitize(longMessage)).hasSize(203).endsWith("...");
        }
    }
}
