package io.tiller.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void shouldReturnNullStringForNullInput() {
        assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
    }

    @Test
    void shouldReturnCleanStringUnchanged() {
        assertThat(LogSanitizer.sanitize("session-42")).isEqualTo("session-42");
    }

    @Test
    void shouldReplaceLineBreaks() {
        assertThat(LogSanitizer.sanitize("s1\nINFO forged entry")).isEqualTo("s1_INFO forged entry");
        assertThat(LogSanitizer.sanitize("line1\r\nline2")).isEqualTo("line1__line2");
    }

    @Test
    void shouldTruncateLongValues() {
        String sanitized = LogSanitizer.sanitize("x".repeat(500));

        assertThat(sanitized).hasSize(LogSanitizer.MAX_LENGTH + 3).endsWith("...");
    }

    @Test
    void shouldHandleEmptyString() {
        assertThat(LogSanitizer.sanitize("")).isEqualTo("");
    }
}
