package com.phillippitts.callcopilot.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenWithinMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWithEllipsis() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello...");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(103);
    }

    @Test
    void shouldMaskAllButLastFourDigits() {
        assertThat(LogSanitizer.maskPhone("+919812341234")).isEqualTo("***1234");
        assertThat(LogSanitizer.maskPhone("+1 (555) 123-4567")).isEqualTo("***4567");
    }

    @Test
    void shouldFullyMaskShortNumbers() {
        assertThat(LogSanitizer.maskPhone("1234")).isEqualTo("***");
        assertThat(LogSanitizer.maskPhone("anonymous")).isEqualTo("***");
    }

    @Test
    void shouldReturnEmptyForMissingNumber() {
        assertThat(LogSanitizer.maskPhone(null)).isEmpty();
        assertThat(LogSanitizer.maskPhone("  ")).isEmpty();
    }
}
