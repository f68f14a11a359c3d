package com.phillippitts.numberdrill.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("さんびゃくまん", 3)).isEqualTo("さんび");
    }

    @Test
    void shouldNotSplitSurrogatePairs() {
        String text = "a" + new String(Character.toChars(0x1F30D)) + "b";

        assertThat(LogSanitizer.truncate(text, 2)).isEqualTo("a");
    }

    @Test
    void previewKeepsShortAnswersIntact() {
        assertThat(LogSanitizer.preview(null)).isEmpty();
        assertThat(LogSanitizer.preview("two thousand")).isEqualTo("two thousand");
    }

    @Test
    void previewMarksCutAnswersWithLength() {
        String longAnswer = "a".repeat(100);

        assertThat(LogSanitizer.preview(longAnswer))
                .startsWith("a".repeat(LogSanitizer.DEFAULT_PREVIEW))
                .endsWith("…(100 chars)");
    }
}
