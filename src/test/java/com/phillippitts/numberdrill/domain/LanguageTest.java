package com.phillippitts.numberdrill.domain;

import com.phillippitts.numberdrill.exception.UnsupportedLanguageException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageTest {

    @Test
    void resolvesCodesAndNamesIgnoringCase() {
        assertThat(Language.fromCode("ja")).isEqualTo(Language.JAPANESE);
        assertThat(Language.fromCode("EN")).isEqualTo(Language.ENGLISH);
        assertThat(Language.fromCode(" japanese ")).isEqualTo(Language.JAPANESE);
        assertThat(Language.fromCode("English")).isEqualTo(Language.ENGLISH);
    }

    @Test
    void rejectsUnknownCodes() {
        assertThatThrownBy(() -> Language.fromCode("fr"))
                .isInstanceOf(UnsupportedLanguageException.class)
                .hasMessage("Unsupported language: fr");
        assertThatThrownBy(() -> Language.fromCode(null))
                .isInstanceOf(UnsupportedLanguageException.class);
    }

    @Test
    void maxValuesMatchLargestNamedUnit() {
        assertThat(Language.JAPANESE.maxValue()).isEqualTo(10_000_000_000_000_000L - 1);
        assertThat(Language.ENGLISH.maxValue()).isEqualTo(1_000_000_000_000_000L - 1);
    }
}
