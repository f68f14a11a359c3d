package com.phillippitts.numberdrill.domain;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationResultTest {

    @Test
    void createsValidResult() {
        ValidationResult result = new ValidationResult(true, 0.95, MatchMethod.NUMERIC, "2560",
                OptionalLong.of(2560), "2,560", 2560);

        assertThat(result.correct()).isTrue();
        assertThat(result.userParsed()).isTrue();
        assertThat(result.userNumber()).hasValue(2560);
    }

    @Test
    void reportsUnparsedAnswer() {
        ValidationResult result = new ValidationResult(false, 0.0, MatchMethod.REJECTED, "",
                OptionalLong.empty(), "さん", 3);

        assertThat(result.userParsed()).isFalse();
    }

    @Test
    void rejectsConfidenceOutsideRange() {
        assertThatThrownBy(() -> new ValidationResult(true, 1.01, MatchMethod.EXACT, "a",
                OptionalLong.empty(), "a", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Confidence must be between 0.0 and 1.0");
        assertThatThrownBy(() -> new ValidationResult(false, -0.1, MatchMethod.REJECTED, "a",
                OptionalLong.empty(), "b", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNullComponents() {
        assertThatThrownBy(() -> new ValidationResult(true, 1.0, null, "a", OptionalLong.empty(), "a", 1))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ValidationResult(true, 1.0, MatchMethod.EXACT, null, OptionalLong.empty(),
                "a", 1))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ValidationResult(true, 1.0, MatchMethod.EXACT, "a", null, "a", 1))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void diagnosisFactoryLeavesDetailsEmpty() {
        AnswerDiagnosis diagnosis = AnswerDiagnosis.of(AnswerDiagnosis.Kind.NOT_RECOGNIZED);

        assertThat(diagnosis.placeIndex()).isEqualTo(-1);
        assertThat(diagnosis.difference()).isZero();
        assertThatThrownBy(() -> AnswerDiagnosis.of(null)).isInstanceOf(NullPointerException.class);
    }
}
