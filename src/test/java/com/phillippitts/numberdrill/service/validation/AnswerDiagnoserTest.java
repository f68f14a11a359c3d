package com.phillippitts.numberdrill.service.validation;

import com.phillippitts.numberdrill.config.properties.ValidationProperties;
import com.phillippitts.numberdrill.domain.AnswerDiagnosis;
import com.phillippitts.numberdrill.domain.AnswerDiagnosis.Kind;
import com.phillippitts.numberdrill.domain.MatchMethod;
import com.phillippitts.numberdrill.domain.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerDiagnoserTest {

    private final AnswerDiagnoser diagnoser = new AnswerDiagnoser(ValidationProperties.defaults());

    private static ValidationResult rejected(OptionalLong userNumber, long correctNumber) {
        return new ValidationResult(false, 0.3, MatchMethod.REJECTED, "answer", userNumber,
                "expected", correctNumber);
    }

    @Test
    void acceptedAnswerIsCorrect() {
        ValidationResult accepted = new ValidationResult(true, 0.95, MatchMethod.NUMERIC, "2560",
                OptionalLong.of(2560), "2,560", 2560);

        assertThat(diagnoser.diagnose(accepted).kind()).isEqualTo(Kind.CORRECT);
    }

    @Test
    void unparsedAnswerIsNotRecognized() {
        AnswerDiagnosis diagnosis = diagnoser.diagnose(rejected(OptionalLong.empty(), 2560));

        assertThat(diagnosis.kind()).isEqualTo(Kind.NOT_RECOGNIZED);
        assertThat(diagnosis.placeIndex()).isEqualTo(-1);
    }

    @Test
    void smallDifferenceIsVeryClose() {
        AnswerDiagnosis diagnosis = diagnoser.diagnose(rejected(OptionalLong.of(2500), 2560));

        assertThat(diagnosis.kind()).isEqualTo(Kind.VERY_CLOSE);
        assertThat(diagnosis.difference()).isEqualTo(60);
    }

    @Test
    void shorterNumberHasFewerDigits() {
        AnswerDiagnosis diagnosis = diagnoser.diagnose(rejected(OptionalLong.of(200), 2560));

        assertThat(diagnosis.kind()).isEqualTo(Kind.FEWER_DIGITS);
        assertThat(diagnosis.userDigits()).isEqualTo(3);
        assertThat(diagnosis.correctDigits()).isEqualTo(4);
    }

    @Test
    void longerNumberHasMoreDigits() {
        AnswerDiagnosis diagnosis = diagnoser.diagnose(rejected(OptionalLong.of(25_600), 2560));

        assertThat(diagnosis.kind()).isEqualTo(Kind.MORE_DIGITS);
        assertThat(diagnosis.userDigits()).isEqualTo(5);
    }

    @Test
    void reportsFirstWrongPlaceFromTheOnes() {
        assertThat(diagnoser.diagnose(rejected(OptionalLong.of(3560), 2560)).placeIndex()).isEqualTo(3);
        assertThat(diagnoser.diagnose(rejected(OptionalLong.of(2960), 2560)).placeIndex()).isEqualTo(2);

        AnswerDiagnosis diagnosis = diagnoser.diagnose(rejected(OptionalLong.of(2960), 2560));
        assertThat(diagnosis.kind()).isEqualTo(Kind.CHECK_PLACE);
        assertThat(diagnosis.difference()).isEqualTo(400);
    }

    @Test
    void expectedZeroIsNeverVeryClose() {
        AnswerDiagnosis diagnosis = diagnoser.diagnose(rejected(OptionalLong.of(5), 0));

        assertThat(diagnosis.kind()).isEqualTo(Kind.CHECK_PLACE);
        assertThat(diagnosis.placeIndex()).isZero();
    }

    @Test
    void fallsBackToTryAgainWhenNothingSpecificApplies() {
        AnswerDiagnoser strict = new AnswerDiagnoser(new ValidationProperties(null, null, 0.0));

        AnswerDiagnosis diagnosis = strict.diagnose(rejected(OptionalLong.of(2560), 2560));

        assertThat(diagnosis.kind()).isEqualTo(Kind.TRY_AGAIN);
    }
}
