package com.phillippitts.numberdrill.presentation.dto;

import com.phillippitts.numberdrill.domain.AnswerDiagnosis;
import com.phillippitts.numberdrill.domain.ValidationResult;
import com.phillippitts.numberdrill.service.drill.CheckedAnswer;

import java.util.Locale;

/**
 * Validation verdict as returned to API clients.
 */
public record ValidateResponse(
        boolean correct,
        double confidence,
        String method,
        String userAnswer,
        Long userNumber,
        boolean userParsed,
        String correctAnswer,
        long correctNumber,
        Diagnosis diagnosis
) {

    /**
     * Flattened {@link AnswerDiagnosis}; {@code placeIndex} is null unless kind is CHECK_PLACE.
     */
    public record Diagnosis(String kind, int userDigits, int correctDigits, Integer placeIndex, long difference) {

        static Diagnosis from(AnswerDiagnosis d) {
            return new Diagnosis(
                    d.kind().name(),
                    d.userDigits(),
                    d.correctDigits(),
                    d.placeIndex() < 0 ? null : d.placeIndex(),
                    d.difference());
        }
    }

    public static ValidateResponse from(CheckedAnswer checked) {
        ValidationResult r = checked.result();
        return new ValidateResponse(
                r.correct(),
                r.confidence(),
                r.method().name().toLowerCase(Locale.ROOT),
                r.userAnswer(),
                r.userParsed() ? r.userNumber().getAsLong() : null,
                r.userParsed(),
                r.correctAnswer(),
                r.correctNumber(),
                Diagnosis.from(checked.diagnosis()));
    }
}
