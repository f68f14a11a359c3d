package com.phillippitts.numberdrill.domain;

import java.util.Objects;

/**
 * Structured explanation of why an answer was (or was not) accepted.
 *
 * <p>Fields that do not apply to a given {@link Kind} are zero; {@code placeIndex} is -1
 * unless the kind is {@link Kind#CHECK_PLACE}.
 *
 * @param kind          diagnosis category
 * @param userDigits    digit count of the recognized number
 * @param correctDigits digit count of the expected number
 * @param placeIndex    first wrong place counted from the ones place (0 = ones, 1 = tens, ...)
 * @param difference    absolute difference between recognized and expected number
 */
public record AnswerDiagnosis(
        Kind kind,
        int userDigits,
        int correctDigits,
        int placeIndex,
        long difference
) {

    public enum Kind {
        CORRECT,
        NOT_RECOGNIZED,
        VERY_CLOSE,
        FEWER_DIGITS,
        MORE_DIGITS,
        CHECK_PLACE,
        TRY_AGAIN
    }

    public AnswerDiagnosis {
        Objects.requireNonNull(kind, "Diagnosis kind must not be null");
    }

    public static AnswerDiagnosis of(Kind kind) {
        return new AnswerDiagnosis(kind, 0, 0, -1, 0L);
    }
}
