package com.phillippitts.numberdrill.domain;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Immutable outcome of checking a learner's answer against the expected numeral.
 *
 * <p>The number extracted from the answer is carried whether or not the answer was
 * accepted, so callers can explain a wrong answer without parsing it again.
 *
 * @param correct       whether the answer was accepted
 * @param confidence    score between 0.0 and 1.0
 * @param method        tier that produced the verdict
 * @param userAnswer    the answer exactly as received (never null, may be empty)
 * @param userNumber    number extracted from the answer, if any
 * @param correctAnswer expected answer text
 * @param correctNumber expected value
 */
public record ValidationResult(
        boolean correct,
        double confidence,
        MatchMethod method,
        String userAnswer,
        OptionalLong userNumber,
        String correctAnswer,
        long correctNumber
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if confidence is out of range
     * @throws NullPointerException if method, userAnswer, userNumber or correctAnswer is null
     */
    public ValidationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(method, "Match method must not be null");
        Objects.requireNonNull(userAnswer, "User answer must not be null");
        Objects.requireNonNull(userNumber, "User number must not be null");
        Objects.requireNonNull(correctAnswer, "Correct answer must not be null");
    }

    /** Whether a number could be extracted from the user's answer. */
    public boolean userParsed() {
        return userNumber.isPresent();
    }
}
