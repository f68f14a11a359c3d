package com.phillippitts.numberdrill.service.drill;

import com.phillippitts.numberdrill.domain.AnswerDiagnosis;
import com.phillippitts.numberdrill.domain.ValidationResult;

import java.util.Objects;

/**
 * Validation verdict together with its diagnosis.
 */
public record CheckedAnswer(ValidationResult result, AnswerDiagnosis diagnosis) {

    public CheckedAnswer {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(diagnosis, "diagnosis");
    }
}
