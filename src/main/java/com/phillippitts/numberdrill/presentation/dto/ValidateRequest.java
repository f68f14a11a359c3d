package com.phillippitts.numberdrill.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of {@code POST /api/answers/validate}.
 *
 * @param userAnswer    transcribed learner answer (null is treated as empty)
 * @param correctAnswer expected answer text
 * @param language      answer language code
 * @param correctNumber expected value
 */
public record ValidateRequest(
        String userAnswer,
        @NotNull String correctAnswer,
        @NotBlank String language,
        @NotNull @PositiveOrZero Long correctNumber
) {
}
