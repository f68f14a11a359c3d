package com.phillippitts.numberdrill.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/numerals/decode}.
 *
 * @param text     numeral text to decode
 * @param language language code ("ja" or "en")
 */
public record DecodeRequest(
        @NotNull String text,
        @NotBlank String language
) {
}
