package com.phillippitts.numberdrill.presentation.dto;

import com.phillippitts.numberdrill.service.drill.SpokenNumeral;

/**
 * A value spelled out and grouped in one language.
 */
public record NumeralResponse(long value, String language, String spoken, String grouped) {

    public static NumeralResponse from(SpokenNumeral numeral) {
        return new NumeralResponse(numeral.value(), numeral.language().code(), numeral.spoken(), numeral.grouped());
    }
}
