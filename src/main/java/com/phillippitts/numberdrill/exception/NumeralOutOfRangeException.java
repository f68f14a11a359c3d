package com.phillippitts.numberdrill.exception;

import com.phillippitts.numberdrill.domain.Language;

/**
 * Thrown when a value outside 0..{@link Language#maxValue()} is passed to an encoder.
 * Indicates a bug at the call site, not bad learner input.
 */
public class NumeralOutOfRangeException extends NumberDrillException {

    private final long value;
    private final Language language;

    public NumeralOutOfRangeException(long value, Language language) {
        super("Value " + value + " cannot be spoken in " + language.code()
                + " (supported range 0.." + language.maxValue() + ")");
        this.value = value;
        this.language = language;
    }

    public long getValue() {
        return value;
    }

    public Language getLanguage() {
        return language;
    }
}
