package com.phillippitts.numberdrill.service.numeral;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.exception.NumeralOutOfRangeException;

/**
 * Renders integers as spoken numeral text and as grouped digit strings for one language.
 *
 * <p>Implementations are stateless and thread-safe.
 */
public interface NumeralEncoder {

    /** Language this encoder speaks. */
    Language language();

    /**
     * Spells out a value the way it is read aloud.
     *
     * @param value value in 0..{@link Language#maxValue()}
     * @return spoken form, the zero-word for 0 (never empty)
     * @throws NumeralOutOfRangeException if the value is negative or too large
     */
    String encodeSpoken(long value);

    /**
     * Renders a value as digits with the language's grouping convention.
     *
     * @param value value in 0..{@link Language#maxValue()}
     * @return grouped digit string ("1,234,567" or "123万4567")
     * @throws NumeralOutOfRangeException if the value is negative or too large
     */
    String encodeGrouped(long value);

    /**
     * Checks that a value can be spoken in the given language.
     *
     * @return the value, unchanged
     * @throws NumeralOutOfRangeException if the value is negative or above the language maximum
     */
    static long requireEncodable(long value, Language language) {
        if (value < 0 || value > language.maxValue()) {
            throw new NumeralOutOfRangeException(value, language);
        }
        return value;
    }
}
