package com.phillippitts.numberdrill.service.numeral;

import com.phillippitts.numberdrill.domain.Language;

import java.util.OptionalLong;

/**
 * Parses numeral text, typically a speech transcript, back into an integer.
 *
 * <p>Decoders are lenient: noise between numeral words is skipped. They never throw for
 * malformed text; an empty result means no digits were found. Zero is returned only when
 * the text explicitly says zero.
 */
public interface NumeralDecoder {

    /** Language this decoder reads. */
    Language language();

    /**
     * Decodes numeral text.
     *
     * @param text numeral text (may be null or blank)
     * @return decoded value, or empty if the text carries no number
     */
    OptionalLong decode(String text);
}
