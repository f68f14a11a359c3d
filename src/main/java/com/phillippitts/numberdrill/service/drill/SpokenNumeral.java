package com.phillippitts.numberdrill.service.drill;

import com.phillippitts.numberdrill.domain.Language;

/**
 * A value rendered in one language, both spelled out and as grouped digits.
 */
public record SpokenNumeral(long value, Language language, String spoken, String grouped) {
}
