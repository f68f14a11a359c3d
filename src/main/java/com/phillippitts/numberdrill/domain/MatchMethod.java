package com.phillippitts.numberdrill.domain;

/**
 * Validation tier that decided an answer, in precedence order.
 */
public enum MatchMethod {
    EXACT,
    NUMERIC,
    FUZZY,
    VARIANT,
    REJECTED
}
