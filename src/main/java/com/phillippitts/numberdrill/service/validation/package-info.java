/**
 * Answer validation for spoken numeral drills.
 *
 * <p>{@link com.phillippitts.numberdrill.service.validation.AnswerValidator} applies the
 * Exact, Numeric, Fuzzy, Variant and Rejected tiers in strict precedence;
 * {@link com.phillippitts.numberdrill.service.validation.AnswerDiagnoser} turns a rejected
 * result into a structured hint (digit count, wrong place, small difference).
 *
 * <p>Configuration via application.properties:
 * <pre>
 * numeral.validation.fuzzy-threshold=0.80
 * numeral.validation.variant-matching-enabled=true
 * numeral.validation.very-close-percent=10
 * </pre>
 *
 * @see com.phillippitts.numberdrill.config.properties.ValidationProperties
 * @since 1.0
 */
package com.phillippitts.numberdrill.service.validation;
