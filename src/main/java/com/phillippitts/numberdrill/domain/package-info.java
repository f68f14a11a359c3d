/**
 * Domain models shared by the numeral core and its callers.
 *
 * <p>All domain models are immutable records or enums and validate themselves on
 * construction.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.numberdrill.domain.Language} - Spoken language of a numeral
 *       and the largest value it can name</li>
 *   <li>{@link com.phillippitts.numberdrill.domain.ValidationResult} - Verdict, confidence and
 *       extracted number for one checked answer</li>
 *   <li>{@link com.phillippitts.numberdrill.domain.AnswerDiagnosis} - Why an answer was wrong</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.numberdrill.domain;
