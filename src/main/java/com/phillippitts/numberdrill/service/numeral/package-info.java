/**
 * Numeral core: converts integers to spoken Japanese and English numerals and back.
 *
 * <p>Every class in this package tree is a pure function over immutable tables. Nothing
 * here performs I/O or holds mutable state, so all components are safe to share across
 * threads and their results may be cached by input.
 *
 * <p>Layout:
 * <ul>
 *   <li>{@link com.phillippitts.numberdrill.service.numeral.NumeralConverter} - routes by language</li>
 *   <li>{@code japanese} - hiragana and 万/億/兆 grouping, euphony table, mixed-form parser and
 *       the kana state machine</li>
 *   <li>{@code english} - 3-digit grouping with thousand/million/billion/trillion</li>
 * </ul>
 *
 * <p>Round trip law: {@code decode(encodeSpoken(v, L), L) == v} for every value in
 * {@code 0..L.maxValue()}.
 *
 * @since 1.0
 */
package com.phillippitts.numberdrill.service.numeral;
