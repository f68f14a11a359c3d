/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.numberdrill.exception.NumberDrillException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.numberdrill.exception.NumeralOutOfRangeException} - Thrown when
 *       an encoder receives a negative or too-large value</li>
 *   <li>{@link com.phillippitts.numberdrill.exception.UnsupportedLanguageException} - Thrown when
 *       a language code cannot be resolved</li>
 * </ul>
 *
 * <p>Unparseable answer text is never an exception: decoders return an empty
 * {@code OptionalLong} and the validator rejects the answer.
 *
 * @see com.phillippitts.numberdrill.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.numberdrill.exception;
