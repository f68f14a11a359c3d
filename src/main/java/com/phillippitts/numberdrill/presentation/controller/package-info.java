/**
 * REST controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/numerals/{value}?language=ja|en} - spoken and grouped forms</li>
 *   <li>{@code POST /api/numerals/decode} - numeral text to integer</li>
 *   <li>{@code POST /api/answers/validate} - check a learner answer</li>
 *   <li>{@code GET /ping} - liveness</li>
 * </ul>
 *
 * <p>Controllers only translate between JSON and the service layer; errors are mapped by
 * {@link com.phillippitts.numberdrill.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.numberdrill.presentation.controller;
