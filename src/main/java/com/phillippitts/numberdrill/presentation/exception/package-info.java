/**
 * Maps application exceptions to HTTP responses.
 *
 * @see com.phillippitts.numberdrill.exception
 */
package com.phillippitts.numberdrill.presentation.exception;
