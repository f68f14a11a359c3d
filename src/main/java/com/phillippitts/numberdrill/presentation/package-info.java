/**
 * HTTP presentation layer: controllers, request/response records and error mapping.
 *
 * @since 1.0
 */
package com.phillippitts.numberdrill.presentation;
