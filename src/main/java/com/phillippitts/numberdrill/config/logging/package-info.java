/**
 * Logging configuration: request-scoped MDC values for Log4j 2.
 *
 * <p>The console pattern in {@code log4j2-spring.xml} prints {@code requestId} and
 * {@code sessionId} on every line written while a request is being served.
 */
package com.phillippitts.numberdrill.config.logging;
