/**
 * Application-wide configuration.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Externalized validation tolerances bound from
 *       {@code application.properties}</li>
 *   <li>{@code config.logging} - Logging infrastructure (MDC filter)</li>
 * </ul>
 *
 * @see com.phillippitts.numberdrill.config.properties.ValidationProperties
 * @since 1.0
 */
package com.phillippitts.numberdrill.config;
