/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.fstintent.config.GrammarConfig} - Loads the grammar and wires the
 *       recognition pipeline</li>
 *   <li>{@code GrammarValidationService} - Fail-fast grammar checks at startup</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code fst.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.fstintent.config;
