/**
 * Presentation layer: REST controllers, exception handling, JSON rendering and the command-line
 * runner. Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 *   <li>{@code presentation.json} - org.json rendering of batch results</li>
 *   <li>{@code presentation.cli} - fstaccept-style command-line runner</li>
 * </ul>
 */
package com.phillippitts.fstintent.presentation;
