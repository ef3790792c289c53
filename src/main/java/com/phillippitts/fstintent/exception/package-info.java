/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.fstintent.exception.FstIntentException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.fstintent.exception.GrammarNotFoundException} - Grammar or symbol
 *       table file missing at startup</li>
 *   <li>{@link com.phillippitts.fstintent.exception.GrammarFormatException} - Text FST or symbol
 *       table could not be parsed</li>
 *   <li>{@link com.phillippitts.fstintent.exception.MalformedTagException} - Begin/end tag markers
 *       of a path do not nest</li>
 *   <li>{@link com.phillippitts.fstintent.exception.UnknownSymbolException} - Label missing from a
 *       symbol table</li>
 *   <li>{@link com.phillippitts.fstintent.exception.CyclicGrammarException} - Path enumeration
 *       exceeded its depth bound</li>
 * </ul>
 *
 * <p>Recognition failures are isolated per sentence: the recognizer turns them into a failed
 * {@code RecognitionOutcome} instead of letting them propagate. Startup failures (missing or
 * unreadable grammar) are fatal and map to HTTP 503 via {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.fstintent.exception;
