/**
 * Domain models for recognition results.
 *
 * <p>All domain models are immutable Java records that validate themselves in their compact
 * constructors and carry no serialization annotations; the presentation layer decides how they
 * are rendered.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.fstintent.domain.IntentRecord} - text, tokens, intent and
 *       entities of one decoded grammar path</li>
 *   <li>{@link com.phillippitts.fstintent.domain.RecognizedIntent} - intent name with confidence</li>
 *   <li>{@link com.phillippitts.fstintent.domain.EntityValue} - one captured entity slot</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.fstintent.domain;
