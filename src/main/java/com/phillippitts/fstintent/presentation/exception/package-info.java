/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.fstintent.exception.GrammarNotFoundException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.fstintent.exception.GrammarFormatException} → 503 Service Unavailable</li>
 *   <li>Request validation and unreadable bodies → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidRequest",
 *   "message": "Invalid recognize request",
 *   "details": "sentences must not be empty",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.fstintent.presentation.exception;
