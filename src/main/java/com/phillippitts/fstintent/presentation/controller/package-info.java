/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.fstintent.presentation.controller.IntentController}
 *       - {@code POST /api/intents/recognize} batch recognition and
 *       {@code GET /api/intents/grammar} grammar summary</li>
 * </ul>
 *
 * @see com.phillippitts.fstintent.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.fstintent.presentation.controller;
