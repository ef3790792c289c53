/**
 * Service layer: finite-state machinery, path decoding and sentence recognition.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.fst} - Transducer model, acceptor building, composition, projection
 *       and path enumeration</li>
 *   <li>{@code service.fst.io} - AT&amp;T text grammar and symbol table readers</li>
 *   <li>{@code service.decode} - Marker symbol decoding into intent records</li>
 *   <li>{@code service.recognition} - Per-sentence recognizer and batch entry point</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer metrics and Actuator health</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services use constructor injection (not field injection)</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>The loaded grammar is read-only, so recognition is safe for concurrent requests</li>
 * </ul>
 */
package com.phillippitts.fstintent.service;
