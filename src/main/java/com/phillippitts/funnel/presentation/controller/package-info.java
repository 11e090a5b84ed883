/**
 * REST endpoints of the relay.
 *
 * <ul>
 *   <li>{@code POST /recordings/{sessionId}/done}: finalize handshake, returns the assembled transcript</li>
 *   <li>{@code GET /recordings/{sessionId}}: session state and counters</li>
 * </ul>
 *
 * <p>Exceptions are mapped to responses by
 * {@link com.phillippitts.funnel.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.funnel.presentation.controller;
