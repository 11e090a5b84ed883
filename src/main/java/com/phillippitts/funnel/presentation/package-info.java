/**
 * Presentation layer: the relay's network boundary.
 *
 * <p>Presentation depends on the service layer but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - streaming endpoint that accepts config and PCM frames
 *       and pushes transcript events back</li>
 *   <li>{@code presentation.controller} - REST endpoints (finalize, status)</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Handlers are thin adapters; session rules live in
 * {@link com.phillippitts.funnel.service.relay.SessionRegistry}.
 *
 * @see com.phillippitts.funnel.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.funnel.presentation;
