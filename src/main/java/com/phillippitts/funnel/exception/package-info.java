/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend a common base so the web layer can translate them to HTTP responses
 * in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.funnel.exception.FunnelException} - Base exception</li>
 *   <li>{@link com.phillippitts.funnel.exception.PermissionDeniedException} - Microphone access refused</li>
 *   <li>{@link com.phillippitts.funnel.exception.ConnectionFailureException} - Streaming connection
 *       failed, was never acknowledged, or dropped mid-stream</li>
 *   <li>{@link com.phillippitts.funnel.exception.EncodingFailureException} - Captured audio could not be
 *       converted to 16-bit PCM</li>
 *   <li>{@link com.phillippitts.funnel.exception.RecordingTooShortException} - Stop requested before the
 *       minimum recording duration</li>
 *   <li>{@link com.phillippitts.funnel.exception.BackendUnavailableException} - Transcription backend
 *       connection not open</li>
 *   <li>{@link com.phillippitts.funnel.exception.DuplicateSessionException} - Session id already registered</li>
 *   <li>{@link com.phillippitts.funnel.exception.UnknownSessionException} - Session id not registered</li>
 *   <li>{@link com.phillippitts.funnel.exception.InvalidStreamConfigException} - Malformed or unsupported
 *       stream config</li>
 * </ul>
 *
 * @see com.phillippitts.funnel.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.funnel.exception;
