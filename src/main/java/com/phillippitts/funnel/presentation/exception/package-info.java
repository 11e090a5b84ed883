/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.funnel.exception.InvalidStreamConfigException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.funnel.exception.UnknownSessionException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.funnel.exception.DuplicateSessionException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.funnel.exception.ConnectionFailureException} → 502 Bad Gateway</li>
 *   <li>{@link com.phillippitts.funnel.exception.BackendUnavailableException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "UnknownSessionException",
 *   "message": "Recording session not found",
 *   "details": "No session with id 3f2a... (it may have expired)",
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.funnel.exception
 * @since 1.0
 */
package com.phillippitts.funnel.presentation.exception;
