/**
 * Client-side recording lifecycle.
 *
 * <p>{@link com.phillippitts.funnel.service.orchestration.DefaultRecordingOrchestrator} drives one
 * session at a time through
 * {@code IDLE → CONNECTING → STREAMING → FINALIZING → COMPLETED}, with {@code FAILED} reachable
 * from any non-terminal state. Transitions are guarded by
 * {@link com.phillippitts.funnel.service.orchestration.RecordingStateMachine}; the same machine
 * tracks relay-side sessions.
 *
 * @since 1.0
 */
package com.phillippitts.funnel.service.orchestration;
