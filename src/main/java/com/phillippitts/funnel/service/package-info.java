/**
 * Service layer for both roles of the system.
 *
 * <p>Client role:
 * <ul>
 *   <li>{@code service.audio} - capture, PCM16 encoding, loudness metering, audio sources, archive</li>
 *   <li>{@code service.transport} - streaming connection to the relay and the finalize call</li>
 *   <li>{@code service.orchestration} - the recording state machine that drives a session</li>
 * </ul>
 *
 * <p>Relay role:
 * <ul>
 *   <li>{@code service.relay} - session registry, per-session mailboxes, finalize handshake</li>
 *   <li>{@code service.backend} - streaming connection to the transcription backend</li>
 *   <li>{@code service.health}, {@code service.metrics} - actuator health and Micrometer meters</li>
 * </ul>
 *
 * <p>{@code service.events} carries failure events shared by both roles.
 *
 * @since 1.0
 */
package com.phillippitts.funnel.service;
