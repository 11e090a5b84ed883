package com.phillippitts.funnel.service.events;

import java.time.Instant;

/**
 * Published when a recording session ends in the Failed state, on either side of the stream.
 *
 * @param sessionId failed session
 * @param role      {@code client} or {@code relay}
 * @param reason    short machine-readable reason, e.g. {@code connection_lost}
 * @param at        when the failure was recorded
 */
public record SessionFailedEvent(String sessionId, String role, String reason, Instant at) {

    public static final String ROLE_CLIENT = "client";
    public static final String ROLE_RELAY = "relay";
}
