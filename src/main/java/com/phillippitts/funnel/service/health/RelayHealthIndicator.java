package com.phillippitts.funnel.service.health;

import com.phillippitts.funnel.service.backend.TranscriptionBackend;
import com.phillippitts.funnel.service.relay.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the relay.
 *
 * <ul>
 *   <li>UP: transcription backend credentials configured</li>
 *   <li>DEGRADED: relay accepts streams but every session will fail with backend_unavailable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RelayHealthIndicator implements HealthIndicator {

    private final TranscriptionBackend backend;
    private final SessionRegistry registry;

    public RelayHealthIndicator(TranscriptionBackend backend, SessionRegistry registry) {
        this.backend = backend;
        this.registry = registry;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        if (backend.isConfigured()) {
            builder.up().withDetail("backend", "configured");
        } else {
            builder.status("DEGRADED").withDetail("backend", "missing API key");
        }
        return builder
                .withDetail("activeSessions", registry.activeSessions())
                .withDetail("retainedSessions", registry.size())
                .build();
    }
}
