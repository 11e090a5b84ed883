package com.phillippitts.funnel.service.health;

import com.phillippitts.funnel.config.properties.RelayProperties;
import com.phillippitts.funnel.service.metrics.RelayMetrics;
import com.phillippitts.funnel.service.relay.FinalizationCoordinator;
import com.phillippitts.funnel.service.relay.SessionRegistry;
import com.phillippitts.funnel.testutil.EventCapturingPublisher;
import com.phillippitts.funnel.testutil.FakeTranscriptionBackend;
import com.phillippitts.funnel.testutil.RecordingClientSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class RelayHealthIndicatorTest {

    private static SessionRegistry registry(FakeTranscriptionBackend backend) {
        RelayProperties props = new RelayProperties();
        RelayMetrics metrics = new RelayMetrics(new SimpleMeterRegistry());
        return new SessionRegistry(backend, new FinalizationCoordinator(props, metrics), props, metrics,
                new EventCapturingPublisher(), Runnable::run);
    }

    @Test
    void upWhenBackendConfigured() {
        FakeTranscriptionBackend backend = new FakeTranscriptionBackend();
        SessionRegistry registry = registry(backend);
        registry.createSession("s1", new RecordingClientSink());

        Health health = new RelayHealthIndicator(backend, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("backend", "configured")
                .containsEntry("activeSessions", 1)
                .containsEntry("retainedSessions", 1);
    }

    @Test
    void degradedWhenApiKeyMissing() {
        FakeTranscriptionBackend backend = new FakeTranscriptionBackend().unconfigured();

        Health health = new RelayHealthIndicator(backend, registry(backend)).health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("backend", "missing API key");
    }
}
