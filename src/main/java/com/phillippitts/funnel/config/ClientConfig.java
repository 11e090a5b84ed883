package com.phillippitts.funnel.config;

import com.phillippitts.funnel.config.properties.AudioCaptureProperties;
import com.phillippitts.funnel.config.properties.ClientProperties;
import com.phillippitts.funnel.service.audio.capture.AudioCaptureService;
import com.phillippitts.funnel.service.audio.capture.StreamingAudioCaptureService;
import com.phillippitts.funnel.service.audio.source.AudioSourceFactory;
import com.phillippitts.funnel.service.audio.source.JavaSoundMicrophonePermission;
import com.phillippitts.funnel.service.audio.source.MicrophonePermission;
import com.phillippitts.funnel.service.orchestration.DefaultRecordingOrchestrator;
import com.phillippitts.funnel.service.orchestration.RecordingOrchestrator;
import com.phillippitts.funnel.service.transport.FinalizeClient;
import com.phillippitts.funnel.service.transport.RestFinalizeClient;
import com.phillippitts.funnel.service.transport.StreamTransport;
import com.phillippitts.funnel.service.transport.WebSocketStreamTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Wires the recording client: capture, streaming transport, finalize call and the
 * orchestrator that drives them.
 *
 * <p>Active only when {@code funnel.client.enabled=true}; a relay-only deployment never
 * touches the sound system.
 */
@Configuration
@ConditionalOnProperty(prefix = "funnel.client", name = "enabled", havingValue = "true")
public class ClientConfig {

    private final ClientProperties clientProperties;
    private final AudioCaptureProperties captureProperties;

    public ClientConfig(ClientProperties clientProperties, AudioCaptureProperties captureProperties) {
        this.clientProperties = clientProperties;
        this.captureProperties = captureProperties;
    }

    @Bean
    public AudioCaptureService audioCaptureService(ApplicationEventPublisher publisher) {
        return new StreamingAudioCaptureService(captureProperties, publisher);
    }

    @Bean
    public AudioSourceFactory audioSourceFactory() {
        return new AudioSourceFactory(captureProperties);
    }

    @Bean
    public MicrophonePermission microphonePermission() {
        return new JavaSoundMicrophonePermission(captureProperties.getSampleRate());
    }

    @Bean
    public StreamTransport streamTransport() {
        return new WebSocketStreamTransport(new StandardWebSocketClient(),
                clientProperties.getStreamBaseUrl(), clientProperties.getReadyTimeout());
    }

    /**
     * RestTemplate for the finalize call. The read timeout must outlast the relay's
     * finalize timeout so a partial result still reaches the client.
     */
    @Bean
    public RestTemplate finalizeRestTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) clientProperties.getReadyTimeout().toMillis());
        factory.setReadTimeout((int) clientProperties.getFinalizeReadTimeout().toMillis());
        return new RestTemplate(factory);
    }

    @Bean
    public FinalizeClient finalizeClient(RestTemplate finalizeRestTemplate) {
        return new RestFinalizeClient(finalizeRestTemplate, clientProperties.getServerUrl());
    }

    @Bean
    public RecordingOrchestrator recordingOrchestrator(AudioCaptureService audioCaptureService,
                                                       StreamTransport streamTransport,
                                                       FinalizeClient finalizeClient,
                                                       AudioSourceFactory audioSourceFactory,
                                                       MicrophonePermission microphonePermission,
                                                       ApplicationEventPublisher publisher) {
        return new DefaultRecordingOrchestrator(audioCaptureService, streamTransport, finalizeClient,
                audioSourceFactory, microphonePermission, clientProperties, captureProperties, publisher);
    }
}
