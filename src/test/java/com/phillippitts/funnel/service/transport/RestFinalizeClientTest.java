package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestFinalizeClientTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private RestFinalizeClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestFinalizeClient(restTemplate, "http://relay.test");
    }

    @Test
    void postsToDoneEndpointAndParsesResult() {
        server.expect(requestTo("http://relay.test/recordings/abc/done"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"sessionId":"abc","transcript":"hello world","durationSeconds":2.5,
                         "segments":[{"text":"hello world","confidence":0.9,"start":0.0,"end":1.2,"isFinal":true}],
                         "audioBytesReceived":80000,"timedOut":false,"processingTimeMs":40,
                         "segmentCount":1,"transcriptLength":11}
                        """, MediaType.APPLICATION_JSON));

        AssembledTranscript result = client.finalizeRecording("abc");

        assertThat(result.transcript()).isEqualTo("hello world");
        assertThat(result.durationSeconds()).isEqualTo(2.5);
        assertThat(result.segments()).singleElement().satisfies(s -> assertThat(s.isFinal()).isTrue());
        assertThat(result.audioBytesReceived()).isEqualTo(80_000);
        server.verify();
    }

    @Test
    void sendsBytesSentSoTheRelayCanWaitForTrailingAudio() {
        server.expect(requestTo("http://relay.test/recordings/abc/done?bytesSent=160000"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"sessionId":"abc","transcript":"","durationSeconds":5.0,"segments":[],
                         "audioBytesReceived":160000,"timedOut":false,"processingTimeMs":12,
                         "segmentCount":0,"transcriptLength":0}
                        """, MediaType.APPLICATION_JSON));

        AssembledTranscript result = client.finalizeRecording("abc", 160_000);

        assertThat(result.audioBytesReceived()).isEqualTo(160_000);
        server.verify();
    }

    @Test
    void serverErrorBecomesConnectionFailure() {
        server.expect(requestTo("http://relay.test/recordings/abc/done"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.finalizeRecording("abc"))
                .isInstanceOf(ConnectionFailureException.class)
                .hasMessageContaining("Finalize request failed");
    }
}
