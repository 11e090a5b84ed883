package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Calls {@code POST /recordings/{sessionId}/done} on the relay, passing the client's sent byte
 * count as {@code bytesSent} when known.
 */
public class RestFinalizeClient implements FinalizeClient {

    private static final Logger LOG = LogManager.getLogger(RestFinalizeClient.class);

    private final RestTemplate restTemplate;
    private final String serverUrl;

    public RestFinalizeClient(RestTemplate restTemplate, String serverUrl) {
        this.restTemplate = Objects.requireNonNull(restTemplate);
        this.serverUrl = Objects.requireNonNull(serverUrl);
    }

    @Override
    public AssembledTranscript finalizeRecording(String sessionId, long audioBytesSent) {
        String url = serverUrl + "/recordings/{sessionId}/done";
        try {
            AssembledTranscript result = audioBytesSent < 0
                    ? restTemplate.postForObject(url, null, AssembledTranscript.class, sessionId)
                    : restTemplate.postForObject(url + "?bytesSent={bytesSent}", null, AssembledTranscript.class,
                            sessionId, audioBytesSent);
            if (result == null) {
                throw new ConnectionFailureException("Empty finalize response", sessionId);
            }
            LOG.info("Finalize returned: duration={}s, segments={}, timedOut={}",
                    result.durationSeconds(), result.segmentCount(), result.timedOut());
            return result;
        } catch (RestClientException e) {
            throw new ConnectionFailureException("Finalize request failed", sessionId, e);
        }
    }
}
