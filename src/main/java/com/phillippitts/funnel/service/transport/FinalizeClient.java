package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.AssembledTranscript;

/**
 * Issues the finalize request for a recording, separately from the streaming connection.
 */
public interface FinalizeClient {

    long UNKNOWN_BYTES_SENT = -1;

    /**
     * Blocks until the relay has assembled the transcript.
     *
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the call fails
     */
    default AssembledTranscript finalizeRecording(String sessionId) {
        return finalizeRecording(sessionId, UNKNOWN_BYTES_SENT);
    }

    /**
     * Blocks until the relay has received {@code audioBytesSent} bytes of audio (within its
     * finalize timeout) and assembled the transcript.
     *
     * @param audioBytesSent bytes written to the streaming connection, or {@link #UNKNOWN_BYTES_SENT}
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the call fails
     */
    AssembledTranscript finalizeRecording(String sessionId, long audioBytesSent);
}
