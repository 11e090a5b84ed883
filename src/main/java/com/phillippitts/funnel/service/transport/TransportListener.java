package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.TranscriptEvent;

/**
 * Callbacks from a {@link StreamConnection}. Invoked on the transport's I/O threads.
 */
public interface TransportListener {

    /** A parsed inbound event frame. Malformed frames are logged and never delivered. */
    void onEvent(TranscriptEvent event);

    /** Transport-level failure; the connection is unusable afterwards. */
    void onError(Throwable error);

    /** The connection closed, by either side. Called at most once. */
    void onClosed(int code, String reason);
}
