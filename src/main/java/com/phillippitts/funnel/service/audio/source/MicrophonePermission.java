package com.phillippitts.funnel.service.audio.source;

import com.phillippitts.funnel.exception.PermissionDeniedException;

/**
 * Checks microphone access before a live recording touches the network.
 */
@FunctionalInterface
public interface MicrophonePermission {

    /**
     * @throws PermissionDeniedException if the platform refuses microphone access
     */
    void check();
}
