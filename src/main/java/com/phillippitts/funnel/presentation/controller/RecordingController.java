package com.phillippitts.funnel.presentation.controller;

import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.service.relay.RelaySession;
import com.phillippitts.funnel.service.relay.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP side of the relay: the finalize call and a status lookup for one session.
 */
@RestController
@RequestMapping("/recordings")
class RecordingController {

    private static final Logger LOG = LogManager.getLogger(RecordingController.class);

    private final SessionRegistry registry;

    RecordingController(SessionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Finalizes the session and returns the assembled transcript. Repeated calls return the
     * same result while the session is retained.
     *
     * @param bytesSent audio bytes the client wrote to its stream; when given, the relay waits
     *                  for them to arrive before closing the backend input
     */
    @PostMapping("/{sessionId}/done")
    ResponseEntity<AssembledTranscript> done(@PathVariable String sessionId,
                                             @RequestParam(name = "bytesSent", required = false) Long bytesSent) {
        LOG.info("Finalize requested (bytesSent={})", bytesSent);
        return ResponseEntity.ok(registry.finalize(sessionId, bytesSent));
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<RecordingStatusResponse> status(@PathVariable String sessionId) {
        RelaySession session = registry.get(sessionId);
        return ResponseEntity.ok(RecordingStatusResponse.from(session));
    }
}
