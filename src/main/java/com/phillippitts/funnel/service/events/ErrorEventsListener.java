package com.phillippitts.funnel.service.events;

import com.phillippitts.funnel.service.audio.capture.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            if (CaptureErrorEvent.MIC_PERMISSION_DENIED.equals(e.reason())) {
                LOG.warn("Microphone permission denied. On macOS grant access: "
                        + "System Settings → Privacy & Security → Microphone (then restart app)");
            } else {
                LOG.warn("Capture error: reason={}. Check microphone device & permissions.", e.reason());
            }
        }
    }

    @EventListener
    void onSessionFailed(SessionFailedEvent e) {
        String key = "session-" + e.role() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Recording session failed: role={}, reason={}, session={}", e.role(), e.reason(), e.sessionId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
