package com.phillippitts.funnel.service.backend;

import com.phillippitts.funnel.domain.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Utility to parse Deepgram-style live transcription frames.
 *
 * <p>This parser handles three frame types:
 * <ul>
 *   <li><b>Results:</b> {@code {"type":"Results","is_final":true,"start":0.5,"duration":1.6,
 *       "channel":{"alternatives":[{"transcript":"...","confidence":0.97}]}}}</li>
 *   <li><b>Metadata:</b> {@code {"type":"Metadata","duration":5.0,...}}, the terminal event</li>
 *   <li><b>Error:</b> {@code {"type":"Error","description":"..."}}</li>
 * </ul>
 * Every other type (e.g. {@code SpeechStarted}, {@code UtteranceEnd}) is ignored.
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> Caps frame size at {@link #MAX_JSON_SIZE} (1MB).
 *
 * @since 1.0
 */
final class BackendMessageParser {

    private static final Logger LOG = LogManager.getLogger(BackendMessageParser.class);

    /** Maximum accepted frame size (1MB). */
    private static final int MAX_JSON_SIZE = 1_048_576;

    private BackendMessageParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one backend text frame.
     *
     * @param json frame payload
     * @return parsed message; {@link BackendMessage.Kind#IGNORED} for blank results, unknown types
     *         and malformed input
     */
    static BackendMessage parse(String json) {
        if (json == null || json.isBlank()) {
            return BackendMessage.ignored();
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Backend frame exceeds {}B cap (actual: {}B); ignoring", MAX_JSON_SIZE, json.length());
            return BackendMessage.ignored();
        }
        try {
            JSONObject obj = new JSONObject(json);
            String type = obj.optString("type", "");
            return switch (type) {
                case "Results" -> parseResults(obj);
                case "Metadata" -> BackendMessage.metadata(Math.max(0.0, obj.optDouble("duration", 0.0)));
                case "Error" -> BackendMessage.error(
                        obj.optString("description", obj.optString("message", "unknown backend error")));
                default -> BackendMessage.ignored();
            };
        } catch (Exception e) {
            LOG.warn("Failed to parse backend frame: {}", e.getMessage());
            return BackendMessage.ignored();
        }
    }

    private static BackendMessage parseResults(JSONObject obj) {
        JSONObject channel = obj.optJSONObject("channel");
        JSONArray alternatives = channel == null ? null : channel.optJSONArray("alternatives");
        if (alternatives == null || alternatives.isEmpty()) {
            return BackendMessage.ignored();
        }
        JSONObject first = alternatives.getJSONObject(0);
        String text = first.optString("transcript", "").trim();
        if (text.isEmpty()) {
            return BackendMessage.ignored();
        }
        double rawConfidence = first.optDouble("confidence", 1.0);
        // Clamp to [0.0, 1.0] to satisfy TranscriptSegment contract
        double confidence = Double.isNaN(rawConfidence) ? 0.0 : Math.min(1.0, Math.max(0.0, rawConfidence));
        double start = Math.max(0.0, obj.optDouble("start", 0.0));
        double duration = Math.max(0.0, obj.optDouble("duration", 0.0));
        boolean isFinal = obj.optBoolean("is_final", false);
        return BackendMessage.results(new TranscriptSegment(text, confidence, start, start + duration, isFinal));
    }
}
