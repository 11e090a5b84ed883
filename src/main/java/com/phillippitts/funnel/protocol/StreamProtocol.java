package com.phillippitts.funnel.protocol;

import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.exception.InvalidStreamConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * JSON codec for the text frames exchanged on the streaming connection.
 *
 * <p>Outbound (client → relay): one {@code config} frame. Inbound (relay → client):
 * {@code ready}, {@code transcript}, {@code error} and {@code metadata} events.
 * Audio travels as raw binary frames and never passes through this class.
 *
 * <p>Thread-safe: all methods are static and stateless.
 *
 * @since 1.0
 */
public final class StreamProtocol {

    private static final Logger LOG = LogManager.getLogger(StreamProtocol.class);

    /** Cap on inbound text frame size; anything larger is not a protocol frame. */
    static final int MAX_FRAME_CHARS = 262_144;

    public static final String TYPE_CONFIG = "config";

    private StreamProtocol() {
        // Utility class
    }

    public static String encodeConfig(StreamConfig config) {
        return new JSONObject()
                .put("type", TYPE_CONFIG)
                .put("format", config.format())
                .put("sampleRate", config.sampleRate())
                .put("channels", config.channels())
                .toString();
    }

    /**
     * Parses a client config frame.
     *
     * @param json text frame payload
     * @return parsed config (not yet range-validated)
     * @throws InvalidStreamConfigException if the frame is not a well-formed config frame
     */
    public static StreamConfig parseConfig(String json) {
        JSONObject obj = parseObject(json);
        if (!TYPE_CONFIG.equals(obj.optString("type"))) {
            throw new InvalidStreamConfigException("expected type 'config', got '" + obj.optString("type") + "'");
        }
        if (!obj.has("sampleRate")) {
            throw new InvalidStreamConfigException("missing sampleRate");
        }
        try {
            return new StreamConfig(
                    obj.optString("format", StreamConfig.PCM16),
                    obj.getInt("sampleRate"),
                    obj.optInt("channels", 1));
        } catch (JSONException e) {
            throw new InvalidStreamConfigException("sampleRate is not an integer", e);
        }
    }

    /** Returns the {@code type} discriminant of a text frame, or {@code null} if unreadable. */
    public static String peekType(String json) {
        try {
            return parseObject(json).optString("type", null);
        } catch (InvalidStreamConfigException e) {
            LOG.debug("Unreadable text frame: {}", e.getMessage());
            return null;
        }
    }

    public static String encodeEvent(TranscriptEvent event) {
        JSONObject obj = new JSONObject().put("type", event.type().wireName());
        switch (event.type()) {
            case TRANSCRIPT -> {
                obj.put("segment", encodeSegment(event.segment()));
                obj.put("fullTranscript", event.fullTranscript() == null ? "" : event.fullTranscript());
            }
            case ERROR -> obj.put("message", event.message() == null ? "" : event.message());
            case METADATA -> obj.put("duration", event.durationSeconds() == null ? 0.0 : event.durationSeconds());
            default -> {
                // ready carries no payload
            }
        }
        return obj.toString();
    }

    /**
     * Parses an inbound event frame.
     *
     * @param json text frame payload
     * @return the event, or {@code null} if the frame is malformed or of an unknown type
     */
    public static TranscriptEvent parseEvent(String json) {
        try {
            JSONObject obj = parseObject(json);
            TranscriptEvent.Type type = TranscriptEvent.Type.fromWireName(obj.optString("type"));
            if (type == null) {
                LOG.debug("Ignoring event of unknown type '{}'", obj.optString("type"));
                return null;
            }
            return switch (type) {
                case READY -> TranscriptEvent.ready();
                case TRANSCRIPT -> TranscriptEvent.transcript(
                        decodeSegment(obj.getJSONObject("segment")),
                        obj.optString("fullTranscript", ""));
                case ERROR -> TranscriptEvent.error(obj.optString("message", ""));
                case METADATA -> TranscriptEvent.metadata(obj.optDouble("duration", 0.0));
            };
        } catch (InvalidStreamConfigException | JSONException | IllegalArgumentException e) {
            LOG.warn("Failed to parse event frame: {}", e.getMessage());
            return null;
        }
    }

    static JSONObject encodeSegment(TranscriptSegment segment) {
        return new JSONObject()
                .put("text", segment.text())
                .put("confidence", segment.confidence())
                .put("start", segment.start())
                .put("end", segment.end())
                .put("isFinal", segment.isFinal());
    }

    static TranscriptSegment decodeSegment(JSONObject obj) {
        double start = obj.optDouble("start", 0.0);
        return new TranscriptSegment(
                obj.optString("text", ""),
                Math.min(1.0, Math.max(0.0, obj.optDouble("confidence", 0.0))),
                start,
                Math.max(start, obj.optDouble("end", start)),
                obj.optBoolean("isFinal", false));
    }

    private static JSONObject parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidStreamConfigException("empty frame");
        }
        if (json.length() > MAX_FRAME_CHARS) {
            throw new InvalidStreamConfigException("frame exceeds " + MAX_FRAME_CHARS + " characters");
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new InvalidStreamConfigException("malformed JSON", e);
        }
    }
}
