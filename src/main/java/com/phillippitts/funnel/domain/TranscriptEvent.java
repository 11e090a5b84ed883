package com.phillippitts.funnel.domain;

import java.util.Objects;

/**
 * An inbound event frame on the streaming connection (relay → client).
 *
 * <p>Field usage depends on {@link #type()}:
 * <ul>
 *   <li>{@code READY}: no payload</li>
 *   <li>{@code TRANSCRIPT}: {@code segment} and {@code fullTranscript}</li>
 *   <li>{@code ERROR}: {@code message}</li>
 *   <li>{@code METADATA}: {@code durationSeconds}</li>
 * </ul>
 */
public record TranscriptEvent(
        Type type,
        TranscriptSegment segment,
        String fullTranscript,
        String message,
        Double durationSeconds
) {

    /** Event discriminant; {@link #wireName()} is the JSON {@code type} value. */
    public enum Type {
        READY("ready"),
        TRANSCRIPT("transcript"),
        ERROR("error"),
        METADATA("metadata");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Type fromWireName(String name) {
            for (Type t : values()) {
                if (t.wireName.equals(name)) {
                    return t;
                }
            }
            return null;
        }
    }

    public TranscriptEvent {
        Objects.requireNonNull(type, "type must not be null");
        if (type == Type.TRANSCRIPT) {
            Objects.requireNonNull(segment, "transcript event requires a segment");
        }
    }

    public static TranscriptEvent ready() {
        return new TranscriptEvent(Type.READY, null, null, null, null);
    }

    public static TranscriptEvent transcript(TranscriptSegment segment, String fullTranscript) {
        return new TranscriptEvent(Type.TRANSCRIPT, segment, fullTranscript, null, null);
    }

    public static TranscriptEvent error(String message) {
        return new TranscriptEvent(Type.ERROR, null, null, message, null);
    }

    public static TranscriptEvent metadata(double durationSeconds) {
        return new TranscriptEvent(Type.METADATA, null, null, null, durationSeconds);
    }
}
