package com.phillippitts.funnel.protocol;

import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.exception.InvalidStreamConfigException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamProtocolTest {

    @Test
    void configFrameHasWireFieldNames() {
        JSONObject json = new JSONObject(StreamProtocol.encodeConfig(StreamConfig.pcm16Mono(16_000)));

        assertThat(json.getString("type")).isEqualTo("config");
        assertThat(json.getString("format")).isEqualTo("pcm16");
        assertThat(json.getInt("sampleRate")).isEqualTo(16_000);
        assertThat(json.getInt("channels")).isEqualTo(1);
    }

    @Test
    void parsesConfigWithDefaultsForOptionalFields() {
        StreamConfig config = StreamProtocol.parseConfig("{\"type\":\"config\",\"sampleRate\":44100}");

        assertThat(config).isEqualTo(new StreamConfig("pcm16", 44_100, 1));
    }

    @Test
    void rejectsConfigWithoutSampleRate() {
        assertThatThrownBy(() -> StreamProtocol.parseConfig("{\"type\":\"config\",\"format\":\"pcm16\"}"))
                .isInstanceOf(InvalidStreamConfigException.class)
                .hasMessageContaining("sampleRate");
    }

    @Test
    void rejectsNonConfigFrameAndMalformedJson() {
        assertThatThrownBy(() -> StreamProtocol.parseConfig("{\"type\":\"ready\"}"))
                .isInstanceOf(InvalidStreamConfigException.class);
        assertThatThrownBy(() -> StreamProtocol.parseConfig("{not json"))
                .isInstanceOf(InvalidStreamConfigException.class)
                .hasMessageContaining("malformed");
        assertThatThrownBy(() -> StreamProtocol.parseConfig("{\"type\":\"config\",\"sampleRate\":\"fast\"}"))
                .isInstanceOf(InvalidStreamConfigException.class);
    }

    @Test
    void peekTypeReturnsNullForUnreadableFrames() {
        assertThat(StreamProtocol.peekType("{\"type\":\"config\"}")).isEqualTo("config");
        assertThat(StreamProtocol.peekType("garbage")).isNull();
        assertThat(StreamProtocol.peekType("{}")).isNull();
    }

    @Test
    void transcriptEventCarriesSegmentAndFullTranscript() {
        TranscriptSegment segment = TranscriptSegment.finalSegment("hello", 0.87, 1.0, 1.5);
        JSONObject json = new JSONObject(StreamProtocol.encodeEvent(TranscriptEvent.transcript(segment, "well hello")));

        assertThat(json.getString("type")).isEqualTo("transcript");
        assertThat(json.getString("fullTranscript")).isEqualTo("well hello");
        JSONObject seg = json.getJSONObject("segment");
        assertThat(seg.getString("text")).isEqualTo("hello");
        assertThat(seg.getDouble("confidence")).isEqualTo(0.87);
        assertThat(seg.getDouble("start")).isEqualTo(1.0);
        assertThat(seg.getDouble("end")).isEqualTo(1.5);
        assertThat(seg.getBoolean("isFinal")).isTrue();
    }

    @Test
    void parsesEachEventType() {
        assertThat(StreamProtocol.parseEvent("{\"type\":\"ready\"}").type()).isEqualTo(TranscriptEvent.Type.READY);
        assertThat(StreamProtocol.parseEvent("{\"type\":\"error\",\"message\":\"nope\"}").message()).isEqualTo("nope");
        assertThat(StreamProtocol.parseEvent("{\"type\":\"metadata\",\"duration\":4.25}").durationSeconds())
                .isEqualTo(4.25);

        TranscriptEvent transcript = StreamProtocol.parseEvent(
                "{\"type\":\"transcript\",\"fullTranscript\":\"a b\","
                        + "\"segment\":{\"text\":\"b\",\"confidence\":0.5,\"start\":0.5,\"end\":1.0,\"isFinal\":false}}");
        assertThat(transcript.segment().text()).isEqualTo("b");
        assertThat(transcript.segment().isFinal()).isFalse();
        assertThat(transcript.fullTranscript()).isEqualTo("a b");
    }

    @Test
    void unknownOrMalformedEventsAreIgnored() {
        assertThat(StreamProtocol.parseEvent("{\"type\":\"keepalive\"}")).isNull();
        assertThat(StreamProtocol.parseEvent("[1,2]")).isNull();
        assertThat(StreamProtocol.parseEvent("{\"type\":\"transcript\"}")).isNull();
    }

    @Test
    void segmentDecodingClampsOutOfRangeValues() {
        TranscriptSegment segment = StreamProtocol.decodeSegment(
                new JSONObject("{\"text\":\"x\",\"confidence\":1.7,\"start\":2.0,\"end\":1.0}"));

        assertThat(segment.confidence()).isEqualTo(1.0);
        assertThat(segment.end()).isEqualTo(2.0);
        assertThat(segment.isFinal()).isFalse();
    }
}
