package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import com.phillippitts.funnel.service.audio.AudioFrame;
import com.phillippitts.funnel.testutil.FakeStreamTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AudioFrameSenderTest {

    private static final TransportListener IGNORE = new TransportListener() {
        @Override
        public void onEvent(TranscriptEvent event) {
        }

        @Override
        public void onError(Throwable error) {
        }

        @Override
        public void onClosed(int code, String reason) {
        }
    };

    private static FakeStreamTransport.FakeConnection connection() {
        return (FakeStreamTransport.FakeConnection) new FakeStreamTransport().silentRelay().connect("s1", IGNORE);
    }

    private static AudioFrame frame(int marker) {
        byte[] pcm = new byte[320];
        pcm[0] = (byte) marker;
        return new AudioFrame(pcm, 160, 0.0);
    }

    @Test
    void sendsFramesInOfferOrder() {
        FakeStreamTransport.FakeConnection conn = connection();
        AudioFrameSender sender = new AudioFrameSender(conn, 100, e -> { });
        sender.start();

        for (int i = 0; i < 20; i++) {
            assertThat(sender.offer(frame(i))).isTrue();
        }
        assertThat(sender.drain(Duration.ofSeconds(2))).isTrue();

        assertThat(conn.frames()).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(conn.frames().get(i)[0]).isEqualTo((byte) i);
        }
        assertThat(sender.framesSent()).isEqualTo(20);
        assertThat(sender.bytesSent()).isEqualTo(20 * 320);
    }

    @Test
    void drainSendsEverythingQueuedBeforeStart() {
        FakeStreamTransport.FakeConnection conn = connection();
        AudioFrameSender sender = new AudioFrameSender(conn, 10, e -> { });

        sender.offer(frame(1));
        sender.offer(frame(2));
        sender.start();

        assertThat(sender.drain(Duration.ofSeconds(2))).isTrue();
        assertThat(conn.frames()).hasSize(2);
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() {
        FakeStreamTransport.FakeConnection conn = connection();
        AudioFrameSender sender = new AudioFrameSender(conn, 2, e -> { });

        assertThat(sender.offer(frame(1))).isTrue();
        assertThat(sender.offer(frame(2))).isTrue();
        assertThat(sender.offer(frame(3))).isFalse();

        assertThat(sender.framesDropped()).isEqualTo(1);
        assertThat(sender.queued()).isEqualTo(2);
    }

    @Test
    void offersAfterDrainAreRejected() {
        AudioFrameSender sender = new AudioFrameSender(connection(), 10, e -> { });
        sender.start();
        sender.drain(Duration.ofSeconds(1));

        assertThat(sender.offer(frame(1))).isFalse();
    }

    @Test
    void sendFailureClearsQueueAndIsReported() {
        FakeStreamTransport.FakeConnection conn = connection();
        conn.failSendsWith(new ConnectionFailureException("socket closed", "s1"));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AudioFrameSender sender = new AudioFrameSender(conn, 10, failure::set);
        sender.offer(frame(1));
        sender.offer(frame(2));

        sender.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> failure.get() != null);
        assertThat(failure.get()).isInstanceOf(ConnectionFailureException.class);
        assertThat(sender.framesSent()).isZero();
        assertThat(sender.queued()).isZero();
    }

    @Test
    void cancelDiscardsQueueAndIsIdempotent() {
        FakeStreamTransport.FakeConnection conn = connection();
        AudioFrameSender sender = new AudioFrameSender(conn, 10, e -> { });
        sender.offer(frame(1));
        sender.offer(frame(2));

        sender.cancel();
        sender.cancel();

        assertThat(sender.queued()).isZero();
        assertThat(sender.offer(frame(3))).isFalse();
        assertThat(conn.frames()).isEmpty();
    }
}
