package com.phillippitts.funnel.testutil;

import com.phillippitts.funnel.service.audio.source.AudioSource;
import com.phillippitts.funnel.service.audio.source.SampleStream;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Audio source producing a fixed number of constant-valued chunks, or an endless paced stream.
 */
public final class ScriptedAudioSource implements AudioSource {

    private final int sampleRate;
    private final int chunks;
    private final float value;
    private final boolean live;
    private final long pauseMillis;
    private final AtomicInteger opened = new AtomicInteger();
    private volatile IOException openFailure;

    private ScriptedAudioSource(int sampleRate, int chunks, float value, boolean live, long pauseMillis) {
        this.sampleRate = sampleRate;
        this.chunks = chunks;
        this.value = value;
        this.live = live;
        this.pauseMillis = pauseMillis;
    }

    /** {@code chunks} chunks of {@code value}, then end of stream. */
    public static ScriptedAudioSource finite(int sampleRate, int chunks, float value) {
        return new ScriptedAudioSource(sampleRate, chunks, value, false, 0);
    }

    /** Unbounded chunks of silence-ish audio, one every 5ms. */
    public static ScriptedAudioSource endless(int sampleRate, boolean live) {
        return new ScriptedAudioSource(sampleRate, Integer.MAX_VALUE, 0.1f, live, 5);
    }

    public ScriptedAudioSource failingOpen(IOException failure) {
        this.openFailure = failure;
        return this;
    }

    public int timesOpened() {
        return opened.get();
    }

    @Override
    public String name() {
        return "scripted";
    }

    @Override
    public int sampleRate() {
        return sampleRate;
    }

    @Override
    public boolean isLive() {
        return live;
    }

    @Override
    public SampleStream open() throws IOException {
        opened.incrementAndGet();
        if (openFailure != null) {
            throw openFailure;
        }
        return new SampleStream() {
            private int produced;

            @Override
            public int read(float[] buffer) throws IOException {
                if (produced >= chunks) {
                    return -1;
                }
                if (pauseMillis > 0) {
                    try {
                        Thread.sleep(pauseMillis);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted", e);
                    }
                }
                produced++;
                Arrays.fill(buffer, value);
                return buffer.length;
            }

            @Override
            public void close() {
            }
        };
    }
}
