package com.phillippitts.funnel.service.audio.source;

import javax.sound.sampled.LineUnavailableException;
import java.io.IOException;

/**
 * Where a recording's audio comes from.
 *
 * <p>Implementations produce normalized float samples through a {@link SampleStream}; conversion
 * to the wire format happens downstream. A source is chosen once per recording by
 * {@link AudioSourceFactory}.
 */
public interface AudioSource {

    /** Short description for logs, e.g. {@code microphone(default)} or {@code file(a.wav)}. */
    String name();

    /** Sample rate of the samples {@link #open()} will produce; declared in the config frame. */
    int sampleRate();

    /** Whether this source is a live device that needs microphone permission. */
    boolean isLive();

    /**
     * Opens a new sample stream. The caller owns and must close it.
     *
     * @throws LineUnavailableException if a device line cannot be opened
     * @throws IOException              if a file source cannot be read
     */
    SampleStream open() throws LineUnavailableException, IOException;
}
