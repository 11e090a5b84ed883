package com.phillippitts.funnel.service.audio.source;

import com.phillippitts.funnel.exception.PermissionDeniedException;
import com.phillippitts.funnel.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.TargetDataLine;

/**
 * Probes the Java Sound system for a usable capture line.
 *
 * <p>Java Sound reports refused access as {@link SecurityException}; that is mapped to
 * {@link PermissionDeniedException}. A missing device is not a permission problem and is
 * reported later by the capture thread.
 */
public class JavaSoundMicrophonePermission implements MicrophonePermission {

    private static final Logger LOG = LogManager.getLogger(JavaSoundMicrophonePermission.class);

    private final int sampleRate;

    public JavaSoundMicrophonePermission(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    @Override
    public void check() {
        try {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, AudioFormat.javaSoundFormat(sampleRate));
            if (!AudioSystem.isLineSupported(info)) {
                LOG.warn("No capture line supports {} Hz 16-bit mono; capture may fail", sampleRate);
            }
        } catch (SecurityException e) {
            throw new PermissionDeniedException("Microphone access denied", e);
        }
    }
}
