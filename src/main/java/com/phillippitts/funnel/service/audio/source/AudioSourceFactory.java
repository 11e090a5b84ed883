package com.phillippitts.funnel.service.audio.source;

import com.phillippitts.funnel.config.properties.AudioCaptureProperties;
import com.phillippitts.funnel.exception.EncodingFailureException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Selects the audio source for a new recording from configuration.
 */
public class AudioSourceFactory {

    private final AudioCaptureProperties props;
    private final MicrophoneAudioSource.DataLineProvider lineProvider;

    public AudioSourceFactory(AudioCaptureProperties props) {
        this(props, MicrophoneAudioSource.defaultProvider());
    }

    public AudioSourceFactory(AudioCaptureProperties props, MicrophoneAudioSource.DataLineProvider lineProvider) {
        this.props = Objects.requireNonNull(props);
        this.lineProvider = Objects.requireNonNull(lineProvider);
    }

    public AudioSource create() {
        return switch (props.getSource()) {
            case MICROPHONE -> new MicrophoneAudioSource(props.getSampleRate(), props.getDeviceName(), lineProvider);
            case FILE -> {
                if (props.getFile() == null) {
                    throw new EncodingFailureException("funnel.client.capture.file is required when source=FILE");
                }
                yield new FilePlaybackAudioSource(Path.of(props.getFile()), true);
            }
        };
    }
}
