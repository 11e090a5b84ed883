package com.phillippitts.funnel.service.audio.archive;

import com.phillippitts.funnel.service.audio.AudioFrame;

import java.io.IOException;

/**
 * Optional local copy of a recording's frames, written alongside streaming.
 */
public interface ArchiveSink extends AutoCloseable {

    void write(AudioFrame frame) throws IOException;

    @Override
    void close() throws IOException;
}
