package com.phillippitts.funnel.service.audio.source;

import java.io.IOException;

/**
 * Pull-based, cancelable sequence of normalized mono float samples.
 */
public interface SampleStream extends AutoCloseable {

    /**
     * Reads up to {@code buffer.length} samples, blocking until at least one is available.
     *
     * @return number of samples read, or {@code -1} at end of stream
     */
    int read(float[] buffer) throws IOException;

    @Override
    void close() throws IOException;
}
