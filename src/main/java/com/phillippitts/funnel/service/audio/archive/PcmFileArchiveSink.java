package com.phillippitts.funnel.service.audio.archive;

import com.phillippitts.funnel.service.audio.AudioFrame;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes raw PCM16LE frames to {@code <dir>/recording-<sessionId>.pcm}, with no container header.
 */
public final class PcmFileArchiveSink implements ArchiveSink {

    private final Path file;
    private final OutputStream out;
    private long bytesWritten;

    private PcmFileArchiveSink(Path file, OutputStream out) {
        this.file = file;
        this.out = out;
    }

    public static PcmFileArchiveSink open(Path dir, String sessionId) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve("recording-" + sessionId.replaceAll("[^A-Za-z0-9._-]", "_") + ".pcm");
        return new PcmFileArchiveSink(file, new BufferedOutputStream(Files.newOutputStream(file)));
    }

    @Override
    public void write(AudioFrame frame) throws IOException {
        out.write(frame.pcm());
        bytesWritten += frame.byteLength();
    }

    public Path file() {
        return file;
    }

    public long bytesWritten() {
        return bytesWritten;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
