package com.phillippitts.denoisebatch.service.media;

import com.phillippitts.denoisebatch.domain.AudioBuffer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Streaming sink for processed audio. The target file is only guaranteed complete after
 * {@link #complete()} returns; {@link #abort()} removes whatever was written.
 */
public interface MediaEncoder extends AutoCloseable {

    Path target();

    /**
     * Appends one buffer. Buffers must share the layout the encoder was opened with.
     */
    void write(AudioBuffer buffer) throws IOException;

    /**
     * Flushes, finalizes headers or remuxes, and waits for the file to be fully written.
     *
     * @throws IOException if the file could not be finalized; the partial file is removed
     */
    void complete() throws IOException;

    /**
     * Stops encoding and deletes the partial target. Idempotent and never throws.
     */
    void abort();

    boolean isCompleted();

    /**
     * Aborts unless {@link #complete()} succeeded.
     */
    @Override
    default void close() {
        if (!isCompleted()) {
            abort();
        }
    }
}
