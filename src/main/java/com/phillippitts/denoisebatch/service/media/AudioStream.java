package com.phillippitts.denoisebatch.service.media;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.StreamInfo;

import java.io.IOException;

/**
 * A lazily decoded, finite sequence of fixed-size audio buffers. To read the file again,
 * open a new stream.
 */
public interface AudioStream extends AutoCloseable {

    /**
     * @return layout of the buffers this stream yields
     */
    StreamInfo info();

    /**
     * Reads the next buffer.
     *
     * @return next buffer (the last one may be shorter), or null at end of stream
     * @throws IOException on decode failure
     */
    AudioBuffer read() throws IOException;

    /**
     * Releases the underlying file or decoder process. Idempotent.
     */
    @Override
    void close();
}
