package com.phillippitts.denoisebatch.service.engine;

import com.phillippitts.denoisebatch.domain.StreamInfo;

/**
 * Per-job engine state returned by {@link NoiseReductionEngine#prepare}. Closing releases
 * temp files or buffers held for the job.
 */
public interface EngineHandle extends AutoCloseable {

    StreamInfo stream();

    @Override
    default void close() {
    }
}
