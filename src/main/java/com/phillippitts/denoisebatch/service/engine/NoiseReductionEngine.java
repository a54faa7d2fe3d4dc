package com.phillippitts.denoisebatch.service.engine;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.EngineFailureException;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;

/**
 * Contract for noise-reduction algorithms. Implementations wrap very different back ends (an
 * in-process FFT gate, an ffmpeg filter, a separation model CLI) behind one chunked interface.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #initialize()} once per engine instance (idempotent)</li>
 *   <li>{@link #prepare(EngineConfig, StreamInfo)} once per job; all per-job state lives in the
 *       returned handle</li>
 *   <li>{@link #process(EngineHandle, AudioBuffer)} for every decoded buffer, in order</li>
 *   <li>{@link #finish(EngineHandle)} once at end of stream, then close the handle</li>
 *   <li>{@link #close()} when the owning worker exits (idempotent)</li>
 * </ol>
 *
 * <p>An instance is used by one worker at a time. It may be reused for several jobs in
 * sequence but never holds state from one job into the next.
 */
public interface NoiseReductionEngine extends AutoCloseable {

    EngineKind kind();

    /**
     * Loads models or checks external tools.
     *
     * @throws EngineFailureException if the engine cannot become ready
     */
    void initialize();

    /**
     * Validates {@code config} against the input stream and creates per-job state.
     *
     * @param config engine parameters; must be this engine's variant
     * @param stream layout of the buffers that will be processed
     * @return handle to pass to {@link #process} and {@link #finish}
     * @throws UnsupportedConfigurationException if the parameters do not fit the stream or the
     *         config is another engine's variant
     * @throws EngineFailureException if required resources (model files, tools) are missing
     */
    EngineHandle prepare(EngineConfig config, StreamInfo stream);

    /**
     * Feeds audio known to contain only noise, before the first {@link #process} call. Engines
     * that do not learn a noise profile ignore it.
     */
    void learnNoise(EngineHandle handle, AudioBuffer noise);

    /**
     * Processes one buffer.
     *
     * @return buffer with the same frame count and layout as {@code buffer}
     * @throws EngineFailureException on processing failure
     */
    AudioBuffer process(EngineHandle handle, AudioBuffer buffer);

    /**
     * Flushes the end of the stream.
     *
     * @return remaining audio, possibly empty
     */
    AudioBuffer finish(EngineHandle handle);

    boolean isHealthy();

    @Override
    void close();
}
