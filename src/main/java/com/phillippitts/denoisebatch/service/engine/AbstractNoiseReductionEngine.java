package com.phillippitts.denoisebatch.service.engine;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.BatchDenoiseException;
import com.phillippitts.denoisebatch.exception.EngineFailureException;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import org.springframework.context.ApplicationEventPublisher;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract base class for engines providing lifecycle, type checking and error handling.
 *
 * <p>This class implements the Template Method pattern. Subclasses supply
 * {@link #doInitialize()}, {@link #doClose()}, {@link #doPrepare}, {@link #doProcess} and
 * optionally {@link #doFinish}; the public methods add:
 * <ul>
 *   <li>idempotent, lock-guarded {@link #initialize()} and {@link #close()}</li>
 *   <li>rejection of another engine's config variant with {@link UnsupportedConfigurationException}</li>
 *   <li>a frame-count check on every processed buffer</li>
 *   <li>wrapping of unexpected errors into {@link EngineFailureException}, with an
 *       {@link EngineFailureEvent} published for monitoring</li>
 * </ul>
 *
 * <p><b>Lifecycle:</b> uninitialized, initialized, closed. Once closed the engine stays closed
 * until {@link #initialize()} is called again.
 *
 * @param <C> the config variant this engine accepts
 * @param <H> the engine's handle type
 * @see com.phillippitts.denoisebatch.service.engine.spectral.SpectralGateEngine
 * @see com.phillippitts.denoisebatch.service.engine.neural.NeuralDenoiseEngine
 * @see com.phillippitts.denoisebatch.service.engine.separation.SourceSeparationEngine
 */
public abstract class AbstractNoiseReductionEngine<C extends EngineConfig, H extends EngineHandle>
        implements NoiseReductionEngine {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    private final Class<C> configType;
    private final Class<H> handleType;
    private final ApplicationEventPublisher publisher;

    protected AbstractNoiseReductionEngine(Class<C> configType, Class<H> handleType,
                                           ApplicationEventPublisher publisher) {
        this.configType = Objects.requireNonNull(configType, "configType");
        this.handleType = Objects.requireNonNull(handleType, "handleType");
        this.publisher = publisher;
    }

    /**
     * @return engine name for logs, metrics and exception messages
     */
    public String getEngineName() {
        return kind().id();
    }

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            try {
                doInitialize();
            } catch (RuntimeException e) {
                throw handleEngineError(e, "initialize", Map.of());
            }
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific initialization. Called under {@link #lock}; throw
     * {@link EngineFailureException} if the engine cannot be used.
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (closed || !initialized) {
                closed = true;
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup. Must not throw; log failures instead.
     */
    protected abstract void doClose();

    @Override
    public final EngineHandle prepare(EngineConfig config, StreamInfo stream) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(stream, "stream");
        ensureInitialized();
        if (!configType.isInstance(config)) {
            throw new UnsupportedConfigurationException(
                    "Engine " + getEngineName() + " cannot run a " + config.kind().id() + " configuration",
                    config.kind().id());
        }
        try {
            return doPrepare(configType.cast(config), stream);
        } catch (UnsupportedConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw handleEngineError(e, "prepare", Map.of(
                    "sampleRate", Integer.toString(stream.sampleRate()),
                    "channels", Integer.toString(stream.channels())));
        }
    }

    /**
     * Validates parameters against the stream and builds the per-job handle.
     *
     * @throws UnsupportedConfigurationException if the parameters do not fit the stream
     */
    protected abstract H doPrepare(C config, StreamInfo stream);

    @Override
    public final void learnNoise(EngineHandle handle, AudioBuffer noise) {
        Objects.requireNonNull(noise, "noise");
        H h = castHandle(handle);
        ensureInitialized();
        if (noise.isEmpty()) {
            return;
        }
        try {
            doLearnNoise(h, noise);
        } catch (RuntimeException e) {
            throw handleEngineError(e, "learnNoise", Map.of("frames", Integer.toString(noise.frames())));
        }
    }

    /**
     * Accumulates a noise sample into the handle. The default ignores it.
     */
    protected void doLearnNoise(H handle, AudioBuffer noise) {
    }

    @Override
    public final AudioBuffer process(EngineHandle handle, AudioBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        H h = castHandle(handle);
        ensureInitialized();
        if (buffer.isEmpty()) {
            return buffer;
        }
        AudioBuffer out;
        try {
            out = doProcess(h, buffer);
        } catch (RuntimeException e) {
            throw handleEngineError(e, "process", Map.of("frames", Integer.toString(buffer.frames())));
        }
        if (out.frames() != buffer.frames() || out.channels() != buffer.channels()) {
            throw handleEngineError(new IllegalStateException("returned " + out.frames() + " frames x "
                    + out.channels() + " ch for " + buffer.frames() + " x " + buffer.channels()),
                    "process", Map.of());
        }
        return out;
    }

    protected abstract AudioBuffer doProcess(H handle, AudioBuffer buffer);

    @Override
    public final AudioBuffer finish(EngineHandle handle) {
        H h = castHandle(handle);
        ensureInitialized();
        try {
            return doFinish(h);
        } catch (RuntimeException e) {
            throw handleEngineError(e, "finish", Map.of());
        }
    }

    /**
     * Returns buffered tail audio. Engines without look-ahead return an empty buffer.
     */
    protected AudioBuffer doFinish(H handle) {
        return AudioBuffer.empty(handle.stream().channels(), handle.stream().sampleRate());
    }

    /**
     * @throws EngineFailureException if the engine is not initialized or already closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new EngineFailureException(getEngineName() + " engine not initialized or closed",
                        getEngineName());
            }
        }
    }

    /**
     * Publishes a failure event and converts {@code exception} to the exception to throw.
     * {@link BatchDenoiseException}s pass through unchanged; anything else is wrapped into an
     * {@link EngineFailureException}.
     *
     * @return exception for the caller to throw
     */
    protected final BatchDenoiseException handleEngineError(Exception exception, String stage,
                                                            Map<String, String> context) {
        Map<String, String> ctx = new HashMap<>(context);
        ctx.put("stage", stage);
        EngineEventPublisher.publishFailure(publisher, getEngineName(), stage + " failure", exception, ctx);
        if (exception instanceof BatchDenoiseException bde) {
            return bde;
        }
        return new EngineFailureException(
                getEngineName() + " " + stage + " failed: " + exception.getMessage(),
                getEngineName(),
                exception);
    }

    private H castHandle(EngineHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (!handleType.isInstance(handle)) {
            throw new IllegalArgumentException("Handle " + handle.getClass().getSimpleName()
                    + " was not created by " + getEngineName());
        }
        return handleType.cast(handle);
    }
}
