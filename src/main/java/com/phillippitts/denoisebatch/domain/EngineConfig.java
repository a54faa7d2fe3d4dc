package com.phillippitts.denoisebatch.domain;

import java.util.Optional;

/**
 * Engine-specific parameter set. Each engine kind has exactly one record implementing this
 * interface, so a config always carries one active variant and switching kinds means building
 * a new record.
 *
 * <p>Implementations are immutable; a {@link Job} holds the instance it was enqueued with.
 *
 * @see SpectralGateConfig
 * @see NeuralDenoiseConfig
 * @see SourceSeparationConfig
 */
public interface EngineConfig {

    /**
     * @return the variant tag, used by the engine registry for dispatch
     */
    EngineKind kind();

    /**
     * @return a noise-only span of the input to learn from before processing, if the config names one
     */
    default Optional<NoiseWindow> noiseWindow() {
        return Optional.empty();
    }
}
