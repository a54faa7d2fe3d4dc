package com.phillippitts.denoisebatch.domain;

import static com.phillippitts.denoisebatch.exception.OutOfRangeException.requireInRange;

/**
 * Parameters for the RNNoise-based neural denoiser.
 *
 * @param modelId standard model id ({@code bd}, {@code cb}, {@code mp}, {@code sh}) or a path
 *                to an {@code .rnnn} model file
 * @param mixFactor blend of processed and original signal; 1.0 is fully processed
 * @param targetSampleRate sample rate the model runs at; input must match
 */
public record NeuralDenoiseConfig(
        String modelId,
        double mixFactor,
        int targetSampleRate
) implements EngineConfig {

    public static final String DEFAULT_MODEL = "sh";
    public static final int DEFAULT_SAMPLE_RATE = 48_000;

    public NeuralDenoiseConfig {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        requireInRange("mixFactor", mixFactor, 0.0, 1.0);
        requireInRange("targetSampleRate", targetSampleRate, 8_000, 192_000);
    }

    public static NeuralDenoiseConfig defaults() {
        return new NeuralDenoiseConfig(DEFAULT_MODEL, 1.0, DEFAULT_SAMPLE_RATE);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.NEURAL_DENOISE;
    }
}
