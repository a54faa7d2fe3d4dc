package com.phillippitts.denoisebatch.domain;

import com.phillippitts.denoisebatch.exception.OutOfRangeException;

import static com.phillippitts.denoisebatch.exception.OutOfRangeException.requireInRange;

/**
 * Parameters for the two-stem source separation engine. The vocal stem is kept and the
 * remaining stem is attenuated by {@code reductionStrength}.
 *
 * @param modelId separation model name, e.g. {@code htdemucs}
 * @param device compute device hint: {@code cpu}, {@code cuda} or {@code mps}
 * @param reductionStrength how much of the non-vocal stem to remove, 0-1
 * @param segmentSeconds model segment length in seconds, or null for the model default
 * @param overlap overlap between segments, 0-0.5
 */
public record SourceSeparationConfig(
        String modelId,
        String device,
        double reductionStrength,
        Double segmentSeconds,
        double overlap
) implements EngineConfig {

    public static final String DEFAULT_MODEL = "htdemucs";

    public SourceSeparationConfig {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        if (device == null || device.isBlank()) {
            throw new IllegalArgumentException("device must not be blank");
        }
        requireInRange("reductionStrength", reductionStrength, 0.0, 1.0);
        requireInRange("overlap", overlap, 0.0, 0.5);
        if (segmentSeconds != null && !(segmentSeconds > 0.0)) {
            throw new OutOfRangeException("segmentSeconds", "must be positive, got " + segmentSeconds);
        }
    }

    public static SourceSeparationConfig defaults() {
        return new SourceSeparationConfig(DEFAULT_MODEL, "cpu", 0.8, null, 0.25);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.SOURCE_SEPARATION;
    }
}
