package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.NeuralDenoiseConfig;
import com.phillippitts.denoisebatch.domain.SourceSeparationConfig;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;

/**
 * Flat JSON form of an engine config. Only the fields of the selected {@code kind} are read;
 * missing fields take the engine's defaults.
 */
public record EngineConfigRequest(
        String kind,
        Double reductionDb,
        Boolean stationary,
        Double timeSmoothing,
        Double frequencySmoothing,
        Double propDecrease,
        Double noiseLearnSeconds,
        Double noiseStartSeconds,
        Double noiseEndSeconds,
        String modelId,
        Double mixFactor,
        Integer targetSampleRate,
        String device,
        Double reductionStrength,
        Double segmentSeconds,
        Double overlap
) {

    /**
     * @throws IllegalArgumentException if the kind is unknown
     * @throws com.phillippitts.denoisebatch.exception.OutOfRangeException if a parameter is out of range
     */
    public EngineConfig toConfig() {
        EngineKind engineKind = kind == null ? EngineKind.SPECTRAL_GATE : EngineKind.fromId(kind);
        return switch (engineKind) {
            case SPECTRAL_GATE -> {
                SpectralGateConfig d = SpectralGateConfig.defaults();
                yield new SpectralGateConfig(
                        or(reductionDb, d.reductionDb()),
                        stationary != null ? stationary : d.stationary(),
                        or(timeSmoothing, d.timeSmoothing()),
                        or(frequencySmoothing, d.frequencySmoothing()),
                        or(propDecrease, d.propDecrease()),
                        or(noiseLearnSeconds, d.noiseLearnSeconds()),
                        noiseStartSeconds,
                        noiseEndSeconds);
            }
            case NEURAL_DENOISE -> {
                NeuralDenoiseConfig d = NeuralDenoiseConfig.defaults();
                yield new NeuralDenoiseConfig(
                        modelId != null ? modelId : d.modelId(),
                        or(mixFactor, d.mixFactor()),
                        targetSampleRate != null ? targetSampleRate : d.targetSampleRate());
            }
            case SOURCE_SEPARATION -> {
                SourceSeparationConfig d = SourceSeparationConfig.defaults();
                yield new SourceSeparationConfig(
                        modelId != null ? modelId : d.modelId(),
                        device != null ? device : d.device(),
                        or(reductionStrength, d.reductionStrength()),
                        segmentSeconds,
                        or(overlap, d.overlap()));
            }
        };
    }

    private static double or(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
