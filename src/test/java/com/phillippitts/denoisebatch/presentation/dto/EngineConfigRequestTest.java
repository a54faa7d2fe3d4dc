package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.NeuralDenoiseConfig;
import com.phillippitts.denoisebatch.domain.SourceSeparationConfig;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.exception.OutOfRangeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigRequestTest {

    @Test
    void missingKindShouldDefaultToSpectralGate() {
        EngineConfig config = request(null, null, null, null, null).toConfig();

        assertThat(config).isEqualTo(SpectralGateConfig.defaults());
    }

    @Test
    void spectralOverridesShouldApply() {
        EngineConfigRequest request = new EngineConfigRequest("spectral-gate", 12.0, false, null, null, 0.5, null,
                null, null, null, null, null, null, null, null, null);

        SpectralGateConfig config = (SpectralGateConfig) request.toConfig();

        assertThat(config.reductionDb()).isEqualTo(12.0);
        assertThat(config.stationary()).isFalse();
        assertThat(config.propDecrease()).isEqualTo(0.5);
        assertThat(config.timeSmoothing()).isEqualTo(SpectralGateConfig.defaults().timeSmoothing());
    }

    @Test
    void neuralRequestShouldFillDefaults() {
        NeuralDenoiseConfig config = (NeuralDenoiseConfig) request("neural_denoise", "bd", 0.7, null, null).toConfig();

        assertThat(config.modelId()).isEqualTo("bd");
        assertThat(config.mixFactor()).isEqualTo(0.7);
        assertThat(config.targetSampleRate()).isEqualTo(NeuralDenoiseConfig.DEFAULT_SAMPLE_RATE);
    }

    @Test
    void separationRequestShouldKeepNullSegment() {
        SourceSeparationConfig config =
                (SourceSeparationConfig) request("SOURCE_SEPARATION", null, null, "cuda", 0.5).toConfig();

        assertThat(config.modelId()).isEqualTo(SourceSeparationConfig.DEFAULT_MODEL);
        assertThat(config.device()).isEqualTo("cuda");
        assertThat(config.reductionStrength()).isEqualTo(0.5);
        assertThat(config.segmentSeconds()).isNull();
    }

    @Test
    void outOfRangeParameterShouldBeRejected() {
        assertThatThrownBy(() -> request("neural_denoise", null, 1.5, null, null).toConfig())
                .isInstanceOf(OutOfRangeException.class)
                .hasMessageContaining("mixFactor");
    }

    @Test
    void unknownKindShouldBeRejected() {
        assertThatThrownBy(() -> request("wavelet", null, null, null, null).toConfig())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("wavelet");
    }

    private static EngineConfigRequest request(String kind, String modelId, Double mixFactor, String device,
                                               Double reductionStrength) {
        return new EngineConfigRequest(kind, null, null, null, null, null, null, null, null, modelId, mixFactor,
                null, device, reductionStrength, null, null);
    }
}
