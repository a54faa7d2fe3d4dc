package com.phillippitts.denoisebatch.domain;

import com.phillippitts.denoisebatch.exception.OutOfRangeException;

import java.util.Optional;

import static com.phillippitts.denoisebatch.exception.OutOfRangeException.requireInRange;

/**
 * Parameters for the frequency-domain noise gate.
 *
 * @param reductionDb maximum attenuation applied to bins classified as noise, 0-60 dB
 * @param stationary true to learn one noise profile from the start of the stream; false to
 *                   track the noise floor adaptively
 * @param timeSmoothing smoothing of per-bin gains across frames, 0-1
 * @param frequencySmoothing smoothing of gains across neighbouring bins, 0-1
 * @param propDecrease proportion of the computed reduction actually applied, 0-1
 * @param noiseLearnSeconds length of the learning window for stationary mode, seconds
 * @param noiseStartSeconds start of a manually chosen noise-only span, or null
 * @param noiseEndSeconds end of that span, or null; set together with {@code noiseStartSeconds}
 */
public record SpectralGateConfig(
        double reductionDb,
        boolean stationary,
        double timeSmoothing,
        double frequencySmoothing,
        double propDecrease,
        double noiseLearnSeconds,
        Double noiseStartSeconds,
        Double noiseEndSeconds
) implements EngineConfig {

    public SpectralGateConfig {
        requireInRange("reductionDb", reductionDb, 0.0, 60.0);
        requireInRange("timeSmoothing", timeSmoothing, 0.0, 1.0);
        requireInRange("frequencySmoothing", frequencySmoothing, 0.0, 1.0);
        requireInRange("propDecrease", propDecrease, 0.0, 1.0);
        requireInRange("noiseLearnSeconds", noiseLearnSeconds, 0.05, 30.0);
        if ((noiseStartSeconds == null) != (noiseEndSeconds == null)) {
            throw new OutOfRangeException("noiseStartSeconds",
                    "noiseStartSeconds and noiseEndSeconds must be given together");
        }
        if (noiseStartSeconds != null) {
            new NoiseWindow(noiseStartSeconds, noiseEndSeconds);
        }
    }

    /**
     * Config that learns noise from the first {@code noiseLearnSeconds} of the stream.
     */
    public SpectralGateConfig(double reductionDb, boolean stationary, double timeSmoothing,
                              double frequencySmoothing, double propDecrease, double noiseLearnSeconds) {
        this(reductionDb, stationary, timeSmoothing, frequencySmoothing, propDecrease, noiseLearnSeconds,
                null, null);
    }

    public static SpectralGateConfig defaults() {
        return new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 0.5);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.SPECTRAL_GATE;
    }

    @Override
    public Optional<NoiseWindow> noiseWindow() {
        return noiseStartSeconds == null
                ? Optional.empty()
                : Optional.of(new NoiseWindow(noiseStartSeconds, noiseEndSeconds));
    }
}
