package com.phillippitts.denoisebatch.service.engine.spectral;

import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;

import java.util.Arrays;

/**
 * Per-job gate state: the noise profile and the previous frame's gains for each channel. With a
 * manual noise window the profile is filled by {@code learnNoise} before processing and stays fixed
 * in stationary mode.
 */
final class SpectralGateHandle implements EngineHandle {

    final SpectralGateConfig config;
    final StreamInfo stream;
    final int frameSize;
    final int bins;
    final int learnFrames;
    final double[][] noiseProfile;
    final double[][] previousGain;
    final boolean manualProfile;
    int framesSeen;
    int noiseFramesLearned;

    SpectralGateHandle(SpectralGateConfig config, StreamInfo stream, int frameSize) {
        this.config = config;
        this.stream = stream;
        this.frameSize = frameSize;
        this.bins = frameSize / 2 + 1;
        this.learnFrames = Math.max(1, (int) Math.ceil(config.noiseLearnSeconds() * stream.sampleRate() / frameSize));
        this.noiseProfile = new double[stream.channels()][bins];
        this.previousGain = new double[stream.channels()][bins];
        this.manualProfile = config.noiseWindow().isPresent();
        for (double[] g : previousGain) {
            Arrays.fill(g, 1.0);
        }
    }

    boolean learning() {
        return config.stationary() && !manualProfile && framesSeen < learnFrames;
    }

    @Override
    public StreamInfo stream() {
        return stream;
    }
}
