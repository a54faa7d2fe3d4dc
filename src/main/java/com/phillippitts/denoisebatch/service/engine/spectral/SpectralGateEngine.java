package com.phillippitts.denoisebatch.service.engine.spectral;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import com.phillippitts.denoisebatch.service.engine.AbstractNoiseReductionEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

/**
 * In-process spectral noise gate.
 *
 * <p>Each channel is cut into frames of roughly 46 ms. Per frame and bin, magnitudes above the
 * noise estimate times {@link #THRESHOLD_FACTOR} pass; others are attenuated by
 * {@code reductionDb}, scaled by {@code propDecrease}. Gains are smoothed across bins and frames
 * before being applied.
 *
 * <p>Noise estimate:
 * <ul>
 *   <li>stationary: mean magnitude over the first {@code noiseLearnSeconds}, then fixed</li>
 *   <li>non-stationary: a floor tracker that falls quickly and rises slowly</li>
 *   <li>manual window: mean magnitude of the audio passed to {@code learnNoise}; fixed when
 *       stationary, otherwise the tracker's starting point</li>
 * </ul>
 *
 * <p>Frames never straddle buffers; a short final frame is zero-padded, so every buffer comes
 * back with exactly its own length.
 */
public class SpectralGateEngine extends AbstractNoiseReductionEngine<SpectralGateConfig, SpectralGateHandle> {

    private static final Logger LOG = LogManager.getLogger(SpectralGateEngine.class);

    static final int MIN_SAMPLE_RATE = 8_000;
    static final int MAX_CHANNELS = 8;
    static final double FRAME_SECONDS = 0.046;
    static final double THRESHOLD_FACTOR = 2.0;
    static final int MAX_FREQUENCY_RADIUS = 8;

    private static final double FLOOR_FALL = 0.3;
    private static final double FLOOR_RISE = 0.005;

    public SpectralGateEngine() {
        this(null);
    }

    public SpectralGateEngine(ApplicationEventPublisher publisher) {
        super(SpectralGateConfig.class, SpectralGateHandle.class, publisher);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.SPECTRAL_GATE;
    }

    @Override
    protected void doInitialize() {
        LOG.debug("Spectral gate ready");
    }

    @Override
    protected void doClose() {
        LOG.debug("Spectral gate closed");
    }

    @Override
    protected SpectralGateHandle doPrepare(SpectralGateConfig config, StreamInfo stream) {
        if (stream.sampleRate() < MIN_SAMPLE_RATE) {
            throw new UnsupportedConfigurationException("Sample rate " + stream.sampleRate()
                    + " Hz is below the minimum of " + MIN_SAMPLE_RATE + " Hz", kind().id());
        }
        if (stream.channels() > MAX_CHANNELS) {
            throw new UnsupportedConfigurationException(stream.channels()
                    + " channels exceed the maximum of " + MAX_CHANNELS, kind().id());
        }
        return new SpectralGateHandle(config, stream, frameSizeFor(stream.sampleRate()));
    }

    static int frameSizeFor(int sampleRate) {
        int n = Fft.nextPowerOfTwo((int) Math.round(sampleRate * FRAME_SECONDS));
        return Math.max(256, Math.min(4096, n));
    }

    @Override
    protected void doLearnNoise(SpectralGateHandle h, AudioBuffer noise) {
        int channels = noise.channels();
        int frames = noise.frames();
        float[] in = noise.samples();
        int n = h.frameSize;
        double[] re = new double[n];
        double[] im = new double[n];
        for (int start = 0; start < frames; start += n) {
            int len = Math.min(n, frames - start);
            if (len < n / 2 && h.noiseFramesLearned > 0) {
                break;
            }
            double weight = 1.0 / (h.noiseFramesLearned + 1);
            for (int ch = 0; ch < channels; ch++) {
                for (int i = 0; i < n; i++) {
                    re[i] = i < len ? in[(start + i) * channels + ch] : 0.0;
                    im[i] = 0.0;
                }
                Fft.transform(re, im, false);
                double[] profile = h.noiseProfile[ch];
                for (int k = 0; k < h.bins; k++) {
                    profile[k] += (Math.hypot(re[k], im[k]) - profile[k]) * weight;
                }
            }
            h.noiseFramesLearned++;
        }
        LOG.debug("Learned noise profile from {} frame(s)", h.noiseFramesLearned);
    }

    @Override
    protected AudioBuffer doProcess(SpectralGateHandle h, AudioBuffer buffer) {
        int channels = buffer.channels();
        int frames = buffer.frames();
        float[] in = buffer.samples();
        float[] out = new float[in.length];
        int n = h.frameSize;
        double[] re = new double[n];
        double[] im = new double[n];
        double[] mag = new double[h.bins];
        double[] gain = new double[h.bins];
        double floorGain = Math.pow(10.0, -h.config.reductionDb() / 20.0);

        for (int start = 0; start < frames; start += n) {
            int len = Math.min(n, frames - start);
            for (int ch = 0; ch < channels; ch++) {
                for (int i = 0; i < n; i++) {
                    re[i] = i < len ? in[(start + i) * channels + ch] : 0.0;
                    im[i] = 0.0;
                }
                Fft.transform(re, im, false);
                for (int k = 0; k < h.bins; k++) {
                    mag[k] = Math.hypot(re[k], im[k]);
                }
                updateNoise(h, ch, mag);
                computeGains(h, ch, mag, floorGain, gain);
                for (int k = 0; k < h.bins; k++) {
                    re[k] *= gain[k];
                    im[k] *= gain[k];
                    int mirror = n - k;
                    if (k > 0 && mirror < n && mirror != k) {
                        re[mirror] *= gain[k];
                        im[mirror] *= gain[k];
                    }
                }
                Fft.transform(re, im, true);
                for (int i = 0; i < len; i++) {
                    out[(start + i) * channels + ch] = (float) re[i];
                }
            }
            h.framesSeen++;
        }
        return new AudioBuffer(out, channels, buffer.sampleRate());
    }

    private static void updateNoise(SpectralGateHandle h, int ch, double[] mag) {
        double[] noise = h.noiseProfile[ch];
        if (h.config.stationary()) {
            if (!h.learning()) {
                return;
            }
            double weight = 1.0 / (h.framesSeen + 1);
            for (int k = 0; k < mag.length; k++) {
                noise[k] += (mag[k] - noise[k]) * weight;
            }
            return;
        }
        if (h.framesSeen == 0 && !h.manualProfile) {
            System.arraycopy(mag, 0, noise, 0, mag.length);
            return;
        }
        for (int k = 0; k < mag.length; k++) {
            double rate = mag[k] < noise[k] ? FLOOR_FALL : FLOOR_RISE;
            noise[k] += (mag[k] - noise[k]) * rate;
        }
    }

    private static void computeGains(SpectralGateHandle h, int ch, double[] mag, double floorGain, double[] gain) {
        double[] noise = h.noiseProfile[ch];
        double prop = h.config.propDecrease();
        double[] raw = new double[mag.length];
        for (int k = 0; k < mag.length; k++) {
            double g = mag[k] > noise[k] * THRESHOLD_FACTOR ? 1.0 : floorGain;
            raw[k] = 1.0 - prop * (1.0 - g);
        }

        int radius = (int) Math.round(h.config.frequencySmoothing() * MAX_FREQUENCY_RADIUS);
        for (int k = 0; k < mag.length; k++) {
            if (radius == 0) {
                gain[k] = raw[k];
                continue;
            }
            int from = Math.max(0, k - radius);
            int to = Math.min(mag.length - 1, k + radius);
            double sum = 0;
            for (int j = from; j <= to; j++) {
                sum += raw[j];
            }
            gain[k] = sum / (to - from + 1);
        }

        double ts = h.config.timeSmoothing();
        double[] previous = h.previousGain[ch];
        for (int k = 0; k < mag.length; k++) {
            gain[k] = ts * previous[k] + (1.0 - ts) * gain[k];
            previous[k] = gain[k];
        }
    }
}
