package com.phillippitts.denoisebatch.service.audio;

import com.phillippitts.denoisebatch.domain.AudioBuffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Approximate EBU R128 loudness normalization with a peak limiter.
 *
 * <p>Integrated loudness is measured over 400 ms blocks of the channel-sum mean square, with no
 * K-weighting, an absolute gate at -70 LUFS and a relative gate 10 LU below the absolutely
 * gated mean. The correction is a single gain: the loudness gain, reduced further when the
 * resulting peak would exceed {@link #LIMITER_THRESHOLD}.
 */
public final class LoudnessNormalizer {

    public static final double SILENCE_THRESHOLD_LUFS = -70.0;
    public static final double LIMITER_THRESHOLD = 0.99;
    public static final double LIMITER_TARGET = 0.95;

    static final double BLOCK_SECONDS = 0.4;
    static final double RELATIVE_GATE_LU = -10.0;
    private static final double LOUDNESS_OFFSET = -0.691;

    private LoudnessNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Starts a loudness measurement for a stream of the given layout.
     */
    public static Meter meter(int channels, int sampleRate) {
        return new Meter(channels, sampleRate);
    }

    /**
     * Linear factor to apply to every sample.
     *
     * @param measuredLufs integrated loudness from {@link Meter#integratedLufs()}
     * @param peak absolute peak of the unscaled audio
     * @param targetLufs desired integrated loudness
     * @return gain factor; 1.0 when the input is treated as silence and does not clip
     */
    public static double normalizationFactor(double measuredLufs, double peak, double targetLufs) {
        double gain = 1.0;
        if (measuredLufs > SILENCE_THRESHOLD_LUFS) {
            gain = Math.pow(10.0, (targetLufs - measuredLufs) / 20.0);
        }
        return gain * limiterFactor(peak * gain);
    }

    /**
     * @return factor bringing {@code peak} to {@link #LIMITER_TARGET} if it exceeds the threshold, else 1
     */
    public static double limiterFactor(double peak) {
        return peak > LIMITER_THRESHOLD ? LIMITER_TARGET / peak : 1.0;
    }

    public static AudioBuffer scale(AudioBuffer buffer, double factor) {
        if (factor == 1.0) {
            return buffer;
        }
        float[] in = buffer.samples();
        float[] out = new float[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = (float) (in[i] * factor);
        }
        return new AudioBuffer(out, buffer.channels(), buffer.sampleRate());
    }

    /**
     * Hard-clamps samples to {@code [-limit, limit]}. Returns the input when nothing exceeds it.
     */
    public static AudioBuffer clamp(AudioBuffer buffer, double limit) {
        float[] in = buffer.samples();
        float max = (float) limit;
        float[] out = null;
        for (int i = 0; i < in.length; i++) {
            float s = in[i];
            if (s > max || s < -max) {
                if (out == null) {
                    out = in.clone();
                }
                out[i] = s > 0 ? max : -max;
            }
        }
        return out == null ? buffer : new AudioBuffer(out, buffer.channels(), buffer.sampleRate());
    }

    /**
     * Accumulates gated-block energy and peak across buffers. Not thread-safe.
     */
    public static final class Meter {

        private final int channels;
        private final int blockFrames;
        private final List<Double> blockPowers = new ArrayList<>();
        private double blockSum;
        private int blockFill;
        private double peak;

        private Meter(int channels, int sampleRate) {
            this.channels = channels;
            this.blockFrames = Math.max(1, (int) Math.round(sampleRate * BLOCK_SECONDS));
        }

        public void accept(AudioBuffer buffer) {
            float[] samples = buffer.samples();
            int frames = buffer.frames();
            for (int f = 0; f < frames; f++) {
                double sum = 0;
                int base = f * channels;
                for (int c = 0; c < channels; c++) {
                    float s = samples[base + c];
                    sum += s;
                    double abs = Math.abs(s);
                    if (abs > peak) {
                        peak = abs;
                    }
                }
                blockSum += sum * sum;
                if (++blockFill == blockFrames) {
                    blockPowers.add(blockSum / blockFrames);
                    blockSum = 0;
                    blockFill = 0;
                }
            }
        }

        public double peak() {
            return peak;
        }

        /**
         * @return gated loudness in LUFS, or negative infinity when no block passes the gates
         */
        public double integratedLufs() {
            List<Double> powers = new ArrayList<>(blockPowers);
            // clips shorter than one block are measured as a single short block
            if (powers.isEmpty() && blockFill > 0) {
                powers.add(blockSum / blockFill);
            }
            List<Double> absGated = new ArrayList<>();
            for (double p : powers) {
                if (loudness(p) > SILENCE_THRESHOLD_LUFS) {
                    absGated.add(p);
                }
            }
            if (absGated.isEmpty()) {
                return Double.NEGATIVE_INFINITY;
            }
            double relativeGate = loudness(mean(absGated)) + RELATIVE_GATE_LU;
            List<Double> relGated = new ArrayList<>();
            for (double p : absGated) {
                if (loudness(p) > relativeGate) {
                    relGated.add(p);
                }
            }
            return relGated.isEmpty() ? loudness(mean(absGated)) : loudness(mean(relGated));
        }

        private static double loudness(double meanSquare) {
            return meanSquare <= 0 ? Double.NEGATIVE_INFINITY : LOUDNESS_OFFSET + 10.0 * Math.log10(meanSquare);
        }

        private static double mean(List<Double> values) {
            double sum = 0;
            for (double v : values) {
                sum += v;
            }
            return sum / values.size();
        }
    }
}
