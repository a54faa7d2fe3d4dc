package com.phillippitts.denoisebatch.service.audio;

import com.phillippitts.denoisebatch.domain.AudioBuffer;

/**
 * Layout fixes for audio coming back from external tools, which may change length, channel
 * count or sample rate slightly.
 */
public final class AudioConversions {

    private AudioConversions() {
        // Utility class - prevent instantiation
    }

    /**
     * Truncates or zero-pads {@code buffer} to exactly {@code frames}.
     */
    public static AudioBuffer fitFrames(AudioBuffer buffer, int frames) {
        if (buffer.frames() == frames) {
            return buffer;
        }
        float[] out = new float[frames * buffer.channels()];
        System.arraycopy(buffer.samples(), 0, out, 0, Math.min(out.length, buffer.samples().length));
        return new AudioBuffer(out, buffer.channels(), buffer.sampleRate());
    }

    /**
     * Converts to {@code channels}: mono is duplicated, anything else is averaged down to mono
     * first when the counts differ.
     */
    public static AudioBuffer toChannels(AudioBuffer buffer, int channels) {
        int from = buffer.channels();
        if (from == channels) {
            return buffer;
        }
        int frames = buffer.frames();
        float[] in = buffer.samples();
        float[] out = new float[frames * channels];
        for (int f = 0; f < frames; f++) {
            float value;
            if (from == 1) {
                value = in[f];
            } else {
                float sum = 0;
                for (int c = 0; c < from; c++) {
                    sum += in[f * from + c];
                }
                value = sum / from;
            }
            for (int c = 0; c < channels; c++) {
                out[f * channels + c] = value;
            }
        }
        return new AudioBuffer(out, channels, buffer.sampleRate());
    }

    /**
     * Linear-interpolation resample. Adequate for small rate differences from model outputs.
     */
    public static AudioBuffer resample(AudioBuffer buffer, int sampleRate) {
        if (buffer.sampleRate() == sampleRate || buffer.isEmpty()) {
            return new AudioBuffer(buffer.samples(), buffer.channels(), sampleRate);
        }
        int channels = buffer.channels();
        int inFrames = buffer.frames();
        int outFrames = (int) Math.round((double) inFrames * sampleRate / buffer.sampleRate());
        float[] in = buffer.samples();
        float[] out = new float[outFrames * channels];
        double step = (double) buffer.sampleRate() / sampleRate;
        for (int f = 0; f < outFrames; f++) {
            double pos = f * step;
            int i0 = Math.min((int) pos, inFrames - 1);
            int i1 = Math.min(i0 + 1, inFrames - 1);
            double frac = pos - i0;
            for (int c = 0; c < channels; c++) {
                double a = in[i0 * channels + c];
                double b = in[i1 * channels + c];
                out[f * channels + c] = (float) (a + (b - a) * frac);
            }
        }
        return new AudioBuffer(out, channels, sampleRate);
    }

    /**
     * Returns {@code wet * processed + (1 - wet) * original}. Both buffers must share a layout.
     */
    public static AudioBuffer mix(AudioBuffer processed, AudioBuffer original, double wet) {
        if (wet >= 1.0) {
            return processed;
        }
        float[] p = processed.samples();
        float[] o = original.samples();
        if (p.length != o.length) {
            throw new IllegalArgumentException("Cannot mix buffers of different lengths");
        }
        float[] out = new float[p.length];
        for (int i = 0; i < p.length; i++) {
            out[i] = (float) (wet * p[i] + (1.0 - wet) * o[i]);
        }
        return new AudioBuffer(out, processed.channels(), processed.sampleRate());
    }
}
