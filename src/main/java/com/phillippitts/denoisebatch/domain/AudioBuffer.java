package com.phillippitts.denoisebatch.domain;

import java.util.List;
import java.util.Objects;

/**
 * A chunk of decoded audio: interleaved 32-bit float samples in [-1, 1].
 *
 * <p>The sample array is not copied. Producers hand over ownership and consumers must not
 * mutate a buffer they did not create.
 *
 * @param samples interleaved samples, length a multiple of {@code channels}
 * @param channels channel count
 * @param sampleRate frames per second
 */
public record AudioBuffer(float[] samples, int channels, int sampleRate) {

    public AudioBuffer {
        Objects.requireNonNull(samples, "samples");
        if (channels < 1) {
            throw new IllegalArgumentException("channels must be positive, got " + channels);
        }
        if (sampleRate < 1) {
            throw new IllegalArgumentException("sampleRate must be positive, got " + sampleRate);
        }
        if (samples.length % channels != 0) {
            throw new IllegalArgumentException("sample count " + samples.length
                    + " is not a multiple of channel count " + channels);
        }
    }

    public static AudioBuffer empty(int channels, int sampleRate) {
        return new AudioBuffer(new float[0], channels, sampleRate);
    }

    public int frames() {
        return samples.length / channels;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    public double durationSeconds() {
        return (double) frames() / sampleRate;
    }

    public float sample(int frame, int channel) {
        return samples[frame * channels + channel];
    }

    /**
     * Returns frames {@code [fromFrame, toFrame)} as a new buffer.
     */
    public AudioBuffer slice(int fromFrame, int toFrame) {
        if (fromFrame < 0 || toFrame > frames() || fromFrame > toFrame) {
            throw new IndexOutOfBoundsException("slice [" + fromFrame + ", " + toFrame + ") of " + frames());
        }
        float[] out = new float[(toFrame - fromFrame) * channels];
        System.arraycopy(samples, fromFrame * channels, out, 0, out.length);
        return new AudioBuffer(out, channels, sampleRate);
    }

    /**
     * Concatenates buffers that share the same layout.
     *
     * @param buffers buffers in order; may be empty
     * @param channels channel count, used when {@code buffers} is empty
     * @param sampleRate sample rate, used when {@code buffers} is empty
     * @return one buffer holding all frames
     */
    public static AudioBuffer concat(List<AudioBuffer> buffers, int channels, int sampleRate) {
        int total = 0;
        for (AudioBuffer b : buffers) {
            if (b.channels != channels || b.sampleRate != sampleRate) {
                throw new IllegalArgumentException("Cannot concatenate buffers with different layouts");
            }
            total += b.samples.length;
        }
        float[] out = new float[total];
        int pos = 0;
        for (AudioBuffer b : buffers) {
            System.arraycopy(b.samples, 0, out, pos, b.samples.length);
            pos += b.samples.length;
        }
        return new AudioBuffer(out, channels, sampleRate);
    }
}
