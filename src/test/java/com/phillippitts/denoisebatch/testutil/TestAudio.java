package com.phillippitts.denoisebatch.testutil;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.service.media.wav.WavWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * Synthetic audio fixtures.
 */
public final class TestAudio {

    private TestAudio() {
    }

    public static AudioBuffer sine(int sampleRate, int channels, double seconds, double freqHz, double amplitude) {
        int frames = (int) Math.round(seconds * sampleRate);
        float[] samples = new float[frames * channels];
        for (int f = 0; f < frames; f++) {
            float v = (float) (amplitude * Math.sin(2 * Math.PI * freqHz * f / sampleRate));
            for (int c = 0; c < channels; c++) {
                samples[f * channels + c] = v;
            }
        }
        return new AudioBuffer(samples, channels, sampleRate);
    }

    public static AudioBuffer noise(int sampleRate, int channels, double seconds, double amplitude, long seed) {
        Random random = new Random(seed);
        int frames = (int) Math.round(seconds * sampleRate);
        float[] samples = new float[frames * channels];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (float) (amplitude * (random.nextDouble() * 2 - 1));
        }
        return new AudioBuffer(samples, channels, sampleRate);
    }

    public static AudioBuffer silence(int sampleRate, int channels, double seconds) {
        int frames = (int) Math.round(seconds * sampleRate);
        return new AudioBuffer(new float[frames * channels], channels, sampleRate);
    }

    /**
     * Writes a 440 Hz tone as 16-bit WAV.
     */
    public static Path writeTone(Path file, int sampleRate, int channels, double seconds) throws IOException {
        WavWriter.write(file, sine(sampleRate, channels, seconds, 440.0, 0.5));
        return file;
    }
}
