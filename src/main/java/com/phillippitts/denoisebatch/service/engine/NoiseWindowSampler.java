package com.phillippitts.denoisebatch.service.engine;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.NoiseWindow;
import com.phillippitts.denoisebatch.exception.OutOfRangeException;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes a manual noise window of the input and feeds it to an engine handle before
 * processing starts.
 */
public final class NoiseWindowSampler {

    private NoiseWindowSampler() {
    }

    /**
     * @param sampleRate decode rate, or null for the source rate; must match the handle's stream
     * @return frames fed to the engine
     * @throws OutOfRangeException if the window lies beyond the end of the input
     */
    public static long learn(MediaIoAdapter media, Path input, Integer sampleRate, NoiseWindow window,
                             NoiseReductionEngine engine, EngineHandle handle) throws IOException {
        long frames = 0;
        try (AudioStream in = media.decodeRange(input, window.startSeconds(), window.durationSeconds(), sampleRate)) {
            AudioBuffer chunk;
            while ((chunk = in.read()) != null) {
                engine.learnNoise(handle, chunk);
                frames += chunk.frames();
            }
        }
        if (frames == 0) {
            throw new OutOfRangeException("noiseStartSeconds", "noise window " + window.startSeconds() + "-"
                    + window.endSeconds() + " s is beyond the end of the input");
        }
        return frames;
    }

    /**
     * @throws OutOfRangeException if the window ends after {@code durationSeconds}
     */
    public static void requireWithin(NoiseWindow window, double durationSeconds) {
        if (durationSeconds > 0 && window.endSeconds() > durationSeconds) {
            throw new OutOfRangeException("noiseEndSeconds", String.format(
                    "noise window ends at %.2f s, after the end of the input (%.2f s)",
                    window.endSeconds(), durationSeconds));
        }
    }
}
