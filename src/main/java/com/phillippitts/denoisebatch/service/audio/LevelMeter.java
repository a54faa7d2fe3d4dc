package com.phillippitts.denoisebatch.service.audio;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.LevelMetrics;

/**
 * RMS and peak measurement over float audio.
 *
 * <p>Use {@link #measure(AudioBuffer)} for a single buffer or an instance to accumulate across
 * the buffers of a stream.
 */
public final class LevelMeter {

    private double sumSquares;
    private long sampleCount;
    private double peak;

    public static LevelMetrics measure(AudioBuffer buffer) {
        LevelMeter meter = new LevelMeter();
        meter.accept(buffer);
        return meter.result();
    }

    public void accept(AudioBuffer buffer) {
        float[] samples = buffer.samples();
        for (float s : samples) {
            sumSquares += (double) s * s;
            double abs = Math.abs(s);
            if (abs > peak) {
                peak = abs;
            }
        }
        sampleCount += samples.length;
    }

    /**
     * @return levels of everything accepted so far; silence (0, 0) if nothing was accepted
     */
    public LevelMetrics result() {
        double rms = sampleCount == 0 ? 0.0 : Math.sqrt(sumSquares / sampleCount);
        return new LevelMetrics(rms, peak);
    }
}
