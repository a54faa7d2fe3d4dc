package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.LevelMetrics;
import com.phillippitts.denoisebatch.domain.PreviewResult;

/**
 * Preview summary. Raw samples are not serialized.
 */
public record PreviewView(
        double offsetSeconds,
        double durationSeconds,
        int sampleRate,
        int channels,
        int originalFrames,
        int processedFrames,
        Levels original,
        Levels processed,
        double reductionDb
) {

    public record Levels(double rms, double peak, double rmsDb, double peakDb) {

        static Levels of(LevelMetrics m) {
            return new Levels(m.rms(), m.peak(), m.rmsDb(), m.peakDb());
        }
    }

    public static PreviewView of(PreviewResult r) {
        return new PreviewView(r.offsetSeconds(), r.durationSeconds(), r.original().sampleRate(),
                r.original().channels(), r.original().frames(), r.processed().frames(),
                Levels.of(r.originalLevels()), Levels.of(r.processedLevels()), r.reductionDb());
    }
}
