package com.phillippitts.denoisebatch.domain;

/**
 * Outcome of a preview: both segments and their levels.
 *
 * @param original decoded window as read from the file
 * @param processed the same window after the engine
 * @param originalLevels levels of {@code original}
 * @param processedLevels levels of {@code processed}
 * @param offsetSeconds effective start of the window
 * @param durationSeconds effective length of the window after clamping
 */
public record PreviewResult(
        AudioBuffer original,
        AudioBuffer processed,
        LevelMetrics originalLevels,
        LevelMetrics processedLevels,
        double offsetSeconds,
        double durationSeconds
) {

    /**
     * @return RMS reduction in dB, positive when the processed segment is quieter
     */
    public double reductionDb() {
        if (processedLevels.rms() <= 0.0) {
            return originalLevels.rms() <= 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return 20.0 * Math.log10(originalLevels.rms() / processedLevels.rms());
    }
}
