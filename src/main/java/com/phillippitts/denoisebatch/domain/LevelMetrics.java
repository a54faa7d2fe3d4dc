package com.phillippitts.denoisebatch.domain;

/**
 * Scalar level measurements of an audio segment.
 *
 * @param rms root mean square amplitude over all samples, linear
 * @param peak largest absolute sample, linear
 */
public record LevelMetrics(double rms, double peak) {

    private static final double DB_FLOOR_EPSILON = 1e-10;

    public double rmsDb() {
        return toDb(rms);
    }

    public double peakDb() {
        return toDb(peak);
    }

    public static double toDb(double linear) {
        return 20.0 * Math.log10(linear + DB_FLOOR_EPSILON);
    }
}
