package com.phillippitts.denoisebatch.domain;

import com.phillippitts.denoisebatch.exception.OutOfRangeException;

/**
 * A span of the input that contains only noise, used to learn a noise profile.
 *
 * @param startSeconds offset of the span from the start of the file
 * @param endSeconds end of the span, exclusive
 */
public record NoiseWindow(double startSeconds, double endSeconds) {

    public static final double MIN_SECONDS = 0.05;
    public static final double MAX_SECONDS = 30.0;

    public NoiseWindow {
        if (Double.isNaN(startSeconds) || startSeconds < 0.0) {
            throw new OutOfRangeException("noiseStartSeconds", "must be >= 0, got " + startSeconds);
        }
        double length = endSeconds - startSeconds;
        if (Double.isNaN(length) || length < MIN_SECONDS || length > MAX_SECONDS) {
            throw new OutOfRangeException("noiseEndSeconds", "window " + startSeconds + "-" + endSeconds
                    + " s must span " + MIN_SECONDS + " to " + MAX_SECONDS + " s");
        }
    }

    public double durationSeconds() {
        return endSeconds - startSeconds;
    }
}
