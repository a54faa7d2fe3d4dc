package com.phillippitts.denoisebatch.domain;

import java.util.Locale;
import java.util.Set;

import static com.phillippitts.denoisebatch.exception.OutOfRangeException.requireInRange;

/**
 * Per-job output settings, captured with the engine config at enqueue time.
 *
 * @param outputFormat target audio format ({@code wav}, {@code mp3}, {@code flac}, {@code aac}),
 *                     or null to keep the input's extension
 * @param preserveVideo remux the original video stream into the output when the input has one
 * @param normalizeLoudness run the loudness normalization pass before encoding
 * @param targetLufs integrated loudness target for normalization
 * @param sampleRate decode sample rate, or null to keep the source rate
 */
public record OutputOptions(
        String outputFormat,
        boolean preserveVideo,
        boolean normalizeLoudness,
        double targetLufs,
        Integer sampleRate
) {

    public static final Set<String> OUTPUT_FORMATS = Set.of("wav", "mp3", "flac", "aac");
    public static final double DEFAULT_TARGET_LUFS = -23.0;

    public OutputOptions {
        if (outputFormat != null) {
            outputFormat = outputFormat.trim().toLowerCase(Locale.ROOT);
            if (outputFormat.startsWith(".")) {
                outputFormat = outputFormat.substring(1);
            }
            if (outputFormat.isEmpty()) {
                outputFormat = null;
            } else if (!OUTPUT_FORMATS.contains(outputFormat)) {
                throw new IllegalArgumentException("Unsupported output format: " + outputFormat
                        + " (supported: " + OUTPUT_FORMATS + ")");
            }
        }
        requireInRange("targetLufs", targetLufs, -70.0, 0.0);
        if (sampleRate != null) {
            requireInRange("sampleRate", sampleRate, 8_000, 192_000);
        }
    }

    public static OutputOptions defaults() {
        return new OutputOptions(null, true, false, DEFAULT_TARGET_LUFS, null);
    }

    /**
     * @return true if the output keeps the input container rather than a converted audio format
     */
    public boolean keepsInputFormat() {
        return outputFormat == null;
    }
}
