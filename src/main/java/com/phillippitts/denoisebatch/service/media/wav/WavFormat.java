package com.phillippitts.denoisebatch.service.media.wav;

/**
 * Structural constants of the RIFF/WAVE container.
 *
 * <pre>
 * RIFF header (12 bytes)   "RIFF" size "WAVE"
 * fmt chunk                id + size (8 bytes), data (&gt;= 16 bytes)
 * ...other chunks...
 * data chunk               id + size (8 bytes), interleaved frames
 * </pre>
 */
final class WavFormat {

    static final int RIFF_HEADER_SIZE = 12;
    static final int CHUNK_HEADER_SIZE = 8;
    static final int FMT_CHUNK_MIN_SIZE = 16;
    /** Canonical header length written by {@link WavWriter}. */
    static final int CANONICAL_HEADER_SIZE = 44;

    static final int FORMAT_PCM = 1;
    static final int FORMAT_IEEE_FLOAT = 3;
    static final int FORMAT_EXTENSIBLE = 0xFFFE;

    /** Offset of the sub-format GUID inside an extensible fmt chunk. */
    static final int EXTENSIBLE_SUBFORMAT_OFFSET = 24;
    static final int EXTENSIBLE_FMT_SIZE = 40;

    static final int OUTPUT_BITS_PER_SAMPLE = 16;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
