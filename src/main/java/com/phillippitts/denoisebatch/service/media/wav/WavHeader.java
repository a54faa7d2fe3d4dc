package com.phillippitts.denoisebatch.service.media.wav;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Parsed fmt chunk and data chunk location of a WAV file.
 *
 * <p>Non-standard files with extra chunks (LIST, fact, bext) or an extended fmt chunk are
 * handled by walking the chunk list until {@code data} is found.
 *
 * @param audioFormat effective format code ({@link WavFormat#FORMAT_PCM} or
 *                    {@link WavFormat#FORMAT_IEEE_FLOAT}), extensible headers resolved
 * @param channels channel count
 * @param sampleRate frames per second
 * @param bitsPerSample bits per sample
 * @param dataSize data chunk size in bytes, -1 if the header does not state a usable size
 */
record WavHeader(int audioFormat, int channels, int sampleRate, int bitsPerSample, long dataSize) {

    int blockAlign() {
        return channels * (bitsPerSample / 8);
    }

    /**
     * @return total frames in the data chunk, or -1 if unknown
     */
    long frames() {
        return dataSize < 0 ? -1 : dataSize / blockAlign();
    }

    /**
     * Reads the header from {@code in}, leaving the stream positioned at the first data byte.
     *
     * @param in stream positioned at the start of the file
     * @return parsed header
     * @throws IOException if the file is not a supported WAV
     */
    static WavHeader parse(DataInputStream in) throws IOException {
        byte[] riff = new byte[WavFormat.RIFF_HEADER_SIZE];
        try {
            in.readFully(riff);
        } catch (EOFException e) {
            throw new IOException("File too small for RIFF header", e);
        }
        if (!"RIFF".equals(ascii(riff, 0)) || !"WAVE".equals(ascii(riff, 8))) {
            throw new IOException("Not a RIFF/WAVE file");
        }

        byte[] fmt = null;
        byte[] chunkHeader = new byte[WavFormat.CHUNK_HEADER_SIZE];
        while (true) {
            try {
                in.readFully(chunkHeader);
            } catch (EOFException e) {
                throw new IOException("Missing data chunk in WAV file", e);
            }
            String chunkId = ascii(chunkHeader, 0);
            long chunkSize = Integer.toUnsignedLong(readLEInt(chunkHeader, 4));

            if ("fmt ".equals(chunkId)) {
                if (chunkSize < WavFormat.FMT_CHUNK_MIN_SIZE || chunkSize > 1024) {
                    throw new IOException("Invalid fmt chunk size: " + chunkSize);
                }
                fmt = new byte[(int) chunkSize];
                in.readFully(fmt);
                skipPad(in, chunkSize);
            } else if ("data".equals(chunkId)) {
                if (fmt == null) {
                    throw new IOException("data chunk precedes fmt chunk");
                }
                long dataSize = (chunkSize == 0 || chunkSize == 0xFFFFFFFFL) ? -1 : chunkSize;
                return fromFmt(fmt, dataSize);
            } else {
                in.skipNBytes(chunkSize);
                skipPad(in, chunkSize);
            }
        }
    }

    private static WavHeader fromFmt(byte[] fmt, long dataSize) throws IOException {
        int format = readLEShort(fmt, 0);
        int channels = readLEShort(fmt, 2);
        int sampleRate = readLEInt(fmt, 4);
        int bits = readLEShort(fmt, 14);
        if (format == WavFormat.FORMAT_EXTENSIBLE) {
            if (fmt.length < WavFormat.EXTENSIBLE_FMT_SIZE) {
                throw new IOException("Extensible fmt chunk too small: " + fmt.length);
            }
            format = readLEShort(fmt, WavFormat.EXTENSIBLE_SUBFORMAT_OFFSET);
        }
        if (format != WavFormat.FORMAT_PCM && format != WavFormat.FORMAT_IEEE_FLOAT) {
            throw new IOException("Unsupported WAV audio format: " + format);
        }
        if (channels < 1 || sampleRate < 1) {
            throw new IOException("Invalid WAV layout: " + channels + " channels at " + sampleRate + " Hz");
        }
        boolean supportedDepth = format == WavFormat.FORMAT_IEEE_FLOAT
                ? bits == 32
                : bits == 8 || bits == 16 || bits == 24 || bits == 32;
        if (!supportedDepth) {
            throw new IOException("Unsupported bit depth " + bits + " for format " + format);
        }
        return new WavHeader(format, channels, sampleRate, bits, dataSize);
    }

    private static void skipPad(DataInputStream in, long chunkSize) throws IOException {
        // chunks are padded to even byte boundaries
        if (chunkSize % 2 == 1) {
            in.skipNBytes(1);
        }
    }

    private static String ascii(byte[] a, int off) {
        return new String(a, off, 4, StandardCharsets.US_ASCII);
    }

    static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
