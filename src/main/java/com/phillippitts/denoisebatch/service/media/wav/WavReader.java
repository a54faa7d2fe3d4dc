package com.phillippitts.denoisebatch.service.media.wav;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.service.media.AudioStream;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Chunked reader for PCM (8/16/24/32-bit) and 32-bit float WAV files, converting to float samples.
 */
public final class WavReader implements AudioStream {

    private final DataInputStream in;
    private final WavHeader header;
    private final int chunkFrames;
    private final StreamInfo info;
    private long remainingFrames;
    private boolean closed;

    private WavReader(DataInputStream in, WavHeader header, int chunkFrames, long startFrame, long maxFrames)
            throws IOException {
        this.in = in;
        this.header = header;
        this.chunkFrames = chunkFrames;
        long available = header.frames() < 0 ? Long.MAX_VALUE : Math.max(0, header.frames() - startFrame);
        this.remainingFrames = maxFrames < 0 ? available : Math.min(available, maxFrames);
        if (startFrame > 0) {
            in.skipNBytes(Math.min(startFrame, header.frames() < 0 ? startFrame : header.frames())
                    * header.blockAlign());
        }
        long totalFrames = remainingFrames == Long.MAX_VALUE ? -1 : remainingFrames;
        this.info = new StreamInfo(header.sampleRate(), header.channels(), totalFrames);
    }

    /**
     * Opens {@code path} for reading.
     *
     * @param path WAV file
     * @param chunkFrames frames per returned buffer
     * @param startFrame first frame to return
     * @param maxFrames maximum frames to return, or -1 for all remaining
     * @return open reader
     * @throws IOException if the file cannot be opened or is not a supported WAV
     */
    public static WavReader open(Path path, int chunkFrames, long startFrame, long maxFrames) throws IOException {
        if (chunkFrames <= 0) {
            throw new IllegalArgumentException("chunkFrames must be positive");
        }
        DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path), 64 * 1024));
        try {
            WavHeader header = WavHeader.parse(in);
            return new WavReader(in, header, chunkFrames, startFrame, maxFrames);
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    public static WavReader open(Path path, int chunkFrames) throws IOException {
        return open(path, chunkFrames, 0, -1);
    }

    /**
     * Reads a whole file into one buffer. Intended for short temp files produced by helper tools.
     */
    public static AudioBuffer readAll(Path path) throws IOException {
        try (WavReader reader = open(path, 65_536)) {
            List<AudioBuffer> parts = new ArrayList<>();
            AudioBuffer next;
            while ((next = reader.read()) != null) {
                parts.add(next);
            }
            return AudioBuffer.concat(parts, reader.info.channels(), reader.info.sampleRate());
        }
    }

    /**
     * Probes the header without reading sample data.
     */
    static WavHeader readHeader(Path path) throws IOException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            return WavHeader.parse(in);
        }
    }

    @Override
    public StreamInfo info() {
        return info;
    }

    @Override
    public AudioBuffer read() throws IOException {
        if (closed) {
            throw new IOException("reader closed");
        }
        if (remainingFrames <= 0) {
            return null;
        }
        int blockAlign = header.blockAlign();
        int frames = (int) Math.min(chunkFrames, remainingFrames);
        byte[] raw = in.readNBytes(frames * blockAlign);
        int framesRead = raw.length / blockAlign;
        if (framesRead == 0) {
            remainingFrames = 0;
            return null;
        }
        remainingFrames -= framesRead;
        if (framesRead < frames) {
            remainingFrames = 0;
        }
        return new AudioBuffer(convert(raw, framesRead * header.channels()), header.channels(), header.sampleRate());
    }

    private float[] convert(byte[] raw, int sampleCount) {
        float[] out = new float[sampleCount];
        int bytesPerSample = header.bitsPerSample() / 8;
        boolean isFloat = header.audioFormat() == WavFormat.FORMAT_IEEE_FLOAT;
        for (int i = 0, off = 0; i < sampleCount; i++, off += bytesPerSample) {
            switch (bytesPerSample) {
                case 1 -> out[i] = ((raw[off] & 0xFF) - 128) / 128f;
                case 2 -> out[i] = (short) ((raw[off] & 0xFF) | (raw[off + 1] << 8)) / 32768f;
                case 3 -> {
                    int v = (raw[off] & 0xFF) | ((raw[off + 1] & 0xFF) << 8) | (raw[off + 2] << 16);
                    out[i] = v / 8_388_608f;
                }
                default -> {
                    int bits = WavHeader.readLEInt(raw, off);
                    out[i] = isFloat ? Float.intBitsToFloat(bits) : bits / 2_147_483_648f;
                }
            }
        }
        return out;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            in.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close WAV reader", e);
        }
    }
}
