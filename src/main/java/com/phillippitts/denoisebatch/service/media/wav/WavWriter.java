package com.phillippitts.denoisebatch.service.media.wav;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.service.media.MediaEncoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Streaming writer of WAV files at any sample rate and channel count.
 *
 * <p>{@link #open} writes 16-bit PCM with samples clamped to [-1, 1]. {@link #openFloat}
 * writes 32-bit IEEE float and keeps values beyond full scale, which intermediate files need
 * before a gain stage.
 *
 * <p>The header is written with zero sizes up front and patched on {@link #complete()}, so a
 * file that was never completed is recognisably truncated.
 */
public final class WavWriter implements MediaEncoder {

    private static final Logger LOG = LogManager.getLogger(WavWriter.class);
    private static final long MAX_DATA_BYTES = 0xFFFFFFFFL - WavFormat.CANONICAL_HEADER_SIZE;

    private final Path target;
    private final int channels;
    private final int sampleRate;
    private final boolean floatSamples;
    private final FileChannel channel;
    private long dataBytes;
    private boolean completed;
    private boolean aborted;

    private WavWriter(Path target, int channels, int sampleRate, boolean floatSamples, FileChannel channel) {
        this.target = target;
        this.channels = channels;
        this.sampleRate = sampleRate;
        this.floatSamples = floatSamples;
        this.channel = channel;
    }

    /**
     * Creates (or truncates) {@code target} as 16-bit PCM and writes a placeholder header.
     */
    public static WavWriter open(Path target, int channels, int sampleRate) throws IOException {
        return open(target, channels, sampleRate, false);
    }

    /**
     * Creates (or truncates) {@code target} as 32-bit float and writes a placeholder header.
     */
    public static WavWriter openFloat(Path target, int channels, int sampleRate) throws IOException {
        return open(target, channels, sampleRate, true);
    }

    private static WavWriter open(Path target, int channels, int sampleRate, boolean floatSamples)
            throws IOException {
        Objects.requireNonNull(target, "target");
        if (channels < 1 || sampleRate < 1) {
            throw new IllegalArgumentException("invalid layout: " + channels + " ch at " + sampleRate + " Hz");
        }
        FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        WavWriter writer = new WavWriter(target, channels, sampleRate, floatSamples, channel);
        try {
            channel.write(writer.header(0));
        } catch (IOException e) {
            writer.abort();
            throw e;
        }
        return writer;
    }

    /**
     * Writes {@code buffer} as a complete WAV file.
     */
    public static void write(Path target, AudioBuffer buffer) throws IOException {
        try (WavWriter writer = open(target, buffer.channels(), buffer.sampleRate())) {
            writer.write(buffer);
            writer.complete();
        }
    }

    @Override
    public Path target() {
        return target;
    }

    @Override
    public void write(AudioBuffer buffer) throws IOException {
        if (completed || aborted) {
            throw new IOException("WAV writer is no longer open: " + target);
        }
        if (buffer.channels() != channels || buffer.sampleRate() != sampleRate) {
            throw new IOException("Buffer layout " + buffer.channels() + "ch/" + buffer.sampleRate()
                    + "Hz does not match writer " + channels + "ch/" + sampleRate + "Hz");
        }
        float[] samples = buffer.samples();
        long bytes = (long) samples.length * bytesPerSample();
        if (dataBytes + bytes > MAX_DATA_BYTES) {
            throw new IOException("WAV data exceeds 4 GiB limit: " + target);
        }
        ByteBuffer out = ByteBuffer.allocate((int) bytes).order(ByteOrder.LITTLE_ENDIAN);
        for (float s : samples) {
            if (floatSamples) {
                out.putFloat(s);
            } else {
                float clamped = Math.max(-1f, Math.min(1f, s));
                out.putShort((short) Math.round(clamped * 32767f));
            }
        }
        out.flip();
        while (out.hasRemaining()) {
            channel.write(out);
        }
        dataBytes += bytes;
    }

    @Override
    public void complete() throws IOException {
        if (completed) {
            return;
        }
        if (aborted) {
            throw new IOException("WAV writer was aborted: " + target);
        }
        try {
            ByteBuffer header = header(dataBytes);
            int pos = 0;
            while (header.hasRemaining()) {
                pos += channel.write(header, pos);
            }
            channel.force(true);
            channel.close();
            completed = true;
        } catch (IOException e) {
            abort();
            throw e;
        }
    }

    @Override
    public void abort() {
        if (completed || aborted) {
            return;
        }
        aborted = true;
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Closing aborted WAV channel failed: {}", e.toString());
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.warn("Could not delete partial WAV {}: {}", target, e.toString());
        }
    }

    @Override
    public boolean isCompleted() {
        return completed;
    }

    private int bytesPerSample() {
        return floatSamples ? 4 : WavFormat.OUTPUT_BITS_PER_SAMPLE / 8;
    }

    private ByteBuffer header(long dataSize) {
        int blockAlign = channels * bytesPerSample();
        ByteBuffer h = ByteBuffer.allocate(WavFormat.CANONICAL_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        h.put(new byte[] {'R', 'I', 'F', 'F'});
        h.putInt((int) (36 + dataSize));
        h.put(new byte[] {'W', 'A', 'V', 'E'});
        h.put(new byte[] {'f', 'm', 't', ' '});
        h.putInt(WavFormat.FMT_CHUNK_MIN_SIZE);
        h.putShort((short) (floatSamples ? WavFormat.FORMAT_IEEE_FLOAT : WavFormat.FORMAT_PCM));
        h.putShort((short) channels);
        h.putInt(sampleRate);
        h.putInt(sampleRate * blockAlign);
        h.putShort((short) blockAlign);
        h.putShort((short) (bytesPerSample() * 8));
        h.put(new byte[] {'d', 'a', 't', 'a'});
        h.putInt((int) dataSize);
        h.flip();
        return h;
    }
}
