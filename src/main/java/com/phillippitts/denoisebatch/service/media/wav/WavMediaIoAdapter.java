package com.phillippitts.denoisebatch.service.media.wav;

import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.media.MediaEncoder;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.service.media.SupportedFormats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pure-Java backend limited to WAV input and output. It cannot resample or carry video, so
 * requests for either are rejected with {@link MediaException}.
 */
public final class WavMediaIoAdapter implements MediaIoAdapter {

    private static final Logger LOG = LogManager.getLogger(WavMediaIoAdapter.class);
    private static final String WAV = ".wav";

    private final int chunkMillis;

    public WavMediaIoAdapter(int chunkMillis) {
        if (chunkMillis <= 0) {
            throw new IllegalArgumentException("chunkMillis must be positive");
        }
        this.chunkMillis = chunkMillis;
    }

    @Override
    public MediaInfo probe(Path path) {
        requireReadableWav(path);
        try {
            WavHeader header = WavReader.readHeader(path);
            long frames = header.frames();
            if (frames < 0) {
                frames = Math.max(0, Files.size(path) - WavFormat.CANONICAL_HEADER_SIZE) / header.blockAlign();
            }
            double duration = (double) frames / header.sampleRate();
            LOG.debug("Probed {}: {} Hz, {} ch, {}s", path, header.sampleRate(), header.channels(), duration);
            return new MediaInfo(path, header.sampleRate(), header.channels(), duration,
                    false, true, "pcm_" + (header.audioFormat() == WavFormat.FORMAT_IEEE_FLOAT ? "f" : "s")
                            + header.bitsPerSample() + "le", "wav");
        } catch (IOException e) {
            throw new MediaException("Unreadable WAV file", path.toString(), e);
        }
    }

    @Override
    public AudioStream decode(Path path, Integer sampleRate) {
        return open(path, sampleRate, 0, -1);
    }

    @Override
    public AudioStream decodeRange(Path path, double offsetSeconds, double durationSeconds, Integer sampleRate) {
        if (offsetSeconds < 0 || durationSeconds <= 0) {
            throw new IllegalArgumentException("invalid range: offset=" + offsetSeconds + " duration=" + durationSeconds);
        }
        MediaInfo info = probe(path);
        long start = Math.round(offsetSeconds * info.sampleRate());
        long frames = Math.round(durationSeconds * info.sampleRate());
        return open(path, sampleRate, start, frames);
    }

    @Override
    public MediaEncoder openEncoder(Path target, StreamInfo stream, MediaInfo source, boolean preserveVideo) {
        if (!WAV.equals(SupportedFormats.extensionOf(target))) {
            throw new MediaException("wav backend can only write .wav files", target.toString());
        }
        if (preserveVideo && source != null && source.hasVideo()) {
            throw new MediaException("wav backend cannot preserve video", target.toString());
        }
        try {
            return WavWriter.open(target, stream.channels(), stream.sampleRate());
        } catch (IOException e) {
            throw new MediaException("Cannot open WAV encoder", target.toString(), e);
        }
    }

    @Override
    public String name() {
        return "wav";
    }

    private AudioStream open(Path path, Integer sampleRate, long startFrame, long maxFrames) {
        requireReadableWav(path);
        try {
            WavHeader header = WavReader.readHeader(path);
            if (sampleRate != null && sampleRate != header.sampleRate()) {
                throw new MediaException("wav backend cannot resample " + header.sampleRate() + " Hz to "
                        + sampleRate + " Hz", path.toString());
            }
            int chunkFrames = Math.max(1, (int) ((long) header.sampleRate() * chunkMillis / 1000));
            return WavReader.open(path, chunkFrames, startFrame, maxFrames);
        } catch (IOException e) {
            throw new MediaException("Cannot decode WAV file", path.toString(), e);
        }
    }

    private static void requireReadableWav(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MediaException("File not found", path.toString());
        }
        if (!WAV.equals(SupportedFormats.extensionOf(path))) {
            throw new MediaException("wav backend only reads .wav files", path.toString());
        }
    }
}
