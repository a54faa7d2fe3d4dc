package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.ToolFailureExceptionBuilder;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.process.ExternalProcessRunner;
import com.phillippitts.denoisebatch.service.process.StreamGobbler;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import com.phillippitts.denoisebatch.util.ProcessTimeouts;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Reads raw f32le audio from a running ffmpeg decoder's stdout.
 *
 * <p>At end of stream the decoder's exit code is checked so a truncated decode surfaces as a
 * failure instead of a silently short file.
 */
final class FfmpegAudioStream implements AudioStream {

    private static final Logger LOG = LogManager.getLogger(FfmpegAudioStream.class);

    private final Process process;
    private final InputStream stdout;
    private final StringBuffer stderr = new StringBuffer();
    private final Thread errGobbler;
    private final StreamInfo info;
    private final Path source;
    private final int chunkFrames;
    private final long startNanos = System.nanoTime();
    private boolean finished;
    private boolean closed;

    FfmpegAudioStream(Process process, StreamInfo info, Path source, int chunkFrames, int maxStderrChars) {
        this.process = process;
        this.info = info;
        this.source = source;
        this.chunkFrames = chunkFrames;
        this.stdout = new BufferedInputStream(process.getInputStream(), 64 * 1024);
        this.errGobbler = StreamGobbler.start(process.getErrorStream(), stderr, "ffmpeg-decode-err", maxStderrChars);
    }

    @Override
    public StreamInfo info() {
        return info;
    }

    @Override
    public AudioBuffer read() throws IOException {
        if (closed) {
            throw new IOException("decoder closed");
        }
        if (finished) {
            return null;
        }
        int frameBytes = info.channels() * FfmpegCommands.BYTES_PER_SAMPLE;
        byte[] raw = stdout.readNBytes(chunkFrames * frameBytes);
        int frames = raw.length / frameBytes;
        if (raw.length < chunkFrames * frameBytes) {
            finished = true;
            awaitExit();
        }
        if (frames == 0) {
            return null;
        }
        float[] samples = new float[frames * info.channels()];
        ByteBuffer.wrap(raw, 0, frames * frameBytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(samples);
        return new AudioBuffer(samples, info.channels(), info.sampleRate());
    }

    private void awaitExit() throws IOException {
        try {
            if (!process.waitFor(ProcessTimeouts.DECODER_EXIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                throw ToolFailureExceptionBuilder.create("Decoder did not exit after end of stream")
                        .tool("ffmpeg")
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .buildMediaException(source.toString());
            }
            StreamGobbler.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            int exit = process.exitValue();
            if (exit != 0) {
                throw ToolFailureExceptionBuilder.create("Decode failed")
                        .tool("ffmpeg")
                        .exitCode(exit)
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .metadata("stderr", LogSanitizer.truncate(stderr.toString(), 800))
                        .buildMediaException(source.toString());
            }
            LOG.debug("Decoder for {} finished in {}ms", LogSanitizer.fileName(source),
                    TimeUtils.elapsedMillis(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for decoder", e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ExternalProcessRunner.destroyQuietly(process);
        try {
            stdout.close();
        } catch (IOException e) {
            LOG.debug("Closing decoder stdout failed: {}", e.toString());
        }
        StreamGobbler.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
    }
}
