package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.ToolFailureExceptionBuilder;
import com.phillippitts.denoisebatch.service.media.MediaEncoder;
import com.phillippitts.denoisebatch.service.process.ExternalProcessRunner;
import com.phillippitts.denoisebatch.service.process.StreamGobbler;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import com.phillippitts.denoisebatch.util.ProcessTimeouts;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Feeds raw f32le audio into an ffmpeg encoder/remuxer over stdin.
 */
final class FfmpegEncoder implements MediaEncoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegEncoder.class);

    private final Process process;
    private final Path target;
    private final StreamInfo stream;
    private final Duration completeTimeout;
    private final OutputStream stdin;
    private final StringBuffer stderr = new StringBuffer();
    private final Thread errGobbler;
    private final Thread outGobbler;
    private final long startNanos = System.nanoTime();
    private boolean completed;
    private boolean aborted;

    FfmpegEncoder(Process process, Path target, StreamInfo stream, Duration completeTimeout, int maxStderrChars) {
        this.process = process;
        this.target = target;
        this.stream = stream;
        this.completeTimeout = completeTimeout;
        this.stdin = new BufferedOutputStream(process.getOutputStream(), 64 * 1024);
        this.errGobbler = StreamGobbler.start(process.getErrorStream(), stderr, "ffmpeg-encode-err", maxStderrChars);
        this.outGobbler = StreamGobbler.start(process.getInputStream(), new StringBuffer(), "ffmpeg-encode-out",
                maxStderrChars);
    }

    @Override
    public Path target() {
        return target;
    }

    @Override
    public void write(AudioBuffer buffer) throws IOException {
        if (completed || aborted) {
            throw new IOException("Encoder is no longer open: " + target);
        }
        if (buffer.channels() != stream.channels() || buffer.sampleRate() != stream.sampleRate()) {
            throw new IOException("Buffer layout does not match encoder layout " + stream);
        }
        float[] samples = buffer.samples();
        ByteBuffer bytes = ByteBuffer.allocate(samples.length * FfmpegCommands.BYTES_PER_SAMPLE)
                .order(ByteOrder.LITTLE_ENDIAN);
        bytes.asFloatBuffer().put(samples);
        try {
            stdin.write(bytes.array());
        } catch (IOException e) {
            // a broken pipe means ffmpeg already died; its stderr says why
            throw new IOException("Encoder pipe closed: " + LogSanitizer.truncate(stderr.toString(), 400), e);
        }
    }

    @Override
    public void complete() throws IOException {
        if (completed) {
            return;
        }
        if (aborted) {
            throw new IOException("Encoder was aborted: " + target);
        }
        try {
            stdin.close();
            if (!process.waitFor(completeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw ToolFailureExceptionBuilder.create("Timeout after " + completeTimeout.toSeconds() + "s")
                        .tool("ffmpeg")
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .buildMediaException(target.toString());
            }
            StreamGobbler.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            int exit = process.exitValue();
            if (exit != 0) {
                throw ToolFailureExceptionBuilder.create("Encode failed")
                        .tool("ffmpeg")
                        .exitCode(exit)
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .metadata("stderr", LogSanitizer.truncate(stderr.toString(), 800))
                        .buildMediaException(target.toString());
            }
            if (!Files.isRegularFile(target)) {
                throw new IOException("Encoder exited cleanly but produced no file: " + target);
            }
            completed = true;
            LOG.debug("Encoded {} in {}ms", LogSanitizer.fileName(target), TimeUtils.elapsedMillis(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            throw new IOException("Interrupted while waiting for encoder", e);
        } catch (IOException | RuntimeException e) {
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
            stdin.close();
        } catch (IOException e) {
            LOG.debug("Closing encoder stdin failed: {}", e.toString());
        }
        ExternalProcessRunner.destroyQuietly(process);
        StreamGobbler.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        StreamGobbler.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.warn("Could not delete partial output {}: {}", target, e.toString());
        }
    }

    @Override
    public boolean isCompleted() {
        return completed;
    }
}
