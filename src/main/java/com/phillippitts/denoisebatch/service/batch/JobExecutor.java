package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.NoiseWindow;
import com.phillippitts.denoisebatch.domain.OutputOptions;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.BatchDenoiseException;
import com.phillippitts.denoisebatch.exception.EngineFailureException;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.service.audio.LoudnessNormalizer;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;
import com.phillippitts.denoisebatch.service.engine.NoiseReductionEngine;
import com.phillippitts.denoisebatch.service.engine.NoiseWindowSampler;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.media.MediaEncoder;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.service.media.SupportedFormats;
import com.phillippitts.denoisebatch.service.media.wav.WavReader;
import com.phillippitts.denoisebatch.service.media.wav.WavWriter;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import com.phillippitts.denoisebatch.util.TempFiles;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs one job end to end on the calling worker thread.
 *
 * <p>Pipeline: probe, decode, prepare, learn from the manual noise window if the config has one, chunked process and write to a {@code .partial}
 * sibling, flush the engine tail, optional two-pass loudness normalization over a float WAV
 * intermediate, then an atomic move into place. The abort signal is checked before every
 * chunk and before the final move, never in the middle of a write.
 *
 * <p>{@link #execute} never throws for job-level failures; the outcome is recorded on the job
 * through the progress tracker.
 */
public class JobExecutor {

    private static final Logger LOG = LogManager.getLogger(JobExecutor.class);

    static final double DENOISE_PROGRESS_SHARE = 0.95;
    static final double NORMALIZE_FIRST_PASS_SHARE = 0.5;
    static final float CLIP_LIMIT = (float) LoudnessNormalizer.LIMITER_THRESHOLD;

    private final MediaIoAdapter media;

    public JobExecutor(MediaIoAdapter media) {
        this.media = Objects.requireNonNull(media, "media");
    }

    public JobStatus execute(Job job, Function<EngineKind, NoiseReductionEngine> engines,
                             AbortSignal abort, ProgressTracker tracker) {
        return execute(job, engines, abort, tracker, () -> { });
    }

    /**
     * Executes {@code job}, which must already be RUNNING.
     *
     * @param engines returns the worker's engine for a kind
     * @param beforeFailure runs after cleanup and before the job is marked FAILED
     * @return the terminal status the job ended in (SUCCEEDED or FAILED)
     */
    public JobStatus execute(Job job, Function<EngineKind, NoiseReductionEngine> engines,
                             AbortSignal abort, ProgressTracker tracker, Runnable beforeFailure) {
        long startNanos = System.nanoTime();
        Path partial = OutputPathResolver.partialPath(job.outputPath(), job.id());
        Path intermediate = intermediatePath(job.outputPath());
        String input = LogSanitizer.fileName(job.inputPath());
        LOG.info("Job {} started: {} with engine {}", job.id(), input, job.engineConfig().kind().id());
        try {
            runPipeline(job, engines, abort, partial, intermediate);
        } catch (Exception e) {
            TempFiles.deleteQuietly(partial);
            BatchDenoiseException failure = classify(e, job);
            String detail = failure.getClass().getSimpleName() + ": " + failure.getMessage();
            beforeFailure.run();
            tracker.transition(job, JobStatus.FAILED, detail);
            LOG.warn("Job {} failed after {} ms: {} ({})", job.id(), TimeUtils.elapsedMillis(startNanos),
                    input, detail);
            LOG.debug("Job {} failure detail", job.id(), failure);
            return JobStatus.FAILED;
        } finally {
            TempFiles.deleteQuietly(intermediate);
        }
        tracker.transition(job, JobStatus.SUCCEEDED, null);
        LOG.info("Job {} succeeded in {} ms: {} -> {}", job.id(), TimeUtils.elapsedMillis(startNanos),
                input, LogSanitizer.fileName(job.outputPath()));
        return JobStatus.SUCCEEDED;
    }

    private void runPipeline(Job job, Function<EngineKind, NoiseReductionEngine> engines, AbortSignal abort,
                             Path partial, Path intermediate) throws IOException {
        abort.checkpoint();
        MediaInfo info = media.probe(job.inputPath());
        if (!info.hasAudio()) {
            throw new MediaException("Input has no audio stream", job.inputPath().toString());
        }
        NoiseReductionEngine engine = engines.apply(job.engineConfig().kind());
        engine.initialize();

        OutputOptions options = job.outputOptions();
        boolean keepVideo = options.preserveVideo() && info.hasVideo();
        try (AudioStream in = media.decode(job.inputPath(), options.sampleRate());
             EngineHandle handle = engine.prepare(job.engineConfig(), in.info())) {
            StreamInfo stream = in.info();
            Optional<NoiseWindow> window = job.engineConfig().noiseWindow();
            if (window.isPresent()) {
                long learned = NoiseWindowSampler.learn(media, job.inputPath(), options.sampleRate(), window.get(),
                        engine, handle);
                LOG.debug("Job {} learned noise from {} frame(s) at {}-{} s", job.id(), learned,
                        window.get().startSeconds(), window.get().endSeconds());
            }
            if (options.normalizeLoudness()) {
                try (MediaEncoder stage = WavWriter.openFloat(intermediate, stream.channels(), stream.sampleRate())) {
                    denoise(job, engine, handle, in, stage, abort, NORMALIZE_FIRST_PASS_SHARE, false);
                    stage.complete();
                }
                normalize(job, intermediate, stream, info, partial, keepVideo, abort);
            } else {
                try (MediaEncoder out = media.openEncoder(partial, stream, info, keepVideo)) {
                    denoise(job, engine, handle, in, out, abort, DENOISE_PROGRESS_SHARE, true);
                    out.complete();
                }
            }
        }
        abort.checkpoint();
        moveIntoPlace(partial, job.outputPath());
    }

    private static void denoise(Job job, NoiseReductionEngine engine, EngineHandle handle, AudioStream in,
                                MediaEncoder out, AbortSignal abort, double progressShare, boolean clip)
            throws IOException {
        long totalFrames = in.info().totalFrames();
        long framesDone = 0;
        AudioBuffer chunk;
        while (true) {
            abort.checkpoint();
            chunk = in.read();
            if (chunk == null) {
                break;
            }
            AudioBuffer processed = engine.process(handle, chunk);
            out.write(clip ? LoudnessNormalizer.clamp(processed, CLIP_LIMIT) : processed);
            framesDone += chunk.frames();
            if (totalFrames > 0) {
                job.updateProgress(progressShare * Math.min(1.0, (double) framesDone / totalFrames));
            }
        }
        AudioBuffer tail = engine.finish(handle);
        if (!tail.isEmpty()) {
            out.write(clip ? LoudnessNormalizer.clamp(tail, CLIP_LIMIT) : tail);
        }
        job.updateProgress(progressShare);
    }

    private void normalize(Job job, Path intermediate, StreamInfo stream, MediaInfo source, Path partial,
                           boolean keepVideo, AbortSignal abort) throws IOException {
        int chunkFrames = Math.max(1, stream.sampleRate());
        LoudnessNormalizer.Meter meter = LoudnessNormalizer.meter(stream.channels(), stream.sampleRate());
        long totalFrames = 0;
        try (WavReader reader = WavReader.open(intermediate, chunkFrames)) {
            AudioBuffer buffer;
            while ((buffer = reader.read()) != null) {
                abort.checkpoint();
                meter.accept(buffer);
                totalFrames += buffer.frames();
            }
        }
        double lufs = meter.integratedLufs();
        double factor = LoudnessNormalizer.normalizationFactor(lufs, meter.peak(), job.outputOptions().targetLufs());
        LOG.debug("Job {} loudness {} LUFS, peak {}, gain factor {}", job.id(), lufs, meter.peak(), factor);

        double base = NORMALIZE_FIRST_PASS_SHARE;
        double share = DENOISE_PROGRESS_SHARE - NORMALIZE_FIRST_PASS_SHARE;
        long written = 0;
        try (WavReader reader = WavReader.open(intermediate, chunkFrames);
             MediaEncoder out = media.openEncoder(partial, stream, source, keepVideo)) {
            AudioBuffer buffer;
            while (true) {
                abort.checkpoint();
                buffer = reader.read();
                if (buffer == null) {
                    break;
                }
                out.write(LoudnessNormalizer.scale(buffer, factor));
                written += buffer.frames();
                if (totalFrames > 0) {
                    job.updateProgress(base + share * ((double) written / totalFrames));
                }
            }
            out.complete();
        }
    }

    static void moveIntoPlace(Path partial, Path output) throws IOException {
        if (!Files.exists(partial)) {
            throw new MediaException("Encoder finished without producing output", partial.toString());
        }
        try {
            Files.move(partial, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static Path intermediatePath(Path output) {
        return output.resolveSibling("." + SupportedFormats.stemOf(output) + "." + UUID.randomUUID()
                + ".norm.wav");
    }

    private static BatchDenoiseException classify(Exception e, Job job) {
        if (e instanceof BatchDenoiseException bde) {
            return bde;
        }
        if (e instanceof IOException || e instanceof UncheckedIOException) {
            return new MediaException("I/O failure: " + e.getMessage(), job.inputPath().toString(), e);
        }
        return new EngineFailureException("Unexpected error: " + e, job.engineConfig().kind().id(), e);
    }
}
