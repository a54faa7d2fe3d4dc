package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.config.properties.BatchProperties;
import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.OutputOptions;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.domain.SessionOptions;
import com.phillippitts.denoisebatch.exception.InvalidStateException;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.exception.PathException;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;
import com.phillippitts.denoisebatch.service.engine.EngineRegistry;
import com.phillippitts.denoisebatch.service.engine.NoiseReductionEngine;
import com.phillippitts.denoisebatch.service.engine.NoiseWindowSampler;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.service.media.SupportedFormats;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Owns the single active batch session and validates jobs before they are queued.
 *
 * <p>Enqueue validation runs synchronously, in this order:
 * <ol>
 *   <li>the input extension is on the allow-list</li>
 *   <li>the probe succeeds and finds an audio stream</li>
 *   <li>a manual noise window, if any, lies inside the input</li>
 *   <li>the engine accepts the config for the probed stream (dry-run prepare)</li>
 *   <li>the output directory exists or can be created and is writable</li>
 * </ol>
 * A job that passes is queued with its config, output options and resolved output path. Outputs of
 * queued and running jobs are reserved: a clash is numbered {@code _N}, or rejected when overwriting
 * is enabled.
 */
public class BatchSessionService {

    private static final Logger LOG = LogManager.getLogger(BatchSessionService.class);

    private final BatchScheduler scheduler;
    private final MediaIoAdapter media;
    private final EngineRegistry registry;
    private final OutputPathResolver pathResolver;
    private final BatchProperties properties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Map<EngineKind, NoiseReductionEngine> validationEngines = new EnumMap<>(EngineKind.class);

    private volatile BatchSession session;

    public BatchSessionService(BatchScheduler scheduler, MediaIoAdapter media, EngineRegistry registry,
                               OutputPathResolver pathResolver, BatchProperties properties,
                               ApplicationEventPublisher publisher, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.media = Objects.requireNonNull(media, "media");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = publisher;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.session = new BatchSession(properties.toSessionOptions(), clock, publisher);
    }

    public BatchSession currentSession() {
        return session;
    }

    /**
     * Replaces the current session, discarding its jobs.
     *
     * @throws InvalidStateException while a run is active
     */
    public synchronized BatchSession newSession(SessionOptions options) {
        if (scheduler.isRunning()) {
            throw new InvalidStateException("Cannot start a new session while a batch is running");
        }
        BatchSession created = new BatchSession(options == null ? properties.toSessionOptions() : options,
                clock, publisher);
        this.session = created;
        LOG.info("New batch session {}: parallelism={}, continueOnError={}, autoClearCompleted={}",
                created.id(), created.options().parallelism(), created.options().continueOnError(),
                created.options().autoClearCompleted());
        return created;
    }

    /**
     * Validates and queues one file.
     *
     * @throws MediaException if the format is not allowed, the file cannot be probed or has no audio
     * @throws com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException if the
     *         engine rejects the config for this input
     * @throws com.phillippitts.denoisebatch.exception.OutOfRangeException if the manual noise window
     *         extends past the end of the input
     * @throws PathException if the output cannot be written or another pending job already writes it
     * @throws InvalidStateException if the session's queue is draining or stopped
     */
    public Job enqueue(Path input, EngineConfig config, OutputOptions outputOptions) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(config, "config");
        OutputOptions options = outputOptions != null ? outputOptions : OutputOptions.defaults();
        if (!SupportedFormats.isSupported(input)) {
            throw new MediaException("Unsupported file format '" + SupportedFormats.extensionOf(input) + "'",
                    input.toString());
        }
        MediaInfo info = media.probe(input);
        if (!info.hasAudio()) {
            throw new MediaException("File has no audio stream", input.toString());
        }
        config.noiseWindow().ifPresent(w -> NoiseWindowSampler.requireWithin(w, info.durationSeconds()));
        dryRunPrepare(config, info, options);

        Path resolved = pathResolver.prepare(input, options, info.hasVideo());
        Job job;
        BatchSession current;
        synchronized (this) {
            current = session;
            Set<Path> reserved = reservedOutputs(current);
            Path output;
            if (properties.isOverwriteExisting()) {
                if (reserved.contains(resolved)) {
                    throw new PathException("Another queued or running job already writes this output",
                            resolved.toString());
                }
                output = resolved;
            } else {
                output = OutputPathResolver.uniquePath(resolved, reserved::contains);
            }
            job = Job.create(input.toAbsolutePath().normalize(), config, options, output);
            current.queue().enqueue(job);
        }
        LOG.info("Queued job {} in session {}: {} ({})", job.id(), current.id(), LogSanitizer.fileName(input),
                config.kind().id());
        return job;
    }

    private static Set<Path> reservedOutputs(BatchSession current) {
        Set<Path> reserved = new HashSet<>();
        for (Job j : current.jobs()) {
            if (!j.status().isTerminal()) {
                reserved.add(j.outputPath());
            }
        }
        return reserved;
    }

    /**
     * @throws InvalidStateException if a run is active or no job is queued
     */
    public BatchRun start() {
        BatchSession current = session;
        if (current.queue().pendingCount() == 0) {
            throw new InvalidStateException("No queued jobs to process");
        }
        return scheduler.start(current);
    }

    public void pause() {
        scheduler.pause();
    }

    public void resume() {
        scheduler.resume();
    }

    public List<Job> stop() {
        return scheduler.stop();
    }

    /**
     * @return number of succeeded jobs removed from the visible list
     */
    public int clearCompleted() {
        return session.queue().removeTerminal(JobStatus.SUCCEEDED);
    }

    public ProcessingStats stats() {
        return session.stats();
    }

    public List<Job> jobs() {
        return session.jobs();
    }

    /**
     * @return the visible job with {@code id} in the current session
     */
    public Optional<Job> job(UUID id) {
        return session.jobs().stream()
                .filter(j -> j.id().equals(id))
                .findFirst();
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    private void dryRunPrepare(EngineConfig config, MediaInfo info, OutputOptions options) {
        synchronized (validationEngines) {
            NoiseReductionEngine engine = validationEngines.computeIfAbsent(config.kind(), registry::create);
            engine.initialize();
            try (EngineHandle ignored = engine.prepare(config, info.streamInfo(options.sampleRate()))) {
                LOG.debug("Engine {} accepted config for {}", config.kind().id(), LogSanitizer.fileName(info.path()));
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.activeRun().ifPresent(run -> {
            LOG.info("Shutting down: stopping run {}", run.id());
            run.stop();
            try {
                run.awaitCompletion(Duration.ofSeconds(properties.getAwaitTerminationSeconds()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for run {} to stop", run.id());
            } catch (TimeoutException e) {
                LOG.warn("Run {} did not stop within {} s", run.id(), properties.getAwaitTerminationSeconds());
            }
        });
        synchronized (validationEngines) {
            validationEngines.values().forEach(NoiseReductionEngine::close);
            validationEngines.clear();
        }
    }
}
