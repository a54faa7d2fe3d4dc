package com.phillippitts.denoisebatch.domain;

import com.phillippitts.denoisebatch.exception.InvalidStateException;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One file's end-to-end processing request within a batch.
 *
 * <p>Identity, input, engine config, output options and output path are fixed at enqueue time.
 * Status, timestamps and error are mutable and are only changed through
 * {@link #transition(JobStatus, Instant, String)}, which the progress tracker calls inside its
 * lock so that counters and statuses always agree. Fields are volatile so that readers
 * (snapshots, REST views) see a coherent value without taking that lock.
 */
public final class Job {

    private final UUID id;
    private final Path inputPath;
    private final EngineConfig engineConfig;
    private final OutputOptions outputOptions;
    private final Path outputPath;
    private final Instant createdAt;

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String error;
    private volatile double progress;

    public Job(UUID id, Path inputPath, EngineConfig engineConfig, OutputOptions outputOptions,
               Path outputPath, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath");
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        this.outputOptions = Objects.requireNonNull(outputOptions, "outputOptions");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public static Job create(Path inputPath, EngineConfig engineConfig, OutputOptions outputOptions,
                             Path outputPath) {
        return new Job(UUID.randomUUID(), inputPath, engineConfig, outputOptions, outputPath, Instant.now());
    }

    /**
     * Applies a status transition.
     *
     * <p>Entering RUNNING stamps {@code startedAt}; entering a terminal status stamps
     * {@code finishedAt}. {@code error} must be non-null exactly when entering FAILED.
     *
     * @param next target status
     * @param at transition time
     * @param errorDetail failure description for FAILED, otherwise null
     * @return the status the job had before the transition
     * @throws InvalidStateException if the transition is not allowed from the current status
     */
    public JobStatus transition(JobStatus next, Instant at, String errorDetail) {
        JobStatus current = this.status;
        if (!current.canTransitionTo(next)) {
            throw new InvalidStateException("Job " + id + " cannot move from " + current + " to " + next);
        }
        if ((next == JobStatus.FAILED) != (errorDetail != null)) {
            throw new IllegalArgumentException("error detail must be present iff status is FAILED");
        }
        if (next == JobStatus.RUNNING) {
            this.startedAt = at;
        }
        if (next.isTerminal()) {
            this.finishedAt = at;
            this.error = errorDetail;
            if (next == JobStatus.SUCCEEDED) {
                this.progress = 1.0;
            }
        }
        this.status = next;
        return current;
    }

    /**
     * Records chunk-level progress. Only the worker that owns the running job calls this.
     *
     * @param fraction completed fraction, clamped to [0, 1]
     */
    public void updateProgress(double fraction) {
        this.progress = Math.max(0.0, Math.min(1.0, fraction));
    }

    public UUID id() {
        return id;
    }

    public Path inputPath() {
        return inputPath;
    }

    public EngineConfig engineConfig() {
        return engineConfig;
    }

    public OutputOptions outputOptions() {
        return outputOptions;
    }

    public Path outputPath() {
        return outputPath;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public JobStatus status() {
        return status;
    }

    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> finishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public double progress() {
        return progress;
    }

    /**
     * @return execution time for a job that ran to a terminal status, empty otherwise
     */
    public Optional<Duration> duration() {
        Instant start = startedAt;
        Instant end = finishedAt;
        if (start == null || end == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(start, end));
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", input=" + inputPath.getFileName() + ", engine=" + engineConfig.kind().id()
                + ", status=" + status + '}';
    }
}
