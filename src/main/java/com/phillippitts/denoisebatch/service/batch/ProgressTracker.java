package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.service.batch.event.JobStatusChangedEvent;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the batch counters and applies every job status transition.
 *
 * <p>A transition changes the job and the counters inside one critical section, so a
 * {@link #snapshot()} can never observe a status that the counts do not reflect. When the
 * queue calls in while holding its own lock, the order is always queue, then tracker.
 *
 * <p>ETA is {@code (queued + running) x mean duration} of succeeded and failed jobs. Cancelled
 * jobs are excluded from the mean. Durations stay in the mean after their jobs are cleared from
 * the visible list.
 */
public class ProgressTracker {

    private final Lock lock = new ReentrantLock();
    private final String sessionId;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private int total;
    private int queued;
    private int running;
    private int succeeded;
    private int failed;
    private int cancelled;
    private long completedDurationMillis;
    private Instant firstRunStartedAt;
    private Instant lastRunFinishedAt;
    private boolean runActive;

    public ProgressTracker(String sessionId, Clock clock, ApplicationEventPublisher publisher) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.publisher = publisher;
    }

    void onEnqueued(Job job) {
        lock.lock();
        try {
            total++;
            queued++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves {@code job} to {@code next} and updates the counters.
     *
     * @param error failure detail, required for FAILED and forbidden otherwise
     * @return previous status
     * @throws com.phillippitts.denoisebatch.exception.InvalidStateException if the job's current
     *         status does not allow the transition (nothing is counted in that case)
     */
    public JobStatus transition(Job job, JobStatus next, String error) {
        JobStatus previous;
        Instant at;
        lock.lock();
        try {
            at = clock.instant();
            previous = job.transition(next, at, error);
            decrement(previous);
            increment(next);
            if (next.isCompleted()) {
                completedDurationMillis += job.duration().map(Duration::toMillis).orElse(0L);
            }
        } finally {
            lock.unlock();
        }
        if (publisher != null) {
            publisher.publishEvent(new JobStatusChangedEvent(sessionId, job.id(),
                    LogSanitizer.fileName(job.inputPath()), job.engineConfig().kind().id(), previous, next,
                    next.isCompleted() ? job.duration().orElse(null) : null, error, at));
        }
        return previous;
    }

    void markRunStarted() {
        lock.lock();
        try {
            if (firstRunStartedAt == null) {
                firstRunStartedAt = clock.instant();
            }
            runActive = true;
            lastRunFinishedAt = null;
        } finally {
            lock.unlock();
        }
    }

    void markRunFinished() {
        lock.lock();
        try {
            runActive = false;
            lastRunFinishedAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public ProcessingStats snapshot() {
        lock.lock();
        try {
            Duration elapsed = elapsed();
            int completed = succeeded + failed;
            Duration mean = completed == 0 ? null : Duration.ofMillis(completedDurationMillis / completed);
            Duration eta = mean == null ? null : mean.multipliedBy((long) queued + running);
            double minutes = elapsed.toMillis() / 60_000.0;
            double throughput = minutes > 0 ? completed / minutes : 0.0;
            return new ProcessingStats(total, queued, running, succeeded, failed, cancelled,
                    elapsed, mean, eta, throughput);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunActive() {
        lock.lock();
        try {
            return runActive;
        } finally {
            lock.unlock();
        }
    }

    private Duration elapsed() {
        if (firstRunStartedAt == null) {
            return Duration.ZERO;
        }
        Instant end = lastRunFinishedAt != null ? lastRunFinishedAt : clock.instant();
        return Duration.between(firstRunStartedAt, end);
    }

    private void increment(JobStatus status) {
        switch (status) {
            case QUEUED -> queued++;
            case RUNNING -> running++;
            case SUCCEEDED -> succeeded++;
            case FAILED -> failed++;
            case CANCELLED -> cancelled++;
            default -> throw new IllegalStateException("Unexpected status " + status);
        }
    }

    private void decrement(JobStatus status) {
        switch (status) {
            case QUEUED -> queued--;
            case RUNNING -> running--;
            default -> throw new IllegalStateException("Transition out of terminal status " + status);
        }
    }
}
