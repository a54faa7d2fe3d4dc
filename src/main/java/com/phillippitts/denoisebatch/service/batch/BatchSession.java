package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.domain.SessionOptions;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A set of jobs with shared options and statistics. Owns its queue and tracker exclusively.
 */
public final class BatchSession {

    private final String id;
    private final SessionOptions options;
    private final ProgressTracker tracker;
    private final JobQueue queue;
    private final Instant createdAt;

    public BatchSession(SessionOptions options, Clock clock, ApplicationEventPublisher publisher) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.options = options;
        this.tracker = new ProgressTracker(id, clock, publisher);
        this.queue = new JobQueue(tracker);
        this.createdAt = clock.instant();
    }

    public String id() {
        return id;
    }

    public SessionOptions options() {
        return options;
    }

    public JobQueue queue() {
        return queue;
    }

    public ProgressTracker tracker() {
        return tracker;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<Job> jobs() {
        return queue.snapshot();
    }

    public ProcessingStats stats() {
        return tracker.snapshot();
    }
}
