package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.exception.InvalidStateException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO holding area for a session's jobs, shared by all workers of a run.
 *
 * <p>States:
 * <ul>
 *   <li>open: accepts enqueues and hands out jobs</li>
 *   <li>sealed: a worker found the queue empty, so the run is draining; late enqueues are
 *       rejected instead of being stranded</li>
 *   <li>cancelled: {@link #cancelPending()} ran; nothing more is handed out</li>
 * </ul>
 * {@link #reopen()} returns a sealed or cancelled queue to open once the run has ended.
 *
 * <p>Status changes go through the {@link ProgressTracker} while this queue's lock is held.
 */
public class JobQueue {

    private final Lock lock = new ReentrantLock();
    private final ProgressTracker tracker;
    private final List<Job> visible = new ArrayList<>();
    private final Deque<Job> pending = new ArrayDeque<>();
    private boolean sealed;
    private boolean cancelled;

    public JobQueue(ProgressTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
    }

    /**
     * Appends a QUEUED job.
     *
     * @throws InvalidStateException if the queue is sealed or cancelled
     */
    public void enqueue(Job job) {
        Objects.requireNonNull(job, "job");
        if (job.status() != JobStatus.QUEUED) {
            throw new IllegalArgumentException("Only QUEUED jobs can be enqueued, got " + job.status());
        }
        lock.lock();
        try {
            if (cancelled) {
                throw new InvalidStateException("Batch was stopped; no new jobs accepted until it has finished");
            }
            if (sealed) {
                throw new InvalidStateException("Batch is draining; no new jobs accepted until it has finished");
            }
            visible.add(job);
            pending.addLast(job);
            tracker.onEnqueued(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest queued job and marks it RUNNING in the same critical section.
     *
     * @return the job, or empty when nothing is left (which seals the queue) or it was cancelled
     */
    public Optional<Job> dequeueNext() {
        lock.lock();
        try {
            if (cancelled) {
                return Optional.empty();
            }
            Job next = pending.pollFirst();
            if (next == null) {
                sealed = true;
                return Optional.empty();
            }
            tracker.transition(next, JobStatus.RUNNING, null);
            return Optional.of(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every job still waiting and stops further dequeues. Running jobs are untouched.
     *
     * @return the cancelled jobs in queue order
     */
    public List<Job> cancelPending() {
        lock.lock();
        try {
            cancelled = true;
            List<Job> result = new ArrayList<>(pending);
            pending.clear();
            for (Job job : result) {
                tracker.transition(job, JobStatus.CANCELLED, null);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return copy of all visible jobs in arrival order
     */
    public List<Job> snapshot() {
        lock.lock();
        try {
            return List.copyOf(visible);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes jobs with the given terminal status from the visible list. Statistics are not
     * affected.
     *
     * @return number of jobs removed
     */
    public int removeTerminal(JobStatus status) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Only terminal jobs can be removed, got " + status);
        }
        lock.lock();
        try {
            int removed = 0;
            for (Iterator<Job> it = visible.iterator(); it.hasNext(); ) {
                if (it.next().status() == status) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accepts new jobs again after a run has ended.
     */
    public void reopen() {
        lock.lock();
        try {
            sealed = false;
            cancelled = false;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isAcceptingJobs() {
        lock.lock();
        try {
            return !sealed && !cancelled;
        } finally {
            lock.unlock();
        }
    }
}
