package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle for one {@code start()} of a batch session. Completes with the final statistics once
 * every worker has exited.
 */
public final class BatchRun {

    private static final Logger LOG = LogManager.getLogger(BatchRun.class);

    private final String id;
    private final BatchSession session;
    private final int workers;
    private final PauseGate pauseGate = new PauseGate();
    private final AbortSignal abortSignal = new AbortSignal();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicInteger liveWorkers;
    private final CompletableFuture<ProcessingStats> completion = new CompletableFuture<>();

    BatchRun(String id, BatchSession session, int workers) {
        this.id = id;
        this.session = session;
        this.workers = workers;
        this.liveWorkers = new AtomicInteger(workers);
    }

    public String id() {
        return id;
    }

    public BatchSession session() {
        return session;
    }

    public int workers() {
        return workers;
    }

    public CompletableFuture<ProcessingStats> completion() {
        return completion;
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    public boolean isPaused() {
        return pauseGate.isPaused();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Blocks until all workers have exited.
     *
     * @return final statistics
     * @throws TimeoutException if the run is still going after {@code timeout}
     */
    public ProcessingStats awaitCompletion(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch run " + id + " completed exceptionally", e.getCause());
        }
    }

    void pause() {
        pauseGate.pause();
    }

    void resume() {
        pauseGate.resume();
    }

    /**
     * Cancels queued jobs, raises the abort flag for running ones and wakes paused workers.
     *
     * @return jobs cancelled by this call
     */
    List<Job> stop() {
        stopRequested.set(true);
        List<Job> cancelled = session.queue().cancelPending();
        abortSignal.abort();
        pauseGate.release();
        LOG.info("Run {} stopping: {} queued job(s) cancelled", id, cancelled.size());
        return cancelled;
    }

    PauseGate pauseGate() {
        return pauseGate;
    }

    AbortSignal abortSignal() {
        return abortSignal;
    }

    /**
     * @return true if the calling worker was the last one alive
     */
    boolean workerExited() {
        return liveWorkers.decrementAndGet() == 0;
    }

    void complete(ProcessingStats stats) {
        completion.complete(stats);
    }

    void fail(Throwable t) {
        completion.completeExceptionally(t);
    }
}
