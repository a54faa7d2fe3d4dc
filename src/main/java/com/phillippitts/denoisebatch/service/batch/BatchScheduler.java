package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.exception.InvalidStateException;
import com.phillippitts.denoisebatch.service.batch.event.BatchFinishedEvent;
import com.phillippitts.denoisebatch.service.engine.EngineRegistry;
import com.phillippitts.denoisebatch.service.engine.NoiseReductionEngine;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drains a session's queue with a fixed number of workers.
 *
 * <p>Each {@link #start(BatchSession)} gets its own executor sized to the session's
 * parallelism, so changing parallelism only affects the next run. Every worker loops:
 * wait at the pause gate, check the abort flag, take the next job, execute it. Workers cache
 * one engine per kind for the duration of the run and close them on exit.
 *
 * <p>At most one run is active at a time. The last worker to exit finishes the run: it
 * reopens the queue, publishes {@link BatchFinishedEvent} and completes the run's future.
 */
public class BatchScheduler {

    private static final Logger LOG = LogManager.getLogger(BatchScheduler.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String MDC_JOB_ID = "jobId";

    private final WorkerExecutorFactory executorFactory;
    private final EngineRegistry registry;
    private final JobExecutor jobExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private volatile BatchRun activeRun;

    public BatchScheduler(WorkerExecutorFactory executorFactory, EngineRegistry registry, JobExecutor jobExecutor,
                          ApplicationEventPublisher publisher, Clock clock) {
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.jobExecutor = Objects.requireNonNull(jobExecutor, "jobExecutor");
        this.publisher = publisher;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Spawns the session's workers and returns immediately.
     *
     * @throws InvalidStateException if a run is already active
     */
    public synchronized BatchRun start(BatchSession session) {
        if (activeRun != null) {
            throw new InvalidStateException("A batch run is already active: " + activeRun.id());
        }
        int workers = session.options().parallelism();
        BatchRun run = new BatchRun(UUID.randomUUID().toString().substring(0, 8), session, workers);
        ThreadPoolTaskExecutor executor = executorFactory.create(workers);
        session.tracker().markRunStarted();
        activeRun = run;
        LOG.info("Run {} started for session {}: {} worker(s), {} job(s) queued", run.id(), session.id(),
                workers, session.queue().pendingCount());
        for (int i = 0; i < workers; i++) {
            executor.execute(() -> workerLoop(run, executor));
        }
        return run;
    }

    /**
     * Stops workers from taking new jobs; running jobs finish.
     */
    public void pause() {
        BatchRun run = requireActiveRun();
        run.pause();
        LOG.info("Run {} paused", run.id());
    }

    public void resume() {
        BatchRun run = requireActiveRun();
        run.resume();
        LOG.info("Run {} resumed", run.id());
    }

    /**
     * Cancels queued jobs and aborts running ones at their next chunk boundary.
     *
     * @return jobs cancelled by this call
     */
    public List<Job> stop() {
        return requireActiveRun().stop();
    }

    public Optional<BatchRun> activeRun() {
        return Optional.ofNullable(activeRun);
    }

    public boolean isRunning() {
        return activeRun != null;
    }

    private BatchRun requireActiveRun() {
        BatchRun run = activeRun;
        if (run == null) {
            throw new InvalidStateException("No batch run is active");
        }
        return run;
    }

    private void workerLoop(BatchRun run, ThreadPoolTaskExecutor executor) {
        BatchSession session = run.session();
        Map<EngineKind, NoiseReductionEngine> engines = new EnumMap<>(EngineKind.class);
        ThreadContext.put(MDC_SESSION_ID, session.id());
        try {
            while (true) {
                run.pauseGate().awaitOpen();
                if (run.abortSignal().isAborted()) {
                    break;
                }
                Optional<Job> next = session.queue().dequeueNext();
                if (next.isEmpty()) {
                    break;
                }
                runJob(run, next.get(), engines);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Worker interrupted while paused; leaving run {}", run.id());
        } catch (RuntimeException e) {
            LOG.error("Worker of run {} terminated unexpectedly", run.id(), e);
        } finally {
            closeEngines(engines);
            ThreadContext.remove(MDC_SESSION_ID);
            if (run.workerExited()) {
                finishRun(run, executor);
            }
        }
    }

    private void runJob(BatchRun run, Job job, Map<EngineKind, NoiseReductionEngine> engines) {
        BatchSession session = run.session();
        ThreadContext.put(MDC_JOB_ID, job.id().toString());
        try {
            JobStatus outcome = jobExecutor.execute(job, kind -> engines.computeIfAbsent(kind, registry::create),
                    run.abortSignal(), session.tracker(), () -> haltOnFailure(run, job));
            if (outcome == JobStatus.SUCCEEDED && session.options().autoClearCompleted()) {
                session.queue().removeTerminal(JobStatus.SUCCEEDED);
            }
        } finally {
            ThreadContext.remove(MDC_JOB_ID);
        }
    }

    /**
     * Runs before a failed job is marked FAILED, so no queued job can start once the failure is visible.
     */
    private static void haltOnFailure(BatchRun run, Job job) {
        if (run.session().options().continueOnError() || run.isStopRequested()) {
            return;
        }
        LOG.warn("Job {} failed and continue-on-error is off; stopping run {}", job.id(), run.id());
        run.stop();
    }

    private void finishRun(BatchRun run, ThreadPoolTaskExecutor executor) {
        BatchSession session = run.session();
        ProcessingStats stats;
        try {
            session.tracker().markRunFinished();
            session.queue().reopen();
            stats = session.stats();
            synchronized (this) {
                if (activeRun == run) {
                    activeRun = null;
                }
            }
            LOG.info("Run {} finished in {}: {} succeeded, {} failed, {} cancelled of {}", run.id(),
                    TimeUtils.formatDuration(stats.elapsed()), stats.succeeded(), stats.failed(),
                    stats.cancelled(), stats.total());
            if (publisher != null) {
                publisher.publishEvent(new BatchFinishedEvent(session.id(), run.id(), stats,
                        run.isStopRequested(), clock.instant()));
            }
        } catch (RuntimeException e) {
            LOG.error("Finishing run {} failed", run.id(), e);
            synchronized (this) {
                if (activeRun == run) {
                    activeRun = null;
                }
            }
            run.fail(e);
            executor.shutdown();
            return;
        }
        run.complete(stats);
        executor.shutdown();
    }

    private static void closeEngines(Map<EngineKind, NoiseReductionEngine> engines) {
        for (NoiseReductionEngine engine : engines.values()) {
            try {
                engine.close();
            } catch (RuntimeException e) {
                LOG.warn("Closing engine {} failed: {}", engine.kind().id(), e.toString());
            }
        }
        engines.clear();
    }
}
