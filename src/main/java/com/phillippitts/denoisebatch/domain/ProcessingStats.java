package com.phillippitts.denoisebatch.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Point-in-time batch statistics. Always produced by the progress tracker from the counters it
 * updates alongside each status transition, so the counts sum to {@code total}.
 *
 * @param total jobs ever enqueued in the session, including cleared ones
 * @param queued jobs waiting to run
 * @param running jobs in flight
 * @param succeeded jobs that produced output
 * @param failed jobs that ended with an error
 * @param cancelled jobs cancelled before they started
 * @param elapsed wall time since the first run of the session started
 * @param meanJobDuration mean duration of succeeded and failed jobs, null until one completes
 * @param estimatedRemaining remaining x mean duration, null while unknown
 * @param throughputPerMinute completed jobs per minute of elapsed time
 */
public record ProcessingStats(
        int total,
        int queued,
        int running,
        int succeeded,
        int failed,
        int cancelled,
        Duration elapsed,
        Duration meanJobDuration,
        Duration estimatedRemaining,
        double throughputPerMinute
) {

    public static ProcessingStats empty() {
        return new ProcessingStats(0, 0, 0, 0, 0, 0, Duration.ZERO, null, null, 0.0);
    }

    public int completed() {
        return succeeded + failed;
    }

    public int remaining() {
        return queued + running;
    }

    /**
     * @return ETA, empty while unknown (no job has completed yet)
     */
    public Optional<Duration> eta() {
        return Optional.ofNullable(estimatedRemaining);
    }

    public Optional<Duration> meanDuration() {
        return Optional.ofNullable(meanJobDuration);
    }

    /**
     * @return succeeded / completed in percent, 0 when nothing completed
     */
    public double successRate() {
        int completed = completed();
        return completed == 0 ? 0.0 : succeeded * 100.0 / completed;
    }

    public boolean isFinished() {
        return remaining() == 0;
    }
}
