package com.phillippitts.denoisebatch.service.batch.event;

import com.phillippitts.denoisebatch.domain.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Published after every job status transition.
 *
 * @param sessionId owning batch session
 * @param jobId job identifier
 * @param inputName input file name (no directories)
 * @param engine engine kind id
 * @param from previous status
 * @param to new status
 * @param duration execution time for SUCCEEDED/FAILED, otherwise null
 * @param error failure detail for FAILED, otherwise null
 * @param at transition time
 */
public record JobStatusChangedEvent(
        String sessionId,
        UUID jobId,
        String inputName,
        String engine,
        JobStatus from,
        JobStatus to,
        Duration duration,
        String error,
        Instant at
) {
}
