package com.phillippitts.denoisebatch.service.batch.event;

import com.phillippitts.denoisebatch.domain.ProcessingStats;

import java.time.Instant;

/**
 * Published once when the last worker of a run exits.
 *
 * @param sessionId batch session
 * @param runId run identifier within the session
 * @param stats statistics at the moment the run ended
 * @param stopped true if the run ended through stop() (explicitly or after a failure with
 *                continue-on-error disabled)
 * @param at finish time
 */
public record BatchFinishedEvent(String sessionId, String runId, ProcessingStats stats, boolean stopped, Instant at) {
}
