package com.phillippitts.denoisebatch.service.events;

import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.service.batch.event.BatchFinishedEvent;
import com.phillippitts.denoisebatch.service.batch.event.JobStatusChangedEvent;
import com.phillippitts.denoisebatch.service.engine.EngineFailureEvent;
import com.phillippitts.denoisebatch.service.metrics.BatchMetrics;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns batch and engine events into metrics and log lines. Engine failure logs are throttled
 * per engine and stage.
 */
@Component
class BatchEventsListener {
    private static final Logger LOG = LogManager.getLogger(BatchEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final int MAX_MESSAGE_CHARS = 300;

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final BatchMetrics metrics;

    BatchEventsListener(BatchMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onJobStatusChanged(JobStatusChangedEvent e) {
        switch (e.to()) {
            case SUCCEEDED -> {
                metrics.incrementSucceeded(e.engine());
                recordDuration(e, "succeeded");
            }
            case FAILED -> {
                metrics.incrementFailed(e.engine());
                recordDuration(e, "failed");
            }
            case CANCELLED -> metrics.incrementCancelled(e.engine());
            default -> LOG.debug("Job {} ({}) {} -> {}", e.jobId(), e.inputName(), e.from(), e.to());
        }
    }

    @EventListener
    void onBatchFinished(BatchFinishedEvent e) {
        ProcessingStats s = e.stats();
        LOG.info("Session {} run {} {}: total={}, succeeded={}, failed={}, cancelled={}, elapsed={}, "
                        + "throughput={}/min",
                e.sessionId(), e.runId(), e.stopped() ? "stopped" : "completed", s.total(), s.succeeded(),
                s.failed(), s.cancelled(), TimeUtils.formatDuration(s.elapsed()),
                String.format("%.2f", s.throughputPerMinute()));
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        String stage = e.context().getOrDefault("stage", "unknown");
        String key = "engine-" + e.engine() + '-' + stage;
        if (shouldLog(key)) {
            LOG.warn("Engine failure: engine={}, stage={}, message={}", e.engine(), stage,
                    LogSanitizer.truncate(e.message(), MAX_MESSAGE_CHARS));
        }
    }

    private void recordDuration(JobStatusChangedEvent e, String outcome) {
        if (e.duration() != null) {
            metrics.recordDuration(e.engine(), outcome, e.duration());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
