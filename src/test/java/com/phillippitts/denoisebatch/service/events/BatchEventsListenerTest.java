package com.phillippitts.denoisebatch.service.events;

import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.service.batch.event.BatchFinishedEvent;
import com.phillippitts.denoisebatch.service.batch.event.JobStatusChangedEvent;
import com.phillippitts.denoisebatch.service.engine.EngineFailureEvent;
import com.phillippitts.denoisebatch.service.metrics.BatchMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class BatchEventsListenerTest {

    private SimpleMeterRegistry registry;
    private BatchEventsListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new BatchEventsListener(new BatchMetrics(registry));
    }

    @Test
    void succeededTransitionShouldCountAndTime() {
        listener.onJobStatusChanged(event(JobStatus.RUNNING, JobStatus.SUCCEEDED, Duration.ofSeconds(3)));

        assertThat(registry.get("denoisebatch.job.succeeded").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("denoisebatch.job.duration").tag("outcome", "succeeded").timer().count())
                .isEqualTo(1);
    }

    @Test
    void failedTransitionShouldCountAndTime() {
        listener.onJobStatusChanged(event(JobStatus.RUNNING, JobStatus.FAILED, Duration.ofSeconds(1)));

        assertThat(registry.get("denoisebatch.job.failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("denoisebatch.job.duration").tag("outcome", "failed").timer().count())
                .isEqualTo(1);
    }

    @Test
    void cancellationShouldOnlyCount() {
        listener.onJobStatusChanged(event(JobStatus.QUEUED, JobStatus.CANCELLED, null));

        assertThat(registry.get("denoisebatch.job.cancelled").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("denoisebatch.job.duration").timer()).isNull();
    }

    @Test
    void startTransitionShouldNotTouchMetrics() {
        listener.onJobStatusChanged(event(JobStatus.QUEUED, JobStatus.RUNNING, null));

        assertThat(registry.getMeters()).isEmpty();
    }

    @Test
    void batchFinishedShouldBeLoggedWithoutError() {
        ProcessingStats stats = new ProcessingStats(3, 0, 0, 2, 1, 0, Duration.ofSeconds(90),
                Duration.ofSeconds(30), Duration.ZERO, 2.0);

        assertThatCode(() -> listener.onBatchFinished(
                new BatchFinishedEvent("s-1", "r-1", stats, false, Instant.now()))).doesNotThrowAnyException();
    }

    @Test
    void engineFailureLogsShouldBeThrottledPerKey() {
        assertThat(listener.shouldLog("engine-neural_denoise-process")).isTrue();
        assertThat(listener.shouldLog("engine-neural_denoise-process")).isFalse();
        assertThat(listener.shouldLog("engine-neural_denoise-prepare")).isTrue();

        assertThatCode(() -> listener.onEngineFailure(new EngineFailureEvent("neural_denoise", Instant.now(),
                "process failure", new IllegalStateException("x"), Map.of("stage", "process"))))
                .doesNotThrowAnyException();
    }

    private static JobStatusChangedEvent event(JobStatus from, JobStatus to, Duration duration) {
        return new JobStatusChangedEvent("s-1", UUID.randomUUID(), "take1.wav", "spectral_gate", from, to,
                duration, to == JobStatus.FAILED ? "boom" : null, Instant.now());
    }
}
