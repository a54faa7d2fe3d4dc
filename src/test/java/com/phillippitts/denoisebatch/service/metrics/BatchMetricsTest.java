package com.phillippitts.denoisebatch.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BatchMetricsTest {

    private SimpleMeterRegistry registry;
    private BatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new BatchMetrics(registry);
    }

    @Test
    void countersShouldBeTaggedByEngine() {
        metrics.incrementSucceeded("spectral_gate");
        metrics.incrementSucceeded("spectral_gate");
        metrics.incrementFailed("neural_denoise");
        metrics.incrementCancelled("spectral_gate");

        assertThat(registry.get("denoisebatch.job.succeeded").tag("engine", "spectral_gate").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("denoisebatch.job.failed").tag("engine", "neural_denoise").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("denoisebatch.job.cancelled").tag("engine", "spectral_gate").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("denoisebatch.job.failed").tag("engine", "spectral_gate").counter()).isNull();
    }

    @Test
    void durationShouldBeTaggedByOutcome() {
        metrics.recordDuration("source_separation", "succeeded", Duration.ofSeconds(4));
        metrics.recordDuration("source_separation", "succeeded", Duration.ofSeconds(2));
        metrics.recordDuration("source_separation", "failed", Duration.ofMillis(500));

        Timer succeeded = registry.get("denoisebatch.job.duration")
                .tags("engine", "source_separation", "outcome", "succeeded").timer();
        assertThat(succeeded.count()).isEqualTo(2);
        assertThat(succeeded.totalTime(TimeUnit.SECONDS)).isEqualTo(6.0);
        assertThat(registry.get("denoisebatch.job.duration").tag("outcome", "failed").timer().count())
                .isEqualTo(1);
    }
}
