package com.phillippitts.denoisebatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Job-level metrics, tagged by engine kind.
 *
 * <p>Exposed via Micrometer at /actuator/metrics and /actuator/prometheus.
 */
@Component
public class BatchMetrics {

    static final String METRIC_PREFIX = "denoisebatch.job";

    private final MeterRegistry registry;

    public BatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a job ran before succeeding or failing.
     */
    public void recordDuration(String engine, String outcome, Duration duration) {
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Wall time of one job from start to terminal status")
                .tag("engine", engine)
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void incrementSucceeded(String engine) {
        counter("succeeded", "Number of jobs that produced output", engine).increment();
    }

    public void incrementFailed(String engine) {
        counter("failed", "Number of jobs that ended with an error", engine).increment();
    }

    public void incrementCancelled(String engine) {
        counter("cancelled", "Number of jobs cancelled before they started", engine).increment();
    }

    private Counter counter(String name, String description, String engine) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .tag("engine", engine)
                .register(registry);
    }
}
