package com.phillippitts.denoisebatch.config;

import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.service.batch.BatchSessionService;
import com.phillippitts.denoisebatch.util.TimeUtils;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Exposes live batch counters via Micrometer.
 *
 * <ul>
 *   <li>denoisebatch.session.queued - jobs waiting in the current session</li>
 *   <li>denoisebatch.session.running - jobs in flight</li>
 *   <li>denoisebatch.session.total - jobs ever enqueued in the current session</li>
 * </ul>
 *
 * <p>Additionally logs a progress summary every 5 minutes while a run is active.
 */
@Configuration
public class BatchMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(BatchMetricsConfig.class);

    private final ObjectProvider<BatchSessionService> sessionServiceProvider;

    public BatchMetricsConfig(ObjectProvider<BatchSessionService> sessionServiceProvider) {
        this.sessionServiceProvider = sessionServiceProvider;
    }

    @Bean
    public MeterBinder batchSessionMetrics() {
        return registry -> {
            BatchSessionService sessions = sessionServiceProvider.getObject();

            Gauge.builder("denoisebatch.session.queued", sessions, s -> s.stats().queued())
                    .description("Jobs waiting in the current session")
                    .register(registry);

            Gauge.builder("denoisebatch.session.running", sessions, s -> s.stats().running())
                    .description("Jobs currently being processed")
                    .register(registry);

            Gauge.builder("denoisebatch.session.total", sessions, s -> s.stats().total())
                    .description("Jobs enqueued in the current session")
                    .register(registry);

            LOG.info("Batch session metrics registered: denoisebatch.session.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logBatchProgress() {
        BatchSessionService sessions = sessionServiceProvider.getIfAvailable();
        if (sessions == null || !sessions.isRunning()) {
            return;
        }
        ProcessingStats s = sessions.stats();
        LOG.info("Batch progress: {}/{} done (succeeded={}, failed={}, cancelled={}), running={}, queued={}, "
                        + "elapsed={}, eta={}",
                s.completed() + s.cancelled(), s.total(), s.succeeded(), s.failed(), s.cancelled(),
                s.running(), s.queued(), TimeUtils.formatDuration(s.elapsed()),
                TimeUtils.formatDuration(s.estimatedRemaining()));
    }
}
