package com.phillippitts.denoisebatch.config;

import com.phillippitts.denoisebatch.config.properties.BatchProperties;
import com.phillippitts.denoisebatch.config.properties.PreviewProperties;
import com.phillippitts.denoisebatch.service.batch.BatchScheduler;
import com.phillippitts.denoisebatch.service.batch.BatchSessionService;
import com.phillippitts.denoisebatch.service.batch.JobExecutor;
import com.phillippitts.denoisebatch.service.batch.OutputPathResolver;
import com.phillippitts.denoisebatch.service.batch.WorkerExecutorFactory;
import com.phillippitts.denoisebatch.service.engine.EngineRegistry;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.service.preview.PreviewService;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the batch pipeline explicitly. The services are plain classes so tests can build
 * them without a Spring context.
 */
@Configuration
public class BatchConfig {

    private final MediaIoAdapter media;
    private final EngineRegistry engineRegistry;
    private final ApplicationEventPublisher publisher;

    public BatchConfig(MediaIoAdapter media, EngineRegistry engineRegistry, ApplicationEventPublisher publisher) {
        this.media = media;
        this.engineRegistry = engineRegistry;
        this.publisher = publisher;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Output naming; an unknown placeholder in {@code batch.output-pattern} fails startup.
     */
    @Bean
    public OutputPathResolver outputPathResolver(BatchProperties batchProperties) {
        return new OutputPathResolver(batchProperties.getOutputPattern(),
                batchProperties.getMinFreeDiskMb() * 1024 * 1024);
    }

    @Bean
    public JobExecutor jobExecutor() {
        return new JobExecutor(media);
    }

    @Bean
    public BatchScheduler batchScheduler(WorkerExecutorFactory workerExecutorFactory, JobExecutor jobExecutor,
                                         Clock clock) {
        return new BatchScheduler(workerExecutorFactory, engineRegistry, jobExecutor, publisher, clock);
    }

    @Bean
    public BatchSessionService batchSessionService(BatchScheduler batchScheduler,
                                                   OutputPathResolver outputPathResolver,
                                                   BatchProperties batchProperties, Clock clock) {
        return new BatchSessionService(batchScheduler, media, engineRegistry, outputPathResolver,
                batchProperties, publisher, clock);
    }

    @Bean
    public PreviewService previewService(PreviewProperties previewProperties) {
        return new PreviewService(media, engineRegistry, previewProperties);
    }
}
