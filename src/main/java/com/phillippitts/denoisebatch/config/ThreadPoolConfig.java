package com.phillippitts.denoisebatch.config;

import com.phillippitts.denoisebatch.config.properties.BatchProperties;
import com.phillippitts.denoisebatch.service.batch.WorkerExecutorFactory;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Configuration for the batch worker pools.
 *
 * <p>Every batch run gets its own executor with exactly {@code parallelism} threads, created
 * through the {@link WorkerExecutorFactory} bean:
 * <ul>
 *   <li>Core and max pool: the run's worker count</li>
 *   <li>Queue: sized to the worker count, since each worker is a single long-lived task</li>
 *   <li>Thread naming: {@code batch.thread-name-prefix}</li>
 * </ul>
 *
 * <p>MDC propagation: copies the Log4j2 ThreadContext from the thread that starts the run, so
 * request correlation IDs appear in worker logs.
 *
 * <p>Shutdown does not wait for termination: the last worker shuts its own executor down, and
 * waiting there would block on itself.
 */
@Configuration
public class ThreadPoolConfig {

    private final BatchProperties batchProperties;

    public ThreadPoolConfig(BatchProperties batchProperties) {
        this.batchProperties = batchProperties;
    }

    @Bean
    public WorkerExecutorFactory workerExecutorFactory() {
        return workers -> {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(workers);
            executor.setMaxPoolSize(workers);
            executor.setQueueCapacity(workers);
            executor.setThreadNamePrefix(batchProperties.getThreadNamePrefix());
            executor.setWaitForTasksToCompleteOnShutdown(true);
            executor.setAwaitTerminationSeconds(0);
            executor.setTaskDecorator(mdcPropagatingDecorator());
            executor.initialize();
            return executor;
        };
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
