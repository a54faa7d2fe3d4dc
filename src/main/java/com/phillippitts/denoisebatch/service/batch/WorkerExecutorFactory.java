package com.phillippitts.denoisebatch.service.batch;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Creates a fresh, initialized executor sized for one batch run.
 */
@FunctionalInterface
public interface WorkerExecutorFactory {

    ThreadPoolTaskExecutor create(int workers);
}
