package com.phillippitts.denoisebatch.config;

import com.phillippitts.denoisebatch.config.properties.BatchProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldSizePoolToWorkerCount() {
        executor = new ThreadPoolConfig(new BatchProperties()).workerExecutorFactory().create(3);

        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("denoise-worker-");
    }

    @Test
    void shouldUseConfiguredThreadNamePrefix() throws InterruptedException {
        BatchProperties properties = new BatchProperties();
        properties.setThreadNamePrefix("nr-");
        executor = new ThreadPoolConfig(properties).workerExecutorFactory().create(1);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("nr-");
    }

    @Test
    void shouldPropagateMdcToWorkers() throws InterruptedException {
        executor = new ThreadPoolConfig(new BatchProperties()).workerExecutorFactory().create(2);
        ThreadContext.put("requestId", "req-7");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-7");
    }

    @Test
    void decoratorShouldRestorePreviousContext() {
        ThreadContext.put("requestId", "submitter");
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagatingDecorator();
        Runnable decorated = decorator.decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
    }

    @Test
    void eachRunShouldGetItsOwnExecutor() {
        ThreadPoolConfig config = new ThreadPoolConfig(new BatchProperties());
        executor = config.workerExecutorFactory().create(1);
        ThreadPoolTaskExecutor other = config.workerExecutorFactory().create(1);
        try {
            assertThat(other).isNotSameAs(executor);
        } finally {
            other.shutdown();
        }
    }
}
