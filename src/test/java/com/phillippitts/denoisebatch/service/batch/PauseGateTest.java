package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.exception.ProcessingAbortedException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PauseGateTest {

    @Test
    void pausedGateShouldBlockUntilResumed() throws InterruptedException {
        PauseGate gate = new PauseGate();
        gate.pause();
        AtomicBoolean passed = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            started.countDown();
            try {
                gate.awaitOpen();
                passed.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();
        assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(passed).isFalse();

        gate.resume();

        await().atMost(2, TimeUnit.SECONDS).untilTrue(passed);
        worker.join(1000);
    }

    @Test
    void releasedGateShouldIgnoreFurtherPauses() throws InterruptedException {
        PauseGate gate = new PauseGate();
        gate.pause();
        gate.release();
        gate.pause();

        assertThat(gate.isPaused()).isFalse();
        gate.awaitOpen();
    }

    @Test
    void abortSignalShouldTripCheckpointOnce() {
        AbortSignal signal = new AbortSignal();
        signal.checkpoint();

        assertThat(signal.abort()).isTrue();
        assertThat(signal.abort()).isFalse();
        assertThat(signal.isAborted()).isTrue();
        assertThatThrownBy(signal::checkpoint).isInstanceOf(ProcessingAbortedException.class);
    }
}
