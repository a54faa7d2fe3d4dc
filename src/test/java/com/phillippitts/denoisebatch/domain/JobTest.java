package com.phillippitts.denoisebatch.domain;

import com.phillippitts.denoisebatch.exception.InvalidStateException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    private static Job newJob() {
        return Job.create(Path.of("/in/a.wav"), SpectralGateConfig.defaults(), OutputOptions.defaults(),
                Path.of("/in/clean/a_clean.wav"));
    }

    @Test
    void shouldStartQueuedWithoutTimestamps() {
        Job job = newJob();

        assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.startedAt()).isEmpty();
        assertThat(job.finishedAt()).isEmpty();
        assertThat(job.error()).isEmpty();
        assertThat(job.duration()).isEmpty();
    }

    @Test
    void shouldStampTimesAndComputeDurationOnSuccess() {
        Job job = newJob();

        job.transition(JobStatus.RUNNING, T0, null);
        JobStatus previous = job.transition(JobStatus.SUCCEEDED, T0.plusSeconds(3), null);

        assertThat(previous).isEqualTo(JobStatus.RUNNING);
        assertThat(job.startedAt()).contains(T0);
        assertThat(job.finishedAt()).contains(T0.plusSeconds(3));
        assertThat(job.duration()).contains(Duration.ofSeconds(3));
        assertThat(job.progress()).isEqualTo(1.0);
    }

    @Test
    void shouldRequireErrorOnlyForFailed() {
        Job job = newJob();
        job.transition(JobStatus.RUNNING, T0, null);

        assertThatThrownBy(() -> job.transition(JobStatus.FAILED, T0, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.transition(JobStatus.SUCCEEDED, T0, "boom"))
                .isInstanceOf(IllegalArgumentException.class);

        job.transition(JobStatus.FAILED, T0.plusMillis(10), "MediaException: boom");
        assertThat(job.error()).contains("MediaException: boom");
    }

    @Test
    void shouldRejectIllegalTransitions() {
        Job job = newJob();

        assertThatThrownBy(() -> job.transition(JobStatus.SUCCEEDED, T0, null))
                .isInstanceOf(InvalidStateException.class);

        job.transition(JobStatus.CANCELLED, T0, null);
        assertThatThrownBy(() -> job.transition(JobStatus.RUNNING, T0, null))
                .isInstanceOf(InvalidStateException.class);
        assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.duration()).isEmpty();
    }

    @Test
    void shouldNotCancelRunningJob() {
        Job job = newJob();
        job.transition(JobStatus.RUNNING, T0, null);

        assertThatThrownBy(() -> job.transition(JobStatus.CANCELLED, T0, null))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void shouldClampProgress() {
        Job job = newJob();

        job.updateProgress(1.7);
        assertThat(job.progress()).isEqualTo(1.0);
        job.updateProgress(-0.2);
        assertThat(job.progress()).isEqualTo(0.0);
    }
}
