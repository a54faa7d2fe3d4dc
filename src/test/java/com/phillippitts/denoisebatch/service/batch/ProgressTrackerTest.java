package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;
import com.phillippitts.denoisebatch.domain.OutputOptions;
import com.phillippitts.denoisebatch.domain.ProcessingStats;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.exception.InvalidStateException;
import com.phillippitts.denoisebatch.service.batch.event.JobStatusChangedEvent;
import com.phillippitts.denoisebatch.testutil.EventCapturingPublisher;
import com.phillippitts.denoisebatch.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProgressTrackerTest {

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private ProgressTracker tracker;
    private JobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        publisher = new EventCapturingPublisher();
        tracker = new ProgressTracker("sess0001", clock, publisher);
        queue = new JobQueue(tracker);
    }

    private List<Job> enqueue(int count) {
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Job job = Job.create(Path.of("/in/f" + i + ".wav"), SpectralGateConfig.defaults(),
                    OutputOptions.defaults(), Path.of("/in/clean/f" + i + "_clean.wav"));
            queue.enqueue(job);
            jobs.add(job);
        }
        return jobs;
    }

    private static void assertCountsAddUp(ProcessingStats s) {
        assertThat(s.queued() + s.running() + s.succeeded() + s.failed() + s.cancelled()).isEqualTo(s.total());
    }

    @Test
    void shouldHaveNoEtaBeforeFirstCompletion() {
        enqueue(3);
        tracker.markRunStarted();
        queue.dequeueNext();

        ProcessingStats stats = tracker.snapshot();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.running()).isEqualTo(1);
        assertThat(stats.queued()).isEqualTo(2);
        assertThat(stats.eta()).isEmpty();
        assertThat(stats.meanDuration()).isEmpty();
        assertCountsAddUp(stats);
    }

    @Test
    void shouldEstimateRemainingFromMeanOfCompletedJobs() {
        enqueue(4);
        tracker.markRunStarted();
        Job first = queue.dequeueNext().orElseThrow();
        clock.advance(Duration.ofSeconds(2));
        tracker.transition(first, JobStatus.SUCCEEDED, null);

        Job second = queue.dequeueNext().orElseThrow();
        clock.advance(Duration.ofSeconds(4));
        tracker.transition(second, JobStatus.FAILED, "MediaException: broken");

        ProcessingStats stats = tracker.snapshot();

        assertThat(stats.succeeded()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.queued()).isEqualTo(2);
        assertThat(stats.meanDuration()).contains(Duration.ofSeconds(3));
        assertThat(stats.eta()).contains(Duration.ofSeconds(6));
        assertThat(stats.elapsed()).isEqualTo(Duration.ofSeconds(6));
        assertThat(stats.throughputPerMinute()).isCloseTo(20.0, within(1e-9));
        assertCountsAddUp(stats);
    }

    @Test
    void shouldExcludeCancelledJobsFromMean() {
        enqueue(3);
        tracker.markRunStarted();
        Job first = queue.dequeueNext().orElseThrow();
        clock.advance(Duration.ofSeconds(5));
        tracker.transition(first, JobStatus.SUCCEEDED, null);
        queue.cancelPending();

        ProcessingStats stats = tracker.snapshot();

        assertThat(stats.cancelled()).isEqualTo(2);
        assertThat(stats.meanDuration()).contains(Duration.ofSeconds(5));
        assertThat(stats.eta()).contains(Duration.ZERO);
        assertThat(stats.isFinished()).isTrue();
        assertCountsAddUp(stats);
    }

    @Test
    void clearedJobsShouldKeepContributingToStats() {
        enqueue(2);
        tracker.markRunStarted();
        Job first = queue.dequeueNext().orElseThrow();
        clock.advance(Duration.ofSeconds(2));
        tracker.transition(first, JobStatus.SUCCEEDED, null);

        int removed = queue.removeTerminal(JobStatus.SUCCEEDED);
        ProcessingStats stats = tracker.snapshot();

        assertThat(removed).isEqualTo(1);
        assertThat(queue.snapshot()).hasSize(1);
        assertThat(stats.total()).isEqualTo(2);
        assertThat(stats.succeeded()).isEqualTo(1);
        assertThat(stats.eta()).contains(Duration.ofSeconds(2));
    }

    @Test
    void elapsedShouldFreezeWhenRunFinishes() {
        enqueue(1);
        tracker.markRunStarted();
        clock.advance(Duration.ofSeconds(10));
        tracker.markRunFinished();
        clock.advance(Duration.ofMinutes(5));

        assertThat(tracker.snapshot().elapsed()).isEqualTo(Duration.ofSeconds(10));
        assertThat(tracker.isRunActive()).isFalse();
    }

    @Test
    void shouldPublishStatusChangeEventsWithDurationForCompletedJobs() {
        enqueue(1);
        tracker.markRunStarted();
        Job job = queue.dequeueNext().orElseThrow();
        clock.advance(Duration.ofMillis(1500));
        tracker.transition(job, JobStatus.SUCCEEDED, null);

        List<JobStatusChangedEvent> events = publisher.eventsOf(JobStatusChangedEvent.class);

        assertThat(events).hasSize(2);
        assertThat(events.get(0).from()).isEqualTo(JobStatus.QUEUED);
        assertThat(events.get(0).to()).isEqualTo(JobStatus.RUNNING);
        assertThat(events.get(0).duration()).isNull();
        assertThat(events.get(1).to()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(events.get(1).duration()).isEqualTo(Duration.ofMillis(1500));
        assertThat(events.get(1).sessionId()).isEqualTo("sess0001");
        assertThat(events.get(1).inputName()).isEqualTo("f0.wav");
        assertThat(events.get(1).engine()).isEqualTo("spectral_gate");
    }

    @Test
    void rejectedTransitionShouldLeaveCountsUntouched() {
        List<Job> jobs = enqueue(1);

        assertThatThrownBy(() -> tracker.transition(jobs.get(0), JobStatus.SUCCEEDED, null))
                .isInstanceOf(InvalidStateException.class);

        ProcessingStats stats = tracker.snapshot();
        assertThat(stats.queued()).isEqualTo(1);
        assertThat(stats.succeeded()).isZero();
        assertThat(publisher.eventsOf(JobStatusChangedEvent.class)).isEmpty();
    }
}
