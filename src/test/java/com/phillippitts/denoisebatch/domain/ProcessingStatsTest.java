package com.phillippitts.denoisebatch.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingStatsTest {

    @Test
    void emptyStatsShouldHaveNoEta() {
        ProcessingStats stats = ProcessingStats.empty();

        assertThat(stats.eta()).isEmpty();
        assertThat(stats.meanDuration()).isEmpty();
        assertThat(stats.successRate()).isZero();
        assertThat(stats.isFinished()).isTrue();
    }

    @Test
    void shouldDeriveCompletedRemainingAndSuccessRate() {
        ProcessingStats stats = new ProcessingStats(10, 3, 2, 3, 1, 1, Duration.ofMinutes(2),
                Duration.ofSeconds(4), Duration.ofSeconds(20), 2.0);

        assertThat(stats.completed()).isEqualTo(4);
        assertThat(stats.remaining()).isEqualTo(5);
        assertThat(stats.successRate()).isEqualTo(75.0);
        assertThat(stats.eta()).contains(Duration.ofSeconds(20));
        assertThat(stats.isFinished()).isFalse();
    }
}
