package com.phillippitts.denoisebatch.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldTruncateNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1_000L);
        assertThat(elapsedMs).isLessThan(1_500L);
    }

    @Test
    void shouldFormatSecondsOnly() {
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(42))).isEqualTo("42s");
        assertThat(TimeUtils.formatDuration(Duration.ofMillis(999))).isEqualTo("0s");
    }

    @Test
    void shouldFormatMinutesAndHours() {
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(185))).isEqualTo("3m 05s");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(3723))).isEqualTo("1h 02m 03s");
    }

    @Test
    void shouldRenderNullAsUnknownAndClampNegative() {
        assertThat(TimeUtils.formatDuration(null)).isEqualTo("unknown");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(-5))).isEqualTo("0s");
    }
}
