package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.ProcessingStats;

import java.time.Duration;

public record StatsView(
        String sessionId,
        boolean activeRun,
        int total,
        int queued,
        int running,
        int succeeded,
        int failed,
        int cancelled,
        long elapsedMillis,
        Long meanJobMillis,
        Long etaMillis,
        double throughputPerMinute,
        double successRate
) {

    public static StatsView of(String sessionId, boolean activeRun, ProcessingStats s) {
        return new StatsView(sessionId, activeRun, s.total(), s.queued(), s.running(), s.succeeded(), s.failed(),
                s.cancelled(), s.elapsed().toMillis(),
                s.meanDuration().map(Duration::toMillis).orElse(null),
                s.eta().map(Duration::toMillis).orElse(null),
                s.throughputPerMinute(), s.successRate());
    }
}
