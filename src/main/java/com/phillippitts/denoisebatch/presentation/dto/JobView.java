package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record JobView(
        UUID id,
        String inputPath,
        String outputPath,
        String engine,
        JobStatus status,
        double progress,
        Instant startedAt,
        Instant finishedAt,
        Long durationMillis,
        String error
) {

    public static JobView of(Job job) {
        return new JobView(
                job.id(),
                job.inputPath().toString(),
                job.outputPath().toString(),
                job.engineConfig().kind().id(),
                job.status(),
                job.progress(),
                job.startedAt().orElse(null),
                job.finishedAt().orElse(null),
                job.duration().map(Duration::toMillis).orElse(null),
                job.error().orElse(null));
    }
}
