package com.phillippitts.denoisebatch.presentation.controller;

import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.Job;
import com.phillippitts.denoisebatch.domain.OutputOptions;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.presentation.dto.EnqueueRequest;
import com.phillippitts.denoisebatch.presentation.dto.JobView;
import com.phillippitts.denoisebatch.presentation.dto.SessionRequest;
import com.phillippitts.denoisebatch.presentation.dto.StatsView;
import com.phillippitts.denoisebatch.service.batch.BatchRun;
import com.phillippitts.denoisebatch.service.batch.BatchSession;
import com.phillippitts.denoisebatch.service.batch.BatchSessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Thin REST driver over the batch session service.
 */
@RestController
@RequestMapping("/api/batch")
class BatchController {

    private final BatchSessionService sessions;

    BatchController(BatchSessionService sessions) {
        this.sessions = sessions;
    }

    @PostMapping("/session")
    ResponseEntity<Map<String, Object>> newSession(@RequestBody(required = false) SessionRequest request) {
        BatchSession current = sessions.currentSession();
        BatchSession created = sessions.newSession(request == null
                ? null
                : request.toOptions(current.options()));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "sessionId", created.id(),
                "parallelism", created.options().parallelism(),
                "continueOnError", created.options().continueOnError(),
                "autoClearCompleted", created.options().autoClearCompleted()));
    }

    @PostMapping("/jobs")
    ResponseEntity<JobView> enqueue(@Valid @RequestBody EnqueueRequest request) {
        EngineConfig config = request.engine() != null ? request.engine().toConfig() : SpectralGateConfig.defaults();
        OutputOptions options = request.output() != null ? request.output().toOptions() : OutputOptions.defaults();
        Job job = sessions.enqueue(Path.of(request.inputPath()), config, options);
        return ResponseEntity.status(HttpStatus.CREATED).body(JobView.of(job));
    }

    @GetMapping("/jobs")
    List<JobView> jobs() {
        return sessions.jobs().stream().map(JobView::of).toList();
    }

    @GetMapping("/jobs/{id}")
    ResponseEntity<JobView> job(@PathVariable UUID id) {
        return sessions.job(id)
                .map(j -> ResponseEntity.ok(JobView.of(j)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/stats")
    StatsView stats() {
        return StatsView.of(sessions.currentSession().id(), sessions.isRunning(), sessions.stats());
    }

    @PostMapping("/start")
    ResponseEntity<Map<String, Object>> start() {
        BatchRun run = sessions.start();
        return ResponseEntity.accepted().body(Map.of("runId", run.id(), "workers", run.workers()));
    }

    @PostMapping("/pause")
    ResponseEntity<Void> pause() {
        sessions.pause();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/resume")
    ResponseEntity<Void> resume() {
        sessions.resume();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/stop")
    Map<String, Object> stop() {
        List<Job> cancelled = sessions.stop();
        return Map.of("cancelled", cancelled.size());
    }

    @PostMapping("/clear-completed")
    Map<String, Object> clearCompleted() {
        return Map.of("removed", sessions.clearCompleted());
    }
}
