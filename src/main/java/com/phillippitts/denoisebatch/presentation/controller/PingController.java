package com.phillippitts.denoisebatch.presentation.controller;

import com.phillippitts.denoisebatch.service.batch.BatchScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight liveness endpoint that also traverses the MDC filter.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final BatchScheduler scheduler;

    PingController(BatchScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/api/ping")
    ResponseEntity<Map<String, Object>> ping() {
        log.info("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "activeRun", scheduler.activeRun().map(r -> (Object) r.id()).orElse(false),
                "timestamp", Instant.now().toString()
        ));
    }
}
