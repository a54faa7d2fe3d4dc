package com.phillippitts.denoisebatch.service.engine;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an engine fails to initialize, prepare or process.
 *
 * <p>Context holds technical diagnostics only (kind, stage, sample rate), never file contents.
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
