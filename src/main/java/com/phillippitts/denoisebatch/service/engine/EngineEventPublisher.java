package com.phillippitts.denoisebatch.service.engine;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-safe publishing of {@link EngineFailureEvent}s, so engines built outside a Spring
 * context (tests, previews) work without a publisher.
 */
public final class EngineEventPublisher {

    private EngineEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new EngineFailureEvent(engineName, Instant.now(), message, cause, context));
        }
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, engineName, message, cause, null);
    }
}
