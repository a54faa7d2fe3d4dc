package com.phillippitts.denoisebatch.service.process;

import com.phillippitts.denoisebatch.exception.ToolFailureExceptionBuilder;
import com.phillippitts.denoisebatch.util.LogSanitizer;

import java.time.Duration;

/**
 * Outcome of a completed or killed external tool run.
 *
 * @param exitCode process exit code, -1 when the process was killed on timeout
 * @param stdout captured stdout (capped)
 * @param stderr captured stderr (capped)
 * @param durationMs wall time of the run
 * @param timedOut true if the process exceeded its timeout and was destroyed
 * @param timeout the timeout that applied
 */
public record ProcessResult(
        int exitCode,
        String stdout,
        String stderr,
        long durationMs,
        boolean timedOut,
        Duration timeout
) {

    static final int ERROR_SNIPPET_MAX_CHARS = 800;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Starts an exception builder describing why this run failed.
     *
     * @param tool tool name for the message
     * @return builder pre-filled with exit code, duration and a stderr snippet
     */
    public ToolFailureExceptionBuilder describeFailure(String tool) {
        String message = timedOut
                ? "Timeout after " + timeout.toSeconds() + "s"
                : "Non-zero exit: " + exitCode;
        return ToolFailureExceptionBuilder.create(message)
                .tool(tool)
                .exitCode(exitCode)
                .durationMs(durationMs)
                .metadata("stderr", LogSanitizer.truncate(stderr, ERROR_SNIPPET_MAX_CHARS));
    }
}
