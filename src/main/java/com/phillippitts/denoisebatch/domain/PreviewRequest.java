package com.phillippitts.denoisebatch.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A bounded before/after comparison request. Never becomes a {@link Job}.
 *
 * @param file media file to sample
 * @param offsetSeconds start of the window
 * @param durationSeconds requested window length; clamped to what the file has left
 * @param engineConfig engine to preview
 */
public record PreviewRequest(Path file, double offsetSeconds, double durationSeconds, EngineConfig engineConfig) {

    public PreviewRequest {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(engineConfig, "engineConfig");
    }
}
