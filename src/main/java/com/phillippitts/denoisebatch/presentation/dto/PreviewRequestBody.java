package com.phillippitts.denoisebatch.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/preview}. A missing duration uses {@code preview.default-duration-seconds}.
 */
public record PreviewRequestBody(
        @NotBlank(message = "inputPath is required") String inputPath,
        Double offsetSeconds,
        Double durationSeconds,
        EngineConfigRequest engine
) {
}
