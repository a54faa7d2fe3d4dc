package com.phillippitts.denoisebatch.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/batch/jobs}.
 */
public record EnqueueRequest(
        @NotBlank(message = "inputPath is required") String inputPath,
        @Valid EngineConfigRequest engine,
        @Valid OutputOptionsRequest output
) {
}
