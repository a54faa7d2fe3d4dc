package com.phillippitts.denoisebatch.presentation.controller;

import com.phillippitts.denoisebatch.domain.EngineConfig;
import com.phillippitts.denoisebatch.domain.PreviewRequest;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.presentation.dto.PreviewRequestBody;
import com.phillippitts.denoisebatch.presentation.dto.PreviewView;
import com.phillippitts.denoisebatch.service.preview.PreviewService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
class PreviewController {

    private final PreviewService previewService;

    PreviewController(PreviewService previewService) {
        this.previewService = previewService;
    }

    @PostMapping("/api/preview")
    PreviewView preview(@Valid @RequestBody PreviewRequestBody body) {
        EngineConfig config = body.engine() != null ? body.engine().toConfig() : SpectralGateConfig.defaults();
        double offset = body.offsetSeconds() != null ? body.offsetSeconds() : 0.0;
        double duration = body.durationSeconds() != null
                ? body.durationSeconds()
                : previewService.properties().defaultDurationSeconds();
        return PreviewView.of(previewService.preview(new PreviewRequest(Path.of(body.inputPath()), offset,
                duration, config)));
    }
}
